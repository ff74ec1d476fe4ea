package io.seatwatch.runtime;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class CancellationToken {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0L;
    }

    /**
     * Waits up to {@code timeout} for cancellation. Returns true when cancelled. An interrupt is
     * treated as cancellation and the interrupt flag is restored.
     */
    public boolean await(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }
}
