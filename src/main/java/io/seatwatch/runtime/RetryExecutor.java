package io.seatwatch.runtime;

import io.seatwatch.client.TransientClientException;
import io.seatwatch.config.OrchestratorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Runs a collaborator call up to {@code maxAttempts} times. Only
 * {@link TransientClientException} is retried; the last one propagates. A cancelled backoff
 * ends with {@link RetryCancelledException} instead.
 */
public final class RetryExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);
    private static final long MAX_JITTER_MS = 250L;

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryExecutor(int maxAttempts, long baseBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = Math.max(1L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
    }

    public static RetryExecutor fromSettings(OrchestratorSettings settings, Sleeper sleeper) {
        return new RetryExecutor(settings.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs(), sleeper);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (TransientClientException e) {
                if (attempt >= maxAttempts) {
                    LOG.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delay = computeBackoffMs(attempt);
                LOG.debug("{} failed on attempt {}/{}, retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                if (!sleeper.sleep(delay)) {
                    throw new RetryCancelledException(operation, e);
                }
                attempt++;
            }
        }
    }

    long computeBackoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, MAX_JITTER_MS + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    @FunctionalInterface
    public interface Sleeper {
        boolean sleep(long millis);

        static Sleeper cancellable(CancellationToken token) {
            return millis -> !token.await(Duration.ofMillis(millis));
        }
    }
}
