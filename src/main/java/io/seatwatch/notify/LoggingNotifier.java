package io.seatwatch.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotifier implements Notifier {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotifier.class);

    private final String ownerId;

    public LoggingNotifier(String ownerId) {
        this.ownerId = ownerId;
    }

    @Override
    public void notify(String message) {
        LOG.info("Notification for owner {}: {}", ownerId, message);
    }
}
