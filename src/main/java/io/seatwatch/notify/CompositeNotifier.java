package io.seatwatch.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class CompositeNotifier implements Notifier {
    private static final Logger LOG = LoggerFactory.getLogger(CompositeNotifier.class);

    private final List<Notifier> channels;

    public CompositeNotifier(List<Notifier> channels) {
        this.channels = List.copyOf(channels);
    }

    @Override
    public void notify(String message) {
        for (Notifier channel : channels) {
            try {
                channel.notify(message);
            } catch (RuntimeException e) {
                LOG.error("Notification channel {} failed: {}", channel.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public int size() {
        return channels.size();
    }
}
