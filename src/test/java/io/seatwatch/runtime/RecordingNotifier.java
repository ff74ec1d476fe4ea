package io.seatwatch.runtime;

import io.seatwatch.notify.Notifier;

import java.util.ArrayList;
import java.util.List;

final class RecordingNotifier implements Notifier {
    private final List<String> messages = new ArrayList<>();

    @Override
    public synchronized void notify(String message) {
        messages.add(message);
    }

    synchronized List<String> messages() {
        return List.copyOf(messages);
    }

    synchronized long countStartingWith(String prefix) {
        return messages.stream().filter(m -> m.startsWith(prefix)).count();
    }
}
