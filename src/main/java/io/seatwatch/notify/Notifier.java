package io.seatwatch.notify;

@FunctionalInterface
public interface Notifier {
    void notify(String message);
}
