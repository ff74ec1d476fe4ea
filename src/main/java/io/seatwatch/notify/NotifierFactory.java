package io.seatwatch.notify;

import io.seatwatch.model.NotificationProfile;

@FunctionalInterface
public interface NotifierFactory {
    Notifier create(NotificationProfile profile);
}
