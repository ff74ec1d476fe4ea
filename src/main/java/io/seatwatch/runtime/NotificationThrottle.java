package io.seatwatch.runtime;

import io.seatwatch.model.FailureRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

public final class NotificationThrottle {
    private final int dailyLimit;
    private final ZoneId zone;

    public NotificationThrottle(int dailyLimit, ZoneId zone) {
        if (dailyLimit < 1) {
            throw new IllegalArgumentException("dailyLimit must be >= 1");
        }
        this.dailyLimit = dailyLimit;
        this.zone = zone;
    }

    public NotificationThrottle(int dailyLimit) {
        this(dailyLimit, ZoneId.systemDefault());
    }

    public boolean shouldNotify(Map<String, FailureRecord> tracker, String targetKey, Instant now) {
        FailureRecord existing = tracker.get(targetKey);
        if (existing == null || isBeforeToday(existing.lastFailure(), now)) {
            tracker.put(targetKey, new FailureRecord(1L, now));
            return true;
        }
        if (existing.count() >= dailyLimit) {
            return false;
        }
        tracker.put(targetKey, new FailureRecord(existing.count() + 1L, now));
        return true;
    }

    public void clear(Map<String, FailureRecord> tracker, String targetKey) {
        tracker.remove(targetKey);
    }

    private boolean isBeforeToday(Instant lastFailure, Instant now) {
        if (lastFailure == null) {
            return true;
        }
        LocalDate last = lastFailure.atZone(zone).toLocalDate();
        LocalDate today = now.atZone(zone).toLocalDate();
        return last.isBefore(today);
    }
}
