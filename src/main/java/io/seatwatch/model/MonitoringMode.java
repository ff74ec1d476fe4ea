package io.seatwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum MonitoringMode {
    INCLUDE,
    EXCLUDE;

    public int effectiveThreshold(int requested) {
        return this == INCLUDE ? 0 : requested;
    }

    @JsonCreator
    public static MonitoringMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INCLUDE;
        }
        for (MonitoringMode value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown monitoring mode: " + raw);
    }
}
