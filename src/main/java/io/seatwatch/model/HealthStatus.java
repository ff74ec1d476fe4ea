package io.seatwatch.model;

import java.time.Duration;
import java.time.Instant;

public record HealthStatus(
        String uptime,
        Instant lastCheckTime,
        boolean connected,
        long errorCount,
        double successRate,
        long totalChecks
) {
    public static String formatUptime(Duration duration) {
        long seconds = Math.max(0L, duration.getSeconds());
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m " + (seconds % 60) + "s";
    }
}
