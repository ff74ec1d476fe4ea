package io.seatwatch.model;

import java.time.Instant;

public record JobStatusInfo(
        boolean running,
        boolean connected,
        String state,
        Instant lastCheckTime,
        JobStats stats
) {
}
