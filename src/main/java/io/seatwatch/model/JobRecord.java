package io.seatwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.seatwatch.security.SealedSecret;

import java.time.Instant;

public record JobRecord(
        String id,
        String ownerId,
        String term,
        int pollingIntervalSec,
        int seatThreshold,
        MonitoringMode monitoringMode,
        @JsonIgnore SealedSecret credential,
        boolean active,
        boolean connected,
        Instant lastCheckTime,
        Instant createdAt,
        Instant updatedAt
) {
}
