package io.seatwatch.model;

import java.time.Instant;

public record FailureRecord(long count, Instant lastFailure) {
}
