package io.seatwatch.runtime;

public enum CycleOutcome {
    NO_CHANGE,
    FULL,
    FALSE_POSITIVE,
    ENROLLED,
    ENROLL_FAILED,
    ENROLL_ERROR
}
