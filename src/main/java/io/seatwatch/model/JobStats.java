package io.seatwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class JobStats {
    private long totalChecks;
    private long openingsFound;
    private long enrollmentAttempts;
    private long successfulEnrollments;
    private long errors;
    private Instant startTime;
    private Instant lastUpdated;
    private final Map<String, FailureRecord> sectionFailures;

    public JobStats(Instant startTime) {
        this(0L, 0L, 0L, 0L, 0L, startTime, startTime, new LinkedHashMap<>());
    }

    @JsonCreator
    public JobStats(
            @JsonProperty("totalChecks") long totalChecks,
            @JsonProperty("openingsFound") long openingsFound,
            @JsonProperty("enrollmentAttempts") long enrollmentAttempts,
            @JsonProperty("successfulEnrollments") long successfulEnrollments,
            @JsonProperty("errors") long errors,
            @JsonProperty("startTime") Instant startTime,
            @JsonProperty("lastUpdated") Instant lastUpdated,
            @JsonProperty("sectionFailures") Map<String, FailureRecord> sectionFailures
    ) {
        this.totalChecks = totalChecks;
        this.openingsFound = openingsFound;
        this.enrollmentAttempts = enrollmentAttempts;
        this.successfulEnrollments = successfulEnrollments;
        this.errors = errors;
        this.startTime = startTime;
        this.lastUpdated = lastUpdated;
        this.sectionFailures = sectionFailures == null ? new LinkedHashMap<>() : new LinkedHashMap<>(sectionFailures);
    }

    public JobStats copy() {
        return new JobStats(totalChecks, openingsFound, enrollmentAttempts, successfulEnrollments, errors,
                startTime, lastUpdated, sectionFailures);
    }

    public void recordCheck(Instant now) {
        totalChecks++;
        lastUpdated = now;
    }

    public void recordOpening() {
        openingsFound++;
    }

    public void recordAttempt() {
        enrollmentAttempts++;
    }

    public void recordSuccess() {
        successfulEnrollments++;
    }

    public void recordError() {
        errors++;
    }

    public long getTotalChecks() {
        return totalChecks;
    }

    public long getOpeningsFound() {
        return openingsFound;
    }

    public long getEnrollmentAttempts() {
        return enrollmentAttempts;
    }

    public long getSuccessfulEnrollments() {
        return successfulEnrollments;
    }

    public long getErrors() {
        return errors;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public Map<String, FailureRecord> getSectionFailures() {
        return sectionFailures;
    }
}
