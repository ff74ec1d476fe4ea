package io.seatwatch.runtime;

public class JobAlreadyRunningException extends RuntimeException {
    private final String jobId;

    public JobAlreadyRunningException(String jobId) {
        super("Job is already running: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
