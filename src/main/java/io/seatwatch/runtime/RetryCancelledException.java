package io.seatwatch.runtime;

public final class RetryCancelledException extends RuntimeException {
    public RetryCancelledException(String operation, Throwable cause) {
        super(operation + " cancelled during retry backoff", cause);
    }
}
