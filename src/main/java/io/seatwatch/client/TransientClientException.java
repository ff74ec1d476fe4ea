package io.seatwatch.client;

public class TransientClientException extends RuntimeException {
    public TransientClientException(String message) {
        super(message);
    }

    public TransientClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
