package io.seatwatch.security;

public class SecretAuthenticationException extends RuntimeException {
    public SecretAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
