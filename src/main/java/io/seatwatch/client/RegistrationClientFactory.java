package io.seatwatch.client;

@FunctionalInterface
public interface RegistrationClientFactory {
    RegistrationClient open(String credential);
}
