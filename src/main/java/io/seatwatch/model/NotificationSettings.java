package io.seatwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.seatwatch.security.SealedSecret;

import java.time.Instant;
import java.util.List;

public record NotificationSettings(
        String ownerId,
        String senderAddress,
        @JsonIgnore SealedSecret mailCredential,
        List<String> emailRecipients,
        String webhookUrl,
        Instant updatedAt
) {
    public NotificationSettings {
        emailRecipients = emailRecipients == null ? List.of() : List.copyOf(emailRecipients);
    }

    public static NotificationSettings empty(String ownerId) {
        return new NotificationSettings(ownerId, null, null, List.of(), null, null);
    }
}
