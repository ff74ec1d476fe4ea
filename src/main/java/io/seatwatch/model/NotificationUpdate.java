package io.seatwatch.model;

import java.util.List;

public record NotificationUpdate(
        String senderAddress,
        String mailPassword,
        List<String> emailRecipients,
        String webhookUrl
) {
    public NotificationUpdate {
        emailRecipients = emailRecipients == null ? List.of() : List.copyOf(emailRecipients);
    }
}
