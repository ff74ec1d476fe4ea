package io.seatwatch.model;

import java.util.List;

public record NotificationProfile(
        String ownerId,
        String senderAddress,
        String mailPassword,
        List<String> emailRecipients,
        String webhookUrl
) {
    public NotificationProfile {
        emailRecipients = emailRecipients == null ? List.of() : List.copyOf(emailRecipients);
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public boolean hasEmail() {
        return senderAddress != null && !senderAddress.isBlank() && !emailRecipients.isEmpty();
    }

    @Override
    public String toString() {
        return "NotificationProfile[ownerId=" + ownerId + ", recipients=" + emailRecipients.size()
                + ", webhook=" + hasWebhook() + "]";
    }
}
