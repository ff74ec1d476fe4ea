package io.seatwatch.notify;

import io.seatwatch.config.OrchestratorSettings;
import io.seatwatch.model.NotificationProfile;

import java.time.Duration;

public final class SmtpNotifierFactory implements NotifierFactory {
    private final String host;
    private final int port;
    private final Duration timeout;

    public SmtpNotifierFactory(String host, int port, Duration timeout) {
        this.host = host;
        this.port = port;
        this.timeout = timeout;
    }

    public static SmtpNotifierFactory fromSettings(OrchestratorSettings settings) {
        return new SmtpNotifierFactory(settings.smtpHost(), settings.smtpPort(), Duration.ofMillis(settings.mailTimeoutMs()));
    }

    @Override
    public Notifier create(NotificationProfile profile) {
        return new MailNotifier(
                MailNotifier.smtpSession(host, port, timeout, profile.senderAddress(), profile.mailPassword()),
                profile.senderAddress(),
                profile.emailRecipients()
        );
    }
}
