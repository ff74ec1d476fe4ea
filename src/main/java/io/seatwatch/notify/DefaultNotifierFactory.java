package io.seatwatch.notify;

import io.seatwatch.model.NotificationProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class DefaultNotifierFactory implements NotifierFactory {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultNotifierFactory.class);

    private final Duration webhookTimeout;
    private final NotifierFactory mailFactory;

    public DefaultNotifierFactory(Duration webhookTimeout, NotifierFactory mailFactory) {
        this.webhookTimeout = webhookTimeout;
        this.mailFactory = mailFactory;
    }

    public DefaultNotifierFactory(Duration webhookTimeout) {
        this(webhookTimeout, null);
    }

    @Override
    public Notifier create(NotificationProfile profile) {
        List<Notifier> channels = new ArrayList<>();
        channels.add(new LoggingNotifier(profile.ownerId()));
        if (profile.hasWebhook()) {
            channels.add(new WebhookNotifier(profile.webhookUrl(), webhookTimeout));
        }
        if (profile.hasEmail()) {
            if (mailFactory != null) {
                channels.add(mailFactory.create(profile));
            } else {
                LOG.warn("Owner {} has {} email recipient(s) but no mail transport is configured",
                        profile.ownerId(), profile.emailRecipients().size());
            }
        }
        return new CompositeNotifier(channels);
    }
}
