package io.seatwatch;

import io.seatwatch.client.RegistrationClientFactory;
import io.seatwatch.config.OrchestratorSettings;
import io.seatwatch.config.SeatWatchConfig;
import io.seatwatch.notify.DefaultNotifierFactory;
import io.seatwatch.notify.NotifierFactory;
import io.seatwatch.notify.SmtpNotifierFactory;
import io.seatwatch.observability.AuditLogger;
import io.seatwatch.runtime.JobRegistry;
import io.seatwatch.security.SecretCipher;
import io.seatwatch.storage.Database;
import io.seatwatch.storage.JobStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

public final class SeatWatchApp implements AutoCloseable {
    private final SeatWatchConfig config;
    private final AuditLogger auditLogger;
    private final JobRegistry registry;

    private SeatWatchApp(SeatWatchConfig config, AuditLogger auditLogger, JobRegistry registry) {
        this.config = config;
        this.auditLogger = auditLogger;
        this.registry = registry;
    }

    /**
     * Initializes the schema and loads the encryption key; fails fast with
     * {@link io.seatwatch.config.ConfigException} when the key is missing or malformed.
     *
     * @param mailFactory mail transport, or null for SMTP using the host and port in the settings
     */
    public static SeatWatchApp open(SeatWatchConfig config, RegistrationClientFactory clientFactory,
                                    NotifierFactory mailFactory) {
        OrchestratorSettings settings = OrchestratorSettings.load(config.settingsFile());
        Database database = new Database(config);
        database.init();
        SecretCipher cipher = SecretCipher.fromConfig(config);
        JobStore store = new JobStore(database);
        AuditLogger auditLogger = new AuditLogger(config.auditFile(), loadOrCreateAuditSigningSecret(config.auditSigningKeyFile()));
        NotifierFactory mail = mailFactory == null ? SmtpNotifierFactory.fromSettings(settings) : mailFactory;
        NotifierFactory notifiers = new DefaultNotifierFactory(Duration.ofMillis(settings.webhookTimeoutMs()), mail);
        JobRegistry registry = new JobRegistry(store, cipher, clientFactory, notifiers, settings, auditLogger, Clock.systemDefaultZone());
        return new SeatWatchApp(config, auditLogger, registry);
    }

    public SeatWatchConfig config() {
        return config;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public JobRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        registry.shutdown();
    }

    static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }
}
