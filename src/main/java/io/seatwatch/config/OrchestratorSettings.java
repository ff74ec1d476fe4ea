package io.seatwatch.config;

import io.seatwatch.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record OrchestratorSettings(
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long sessionRefreshIntervalSec,
        int failureNotifyDailyLimit,
        int minPollingIntervalSec,
        long webhookTimeoutMs,
        boolean resumeActiveOnStartup,
        String smtpHost,
        int smtpPort,
        long mailTimeoutMs
) {
    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(
                SeatWatchConfig.DEFAULT_MAX_ATTEMPTS,
                SeatWatchConfig.DEFAULT_BASE_BACKOFF_MS,
                SeatWatchConfig.DEFAULT_MAX_BACKOFF_MS,
                SeatWatchConfig.DEFAULT_SESSION_REFRESH_INTERVAL_SEC,
                SeatWatchConfig.DEFAULT_FAILURE_NOTIFY_DAILY_LIMIT,
                SeatWatchConfig.DEFAULT_MIN_POLLING_INTERVAL_SEC,
                SeatWatchConfig.DEFAULT_WEBHOOK_TIMEOUT_MS,
                false,
                SeatWatchConfig.DEFAULT_SMTP_HOST,
                SeatWatchConfig.DEFAULT_SMTP_PORT,
                SeatWatchConfig.DEFAULT_MAIL_TIMEOUT_MS
        );
    }

    public static OrchestratorSettings load(Path file) {
        OrchestratorSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        SettingsFile raw;
        try {
            raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new ConfigException("Failed to parse settings file: " + file, e);
        }
        return fromFile(raw, defaults);
    }

    static OrchestratorSettings fromFile(SettingsFile file, OrchestratorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxAttempts = sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        long refresh = sanitizeLong(file.sessionRefreshIntervalSec(), defaults.sessionRefreshIntervalSec(), 1L);
        int notifyLimit = sanitizeInt(file.failureNotifyDailyLimit(), defaults.failureNotifyDailyLimit(), 1);
        int minPolling = sanitizeInt(file.minPollingIntervalSec(), defaults.minPollingIntervalSec(), 1);
        long webhookTimeout = sanitizeLong(file.webhookTimeoutMs(), defaults.webhookTimeoutMs(), 100L);
        boolean resume = file.resumeActiveOnStartup() == null
                ? defaults.resumeActiveOnStartup()
                : file.resumeActiveOnStartup();
        String smtpHost = file.smtpHost() == null || file.smtpHost().isBlank()
                ? defaults.smtpHost()
                : file.smtpHost().trim();
        int smtpPort = sanitizeInt(file.smtpPort(), defaults.smtpPort(), 1);
        if (smtpPort > 65_535) {
            smtpPort = defaults.smtpPort();
        }
        long mailTimeout = sanitizeLong(file.mailTimeoutMs(), defaults.mailTimeoutMs(), 100L);
        return new OrchestratorSettings(
                maxAttempts,
                baseBackoff,
                maxBackoff,
                refresh,
                notifyLimit,
                minPolling,
                webhookTimeout,
                resume,
                smtpHost,
                smtpPort,
                mailTimeout
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    record SettingsFile(
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long sessionRefreshIntervalSec,
            Integer failureNotifyDailyLimit,
            Integer minPollingIntervalSec,
            Long webhookTimeoutMs,
            Boolean resumeActiveOnStartup,
            String smtpHost,
            Integer smtpPort,
            Long mailTimeoutMs
    ) {
    }
}
