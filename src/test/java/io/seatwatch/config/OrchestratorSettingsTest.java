package io.seatwatch.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class OrchestratorSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("seatwatch-test-settings-");
        try {
            OrchestratorSettings settings = OrchestratorSettings.load(root.resolve("seatwatch-settings.json"));

            Assertions.assertEquals(OrchestratorSettings.defaults(), settings);
            Assertions.assertEquals(3, settings.maxAttempts());
            Assertions.assertEquals(1_000L, settings.baseBackoffMs());
            Assertions.assertEquals(60_000L, settings.maxBackoffMs());
            Assertions.assertEquals(480L, settings.sessionRefreshIntervalSec());
            Assertions.assertEquals(3, settings.failureNotifyDailyLimit());
            Assertions.assertFalse(settings.resumeActiveOnStartup());
            Assertions.assertEquals("smtp.gmail.com", settings.smtpHost());
            Assertions.assertEquals(587, settings.smtpPort());
        } finally {
            Files.deleteIfExists(root);
        }
    }

    @Test
    void fileValuesOverrideAndInvalidOnesFallBack() throws Exception {
        Path root = Files.createTempDirectory("seatwatch-test-settings-");
        Path file = root.resolve("seatwatch-settings.json");
        try {
            Files.writeString(file, """
                    {
                      "maxAttempts": 5,
                      "baseBackoffMs": 0,
                      "maxBackoffMs": 500,
                      "sessionRefreshIntervalSec": 120,
                      "failureNotifyDailyLimit": -1,
                      "resumeActiveOnStartup": true,
                      "smtpHost": " mail.example.edu ",
                      "smtpPort": 70000,
                      "mailTimeoutMs": 2500,
                      "somethingElse": "ignored"
                    }
                    """, StandardCharsets.UTF_8);

            OrchestratorSettings settings = OrchestratorSettings.load(file);

            Assertions.assertEquals(5, settings.maxAttempts());
            Assertions.assertEquals(1_000L, settings.baseBackoffMs());
            Assertions.assertEquals(60_000L, settings.maxBackoffMs());
            Assertions.assertEquals(120L, settings.sessionRefreshIntervalSec());
            Assertions.assertEquals(3, settings.failureNotifyDailyLimit());
            Assertions.assertTrue(settings.resumeActiveOnStartup());
            Assertions.assertEquals("mail.example.edu", settings.smtpHost());
            Assertions.assertEquals(587, settings.smtpPort());
            Assertions.assertEquals(2_500L, settings.mailTimeoutMs());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(root);
        }
    }

    @Test
    void malformedFileIsAConfigError() throws Exception {
        Path root = Files.createTempDirectory("seatwatch-test-settings-");
        Path file = root.resolve("seatwatch-settings.json");
        try {
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

            Assertions.assertThrows(ConfigException.class, () -> OrchestratorSettings.load(file));
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(root);
        }
    }

    @Test
    void rootLayout() {
        SeatWatchConfig config = SeatWatchConfig.fromRoot("/tmp/seatwatch-layout");

        Assertions.assertTrue(config.dbFile().endsWith("seatwatch.db"));
        Assertions.assertTrue(config.auditFile().endsWith(Path.of("audit", "audit.log")));
        Assertions.assertTrue(config.encryptionKeyFile().endsWith(Path.of("security", "encryption.key")));
        Assertions.assertTrue(SeatWatchConfig.fromRoot(null).rootDir().endsWith("data"));
    }
}
