package io.seatwatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.seatwatch.config.SeatWatchConfig;
import io.seatwatch.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.stream.Stream;

final class SeatWatchCommandTest {
    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        Assumptions.assumeTrue(System.getenv(SeatWatchConfig.ENCRYPTION_KEY_ENV) == null);
        root = Files.createTempDirectory("seatwatch-test-cli-");
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void keygenPrintsA256BitKey() {
        Result result = run("keygen");

        Assertions.assertEquals(0, result.code());
        Assertions.assertEquals(32, Base64.getDecoder().decode(result.out().trim()).length);
    }

    @Test
    void jobLifecycleThroughCommands() throws Exception {
        Result init = run("--root", root.toString(), "init");
        Assertions.assertEquals(0, init.code(), init.err());
        Assertions.assertTrue(Jsons.mapper().readTree(init.out()).path("keyFileCreated").asBoolean());
        Assertions.assertTrue(Files.exists(root.resolve("security").resolve("encryption.key")));

        Path jobFile = root.resolve("job.json");
        Files.writeString(jobFile, """
                {"term": "FA26", "pollingIntervalSeconds": 30, "seatThreshold": 2, "monitoringMode": "exclude",
                 "credential": "cookie-abc",
                 "courses": [{"shape": "legacy", "department": "CSE", "courseCode": "100",
                              "lectureSection": "A00", "discussionSections": ["A01"]}]}
                """, StandardCharsets.UTF_8);
        Result create = run("--root", root.toString(), "create", "--owner", "owner-a", "--file", jobFile.toString());
        Assertions.assertEquals(0, create.code(), create.err());
        String jobId = Jsons.mapper().readTree(create.out()).path("jobId").asText();
        Assertions.assertFalse(jobId.isBlank());

        JsonNode jobs = Jsons.mapper().readTree(run("--root", root.toString(), "jobs", "--owner", "owner-a").out());
        Assertions.assertEquals(1, jobs.size());
        Assertions.assertFalse(jobs.get(0).has("credential"));
        Assertions.assertEquals(0, Jsons.mapper().readTree(
                run("--root", root.toString(), "jobs", "--owner", "owner-b").out()).size());

        Result show = run("--root", root.toString(), "show", "--owner", "owner-a", jobId);
        Assertions.assertEquals(0, show.code(), show.err());
        JsonNode detail = Jsons.mapper().readTree(show.out());
        Assertions.assertEquals(2, detail.path("targets").size());
        Assertions.assertFalse(detail.path("running").asBoolean());
        Assertions.assertFalse(show.out().contains("cookie-abc"));

        Assertions.assertEquals(SeatWatchCommand.EXIT_NOT_FOUND,
                run("--root", root.toString(), "show", "--owner", "owner-b", jobId).code());

        Result delete = run("--root", root.toString(), "delete", "--owner", "owner-a", jobId);
        Assertions.assertEquals(0, delete.code(), delete.err());
        Result missing = run("--root", root.toString(), "delete", "--owner", "owner-a", jobId);
        Assertions.assertEquals(SeatWatchCommand.EXIT_NOT_FOUND, missing.code());
        Assertions.assertTrue(missing.err().contains("Job not found"));

        Result verify = run("--root", root.toString(), "audit-verify");
        Assertions.assertEquals(0, verify.code(), verify.out());
    }

    @Test
    void notificationSettingsCommandShowsAndUpdates() throws Exception {
        Assertions.assertEquals(0, run("--root", root.toString(), "init").code());

        Result update = run("--root", root.toString(), "notifications", "--owner", "owner-a",
                "--sender", "alerts@example.com", "--mail-password", "app-pw",
                "--recipient", "a@example.com", "--recipient", "b@example.com");
        Assertions.assertEquals(0, update.code(), update.err());
        Assertions.assertFalse(update.out().contains("app-pw"));

        JsonNode shown = Jsons.mapper().readTree(run("--root", root.toString(), "notifications", "--owner", "owner-a").out());
        Assertions.assertEquals(2, shown.path("emailRecipients").size());
        Assertions.assertTrue(shown.path("mailCredentialConfigured").asBoolean());
    }

    @Test
    void reconcileDeactivatesJobsLeftActive() throws Exception {
        Assertions.assertEquals(0, run("--root", root.toString(), "init").code());

        JsonNode outcome = Jsons.mapper().readTree(run("--root", root.toString(), "reconcile").out());

        Assertions.assertEquals(0, outcome.path("resumed").size());
        Assertions.assertEquals(0, outcome.path("deactivated").size());
    }

    @Test
    void missingKeyIsReported() {
        Result result = run("--root", root.toString(), "jobs", "--owner", "owner-a");

        Assertions.assertEquals(1, result.code());
        Assertions.assertTrue(result.err().contains(SeatWatchConfig.ENCRYPTION_KEY_ENV));
    }

    private static Result run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cli = SeatWatchCommand.commandLine();
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        int code = cli.execute(args);
        return new Result(code, out.toString(), err.toString());
    }

    private record Result(int code, String out, String err) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> paths = new ArrayList<>(walk.toList());
            paths.sort((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount()));
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }
}
