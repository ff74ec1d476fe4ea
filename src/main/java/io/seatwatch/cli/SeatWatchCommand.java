package io.seatwatch.cli;

import io.seatwatch.SeatWatchApp;
import io.seatwatch.client.RegistrationClientFactory;
import io.seatwatch.config.ConfigException;
import io.seatwatch.config.SeatWatchConfig;
import io.seatwatch.model.JobDetail;
import io.seatwatch.model.JobRecord;
import io.seatwatch.model.JobSpec;
import io.seatwatch.model.NotificationSettings;
import io.seatwatch.model.NotificationUpdate;
import io.seatwatch.observability.AuditLogger;
import io.seatwatch.runtime.JobAlreadyRunningException;
import io.seatwatch.runtime.JobNotFoundException;
import io.seatwatch.runtime.ReconcileOutcome;
import io.seatwatch.security.SecretCipher;
import io.seatwatch.storage.Database;
import io.seatwatch.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "seatwatch",
        mixinStandardHelpOptions = true,
        description = "SeatWatch job orchestrator CLI",
        subcommands = {
                SeatWatchCommand.KeygenCommand.class,
                SeatWatchCommand.InitCommand.class,
                SeatWatchCommand.CreateCommand.class,
                SeatWatchCommand.JobsCommand.class,
                SeatWatchCommand.ShowCommand.class,
                SeatWatchCommand.DeleteCommand.class,
                SeatWatchCommand.NotificationsCommand.class,
                SeatWatchCommand.ReconcileCommand.class,
                SeatWatchCommand.AuditVerifyCommand.class
        }
)
public final class SeatWatchCommand implements Runnable {
    static final int EXIT_NOT_FOUND = 2;
    static final int EXIT_ALREADY_RUNNING = 3;

    private static final RegistrationClientFactory NO_CLIENT = credential -> {
        throw new IllegalStateException("No registration client is available in the CLI process");
    };

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        out().println("Use subcommands: keygen | init | create | jobs | show | delete | notifications | reconcile | audit-verify");
    }

    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new SeatWatchCommand());
        cli.setExecutionExceptionHandler(SeatWatchCommand::handleExecutionException);
        return cli;
    }

    SeatWatchConfig config() {
        return SeatWatchConfig.fromRoot(root);
    }

    SeatWatchApp app() {
        return SeatWatchApp.open(config(), NO_CLIENT, null);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void printJson(Object value) {
        PrintWriter out = out();
        out.println(Jsons.toJson(value));
        out.flush();
    }

    static int exitCodeFor(Exception e) {
        if (e instanceof JobNotFoundException) {
            return EXIT_NOT_FOUND;
        }
        if (e instanceof JobAlreadyRunningException) {
            return EXIT_ALREADY_RUNNING;
        }
        return 1;
    }

    private static int handleExecutionException(Exception e, CommandLine cli, CommandLine.ParseResult parseResult) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        if (e instanceof JobNotFoundException notFound) {
            error.put("jobId", notFound.jobId());
        } else if (e instanceof JobAlreadyRunningException running) {
            error.put("jobId", running.jobId());
        } else if (e instanceof ConfigException) {
            error.put("hint", "set " + SeatWatchConfig.ENCRYPTION_KEY_ENV + " or run 'seatwatch init'");
        }
        PrintWriter err = cli.getErr();
        err.println(Jsons.toCompactJson(error));
        err.flush();
        return exitCodeFor(e);
    }

    @Command(name = "keygen", description = "Print a new base64 encryption key")
    static final class KeygenCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Override
        public Integer call() {
            PrintWriter out = parent.out();
            out.println(SecretCipher.generateKeyBase64());
            out.flush();
            return 0;
        }
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and key material")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Override
        public Integer call() throws IOException {
            SeatWatchConfig config = parent.config();
            new Database(config).init();
            boolean keyCreated = false;
            String fromEnv = System.getenv(SeatWatchConfig.ENCRYPTION_KEY_ENV);
            Path keyFile = config.encryptionKeyFile();
            if ((fromEnv == null || fromEnv.isBlank()) && !Files.exists(keyFile)) {
                Files.writeString(keyFile, SecretCipher.generateKeyBase64(), StandardCharsets.UTF_8);
                keyCreated = true;
            }
            try (SeatWatchApp app = parent.app()) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("root", app.config().rootDir().toString());
                result.put("database", app.config().dbFile().toString());
                result.put("keyFileCreated", keyCreated);
                parent.printJson(result);
            }
            return 0;
        }
    }

    @Command(name = "create", description = "Create a monitoring job from a JSON file")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Option(names = {"--owner"}, required = true, description = "Owner id")
        String owner;

        @Option(names = {"--file"}, required = true, description = "Job definition JSON file")
        String file;

        @Override
        public Integer call() throws IOException {
            JobSpec jobSpec = Jsons.mapper().readValue(Path.of(file).toFile(), JobSpec.class);
            try (SeatWatchApp app = parent.app()) {
                String jobId = app.registry().create(owner, jobSpec);
                parent.printJson(Map.of("jobId", jobId));
            }
            return 0;
        }
    }

    @Command(name = "jobs", description = "List an owner's jobs")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Option(names = {"--owner"}, required = true, description = "Owner id")
        String owner;

        @Override
        public Integer call() {
            try (SeatWatchApp app = parent.app()) {
                List<JobRecord> jobs = app.registry().listJobs(owner);
                parent.printJson(jobs);
            }
            return 0;
        }
    }

    @Command(name = "show", description = "Show a job with its targets and stats")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Option(names = {"--owner"}, required = true, description = "Owner id")
        String owner;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (SeatWatchApp app = parent.app()) {
                JobDetail detail = app.registry().jobDetail(jobId, owner);
                parent.printJson(detail);
            }
            return 0;
        }
    }

    @Command(name = "delete", description = "Delete a job with its targets and stats")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Option(names = {"--owner"}, required = true, description = "Owner id")
        String owner;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (SeatWatchApp app = parent.app()) {
                app.registry().delete(jobId, owner);
                parent.printJson(Map.of("jobId", jobId, "deleted", true));
            }
            return 0;
        }
    }

    @Command(name = "notifications", description = "Show or update an owner's notification settings")
    static final class NotificationsCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Option(names = {"--owner"}, required = true, description = "Owner id")
        String owner;

        @Option(names = {"--sender"}, description = "Sender mail address")
        String sender;

        @Option(names = {"--mail-password"}, description = "Mail credential; blank clears it")
        String mailPassword;

        @Option(names = {"--recipient"}, description = "Email recipient (repeatable)")
        List<String> recipients;

        @Option(names = {"--webhook"}, description = "Chat webhook URL")
        String webhook;

        @Override
        public Integer call() {
            try (SeatWatchApp app = parent.app()) {
                NotificationSettings settings;
                if (sender == null && mailPassword == null && recipients == null && webhook == null) {
                    settings = app.registry().notificationSettings(owner);
                } else {
                    settings = app.registry().updateNotificationSettings(
                            owner, new NotificationUpdate(sender, mailPassword, recipients, webhook));
                }
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("ownerId", settings.ownerId());
                view.put("senderAddress", settings.senderAddress());
                view.put("mailCredentialConfigured", settings.mailCredential() != null);
                view.put("emailRecipients", settings.emailRecipients());
                view.put("webhookUrl", settings.webhookUrl());
                view.put("updatedAt", settings.updatedAt());
                parent.printJson(view);
            }
            return 0;
        }
    }

    @Command(name = "reconcile", description = "Settle jobs persisted as active but not running")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Override
        public Integer call() {
            try (SeatWatchApp app = parent.app()) {
                ReconcileOutcome outcome = app.registry().reconcile();
                parent.printJson(outcome);
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SeatWatchCommand parent;

        @Override
        public Integer call() {
            try (SeatWatchApp app = parent.app()) {
                AuditLogger.Verification verification = app.auditLogger().verify();
                parent.printJson(verification);
                return verification.valid() ? 0 : 1;
            }
        }
    }
}
