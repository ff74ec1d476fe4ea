package io.seatwatch.runtime;

import io.seatwatch.client.RegistrationClient;
import io.seatwatch.client.RegistrationClientFactory;
import io.seatwatch.config.OrchestratorSettings;
import io.seatwatch.model.HealthStatus;
import io.seatwatch.model.JobDetail;
import io.seatwatch.model.JobRecord;
import io.seatwatch.model.JobSpec;
import io.seatwatch.model.JobStats;
import io.seatwatch.model.JobStatusInfo;
import io.seatwatch.model.NotificationProfile;
import io.seatwatch.model.NotificationSettings;
import io.seatwatch.model.NotificationUpdate;
import io.seatwatch.model.Target;
import io.seatwatch.notify.Notifier;
import io.seatwatch.notify.NotifierFactory;
import io.seatwatch.observability.AuditLogger;
import io.seatwatch.security.SealedSecret;
import io.seatwatch.security.SecretCipher;
import io.seatwatch.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public final class JobRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobRegistry.class);

    private final JobStore store;
    private final SecretCipher cipher;
    private final RegistrationClientFactory clientFactory;
    private final NotifierFactory notifierFactory;
    private final OrchestratorSettings settings;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final ExecutorService executor;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, JobRuntime> running = new HashMap<>();

    public JobRegistry(
            JobStore store,
            SecretCipher cipher,
            RegistrationClientFactory clientFactory,
            NotifierFactory notifierFactory,
            OrchestratorSettings settings,
            AuditLogger auditLogger,
            Clock clock
    ) {
        this.store = store;
        this.cipher = cipher;
        this.clientFactory = clientFactory;
        this.notifierFactory = notifierFactory;
        this.settings = settings;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(new JobThreadFactory());
    }

    public String create(String ownerId, JobSpec spec) {
        requireOwner(ownerId);
        spec.validate(settings.minPollingIntervalSec());
        List<Target> targets = spec.targets();
        Instant now = clock.instant();
        String jobId = UUID.randomUUID().toString();
        JobRecord job = new JobRecord(
                jobId,
                ownerId,
                spec.term().trim(),
                spec.pollingIntervalSeconds(),
                spec.effectiveThreshold(),
                spec.monitoringMode(),
                cipher.encrypt(spec.credential()),
                false,
                false,
                null,
                now,
                now
        );
        store.createJob(job, targets, new JobStats(now));
        auditLogger.log(AuditLogger.AuditEvent.of("job.create", ownerId, jobId, "created", Map.of(
                "term", job.term(),
                "targets", targets.size(),
                "mode", job.monitoringMode().name(),
                "threshold", job.seatThreshold()
        )));
        LOG.info("Created job {} for owner {} with {} target(s)", jobId, ownerId, targets.size());
        return jobId;
    }

    public void start(String jobId, String ownerId) {
        JobRecord job = store.findJob(jobId, ownerId)
                .orElseThrow(() -> new JobNotFoundException(jobId, "Job not found: " + jobId));
        if (isRunning(jobId)) {
            throw new JobAlreadyRunningException(jobId);
        }
        String credential = cipher.decrypt(job.credential());
        List<Target> targets = store.loadTargets(jobId);
        Notifier notifier = notifierFactory.create(loadProfile(ownerId));
        JobStats stats = store.loadStats(jobId).orElseGet(() -> new JobStats(clock.instant()));
        RegistrationClient client = clientFactory.open(credential);
        JobRuntime runtime = new JobRuntime(job, targets, client, notifier, store, stats, settings, auditLogger, clock);

        lock.writeLock().lock();
        try {
            if (running.containsKey(jobId)) {
                throw new JobAlreadyRunningException(jobId);
            }
            running.put(jobId, runtime);
        } finally {
            lock.writeLock().unlock();
        }

        try {
            store.updateJobStatus(jobId, true, true);
            executor.submit(() -> runNamed(runtime));
        } catch (RuntimeException e) {
            lock.writeLock().lock();
            try {
                running.remove(jobId, runtime);
            } finally {
                lock.writeLock().unlock();
            }
            runtime.cancel();
            LOG.error("Job {} could not be started: {}", jobId, e.getMessage());
            try {
                store.updateJobStatus(jobId, false, false);
            } catch (IllegalStateException revert) {
                LOG.error("Job {} could not be marked inactive: {}", jobId, revert.getMessage());
            }
            throw e;
        }
        auditLogger.log(AuditLogger.AuditEvent.of("job.start", ownerId, jobId, "started", Map.of(
                "targets", targets.size(),
                "pollingIntervalSec", job.pollingIntervalSec()
        )));
        LOG.info("Started job {}", jobId);
    }

    public void stop(String jobId) {
        JobRuntime runtime;
        lock.writeLock().lock();
        try {
            runtime = running.remove(jobId);
        } finally {
            lock.writeLock().unlock();
        }
        if (runtime == null) {
            throw new JobNotFoundException(jobId, "Job is not running: " + jobId);
        }
        runtime.cancel();
        store.updateJobStatus(jobId, false, false);
        auditLogger.log(AuditLogger.AuditEvent.of("job.stop", runtime.ownerId(), jobId, "stopped", Map.of()));
        LOG.info("Stopped job {}", jobId);
    }

    public void delete(String jobId, String ownerId) {
        store.findJob(jobId, ownerId)
                .orElseThrow(() -> new JobNotFoundException(jobId, "Job not found: " + jobId));
        if (isRunning(jobId)) {
            try {
                stop(jobId);
            } catch (JobNotFoundException e) {
                LOG.debug("Job {} stopped concurrently before delete", jobId);
            }
        }
        if (!store.deleteJob(jobId, ownerId)) {
            throw new JobNotFoundException(jobId, "Job not found: " + jobId);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("job.delete", ownerId, jobId, "deleted", Map.of()));
        LOG.info("Deleted job {}", jobId);
    }

    public Optional<JobStatusInfo> status(String jobId) {
        return runtime(jobId).map(JobRuntime::snapshot);
    }

    public Optional<HealthStatus> health(String jobId) {
        return runtime(jobId).map(JobRuntime::health);
    }

    public List<JobRecord> listJobs(String ownerId) {
        return store.listJobs(ownerId);
    }

    public JobDetail jobDetail(String jobId, String ownerId) {
        JobRecord job = store.findJob(jobId, ownerId)
                .orElseThrow(() -> new JobNotFoundException(jobId, "Job not found: " + jobId));
        List<Target> targets = store.loadTargets(jobId);
        Optional<JobStatusInfo> live = status(jobId);
        JobStats stats = live.map(JobStatusInfo::stats)
                .orElseGet(() -> store.loadStats(jobId).orElseGet(() -> new JobStats(job.createdAt())));
        return new JobDetail(job, targets, stats, live.isPresent());
    }

    public List<String> runningJobIds() {
        lock.readLock().lock();
        try {
            List<String> ids = new ArrayList<>(running.keySet());
            ids.sort(String::compareTo);
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    public NotificationSettings notificationSettings(String ownerId) {
        requireOwner(ownerId);
        return store.getNotificationSettings(ownerId);
    }

    /**
     * Replaces an owner's notification settings. A null mail password keeps the stored
     * credential, a blank one clears it. Running jobs keep the settings they started with.
     */
    public NotificationSettings updateNotificationSettings(String ownerId, NotificationUpdate update) {
        requireOwner(ownerId);
        NotificationSettings existing = store.getNotificationSettings(ownerId);
        SealedSecret mailCredential;
        if (update.mailPassword() == null) {
            mailCredential = existing.mailCredential();
        } else if (update.mailPassword().isBlank()) {
            mailCredential = null;
        } else {
            mailCredential = cipher.encrypt(update.mailPassword());
        }
        NotificationSettings updated = new NotificationSettings(
                ownerId,
                blankToNull(update.senderAddress()),
                mailCredential,
                update.emailRecipients(),
                blankToNull(update.webhookUrl()),
                clock.instant()
        );
        store.saveNotificationSettings(updated);
        List<String> channels = new ArrayList<>();
        if (updated.webhookUrl() != null) {
            channels.add("webhook");
        }
        if (mailCredential != null) {
            channels.add("mail");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipients", updated.emailRecipients().size());
        details.put("channels", channels);
        auditLogger.log(AuditLogger.AuditEvent.of("notification.settings.update", ownerId, null, "updated", details));
        return updated;
    }

    public ReconcileOutcome reconcile() {
        List<String> resumed = new ArrayList<>();
        List<String> deactivated = new ArrayList<>();
        for (JobRecord job : store.findActiveJobs()) {
            if (isRunning(job.id())) {
                continue;
            }
            if (settings.resumeActiveOnStartup()) {
                try {
                    start(job.id(), job.ownerId());
                    resumed.add(job.id());
                    continue;
                } catch (RuntimeException e) {
                    LOG.error("Could not resume job {}: {}", job.id(), e.getMessage());
                }
            }
            store.updateJobStatus(job.id(), false, false);
            deactivated.add(job.id());
        }
        ReconcileOutcome outcome = new ReconcileOutcome(resumed, deactivated);
        auditLogger.log(AuditLogger.AuditEvent.of("job.reconcile", "system", null, "completed", Map.of(
                "resumed", outcome.resumed().size(),
                "deactivated", outcome.deactivated().size()
        )));
        if (!resumed.isEmpty() || !deactivated.isEmpty()) {
            LOG.info("Reconciled active jobs: resumed={} deactivated={}", resumed.size(), deactivated.size());
        }
        return outcome;
    }

    public void shutdown() {
        List<JobRuntime> toCancel;
        lock.writeLock().lock();
        try {
            toCancel = new ArrayList<>(running.values());
            running.clear();
        } finally {
            lock.writeLock().unlock();
        }
        toCancel.forEach(JobRuntime::cancel);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Job threads did not finish within 5s; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private boolean isRunning(String jobId) {
        lock.readLock().lock();
        try {
            return running.containsKey(jobId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Optional<JobRuntime> runtime(String jobId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(running.get(jobId));
        } finally {
            lock.readLock().unlock();
        }
    }

    private NotificationProfile loadProfile(String ownerId) {
        NotificationSettings stored = store.getNotificationSettings(ownerId);
        String mailPassword = stored.mailCredential() == null ? null : cipher.decrypt(stored.mailCredential());
        return new NotificationProfile(
                ownerId,
                stored.senderAddress(),
                mailPassword,
                stored.emailRecipients(),
                stored.webhookUrl()
        );
    }

    private void runNamed(JobRuntime runtime) {
        Thread current = Thread.currentThread();
        String previous = current.getName();
        current.setName("seatwatch-job-" + runtime.jobId());
        try {
            runtime.run();
        } catch (RuntimeException e) {
            LOG.error("Job {} loop terminated unexpectedly", runtime.jobId(), e);
            evict(runtime);
        } finally {
            current.setName(previous);
        }
    }

    private void evict(JobRuntime runtime) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = running.remove(runtime.jobId(), runtime);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            store.updateJobStatus(runtime.jobId(), false, false);
        }
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static final class JobThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "seatwatch-job-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
