package io.seatwatch.runtime;

import io.seatwatch.client.RegistrationClient;
import io.seatwatch.config.OrchestratorSettings;
import io.seatwatch.model.HealthStatus;
import io.seatwatch.model.JobRecord;
import io.seatwatch.model.JobStats;
import io.seatwatch.model.JobStatusInfo;
import io.seatwatch.model.Target;
import io.seatwatch.notify.Notifier;
import io.seatwatch.observability.AuditLogger;
import io.seatwatch.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State and loop of one running job.
 *
 * <p>Only the loop thread mutates state, each time inside a short critical section of
 * {@link #lock}. Readers go through {@link #snapshot()} and {@link #health()}, which copy under
 * the same lock. The lock is never held across a collaborator call.
 */
public final class JobRuntime implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(JobRuntime.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String jobId;
    private final String ownerId;
    private final String term;
    private final int threshold;
    private final List<Target> targets;
    private final RegistrationClient client;
    private final Notifier notifier;
    private final JobStore store;
    private final AuditLogger auditLogger;
    private final NotificationThrottle throttle;
    private final SectionCycle cycle;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration sessionRefreshInterval;
    private final Instant startTime;
    private final CancellationToken token = new CancellationToken();
    private final ReentrantLock lock = new ReentrantLock();

    private final JobStats stats;
    private boolean connected = true;
    private boolean running = true;
    private RuntimeState state = RuntimeState.RUNNING;
    private Instant lastCheckTime;

    public JobRuntime(
            JobRecord job,
            List<Target> targets,
            RegistrationClient client,
            Notifier notifier,
            JobStore store,
            JobStats stats,
            OrchestratorSettings settings,
            AuditLogger auditLogger,
            Clock clock
    ) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("job " + job.id() + " has no targets");
        }
        this.jobId = job.id();
        this.ownerId = job.ownerId();
        this.term = job.term();
        this.threshold = job.monitoringMode().effectiveThreshold(job.seatThreshold());
        this.targets = List.copyOf(targets);
        this.client = client;
        this.notifier = notifier;
        this.store = store;
        this.auditLogger = auditLogger;
        this.stats = stats;
        this.clock = clock;
        this.lastCheckTime = job.lastCheckTime();
        this.pollInterval = Duration.ofSeconds(Math.max(1, job.pollingIntervalSec()));
        this.sessionRefreshInterval = Duration.ofSeconds(settings.sessionRefreshIntervalSec());
        this.throttle = new NotificationThrottle(settings.failureNotifyDailyLimit(), clock.getZone());
        RetryExecutor retry = RetryExecutor.fromSettings(settings, RetryExecutor.Sleeper.cancellable(token));
        this.cycle = new SectionCycle(client, retry, notifier, clock);
        this.startTime = clock.instant();
    }

    public String jobId() {
        return jobId;
    }

    public String ownerId() {
        return ownerId;
    }

    @Override
    public void run() {
        LOG.info("Job {} started: {} target(s), poll every {}s, session check every {}s",
                jobId, targets.size(), pollInterval.getSeconds(), sessionRefreshInterval.getSeconds());
        Instant nextRefresh = clock.instant();
        Instant nextPoll = clock.instant();
        try {
            while (!token.isCancelled()) {
                Instant now = clock.instant();
                if (!now.isBefore(nextRefresh)) {
                    refreshSession();
                    nextRefresh = clock.instant().plus(sessionRefreshInterval);
                }
                if (token.isCancelled()) {
                    break;
                }
                if (!clock.instant().isBefore(nextPoll)) {
                    if (isConnected()) {
                        runSweep();
                    } else {
                        LOG.debug("Job {} paused until the session is valid again", jobId);
                    }
                    nextPoll = clock.instant().plus(pollInterval);
                }
                Instant wakeAt = nextPoll.isBefore(nextRefresh) ? nextPoll : nextRefresh;
                token.await(Duration.between(clock.instant(), wakeAt));
            }
        } finally {
            lock.lock();
            try {
                running = false;
                state = RuntimeState.STOPPED;
            } finally {
                lock.unlock();
            }
            LOG.info("Job {} stopped", jobId);
        }
    }

    public boolean runSweep() {
        SectionCycle.FailureTracker tracker = new LockedTracker();
        for (Target target : targets) {
            if (token.isCancelled()) {
                // partial sweeps are not counted as a check
                persistStats(null);
                return false;
            }
            CycleOutcome outcome;
            try {
                outcome = cycle.run(term, threshold, target, tracker);
            } catch (RetryCancelledException e) {
                LOG.debug("Job {} stopped while retrying {}", jobId, target.displayName());
                persistStats(null);
                return false;
            } catch (RuntimeException e) {
                LOG.error("Job {} error checking {}: {}", jobId, target.displayName(), e.getMessage());
                withLock(stats::recordError);
                continue;
            }
            withLock(() -> record(outcome));
        }
        Instant now = clock.instant();
        withLock(() -> {
            stats.recordCheck(now);
            lastCheckTime = now;
        });
        persistStats(now);
        return true;
    }

    public void refreshSession() {
        boolean valid;
        try {
            valid = client.checkSession(term);
        } catch (RuntimeException e) {
            LOG.error("Job {} session check failed: {}", jobId, e.getMessage());
            return;
        }
        boolean wasConnected;
        lock.lock();
        try {
            wasConnected = connected;
            connected = valid;
            if (running) {
                state = valid ? RuntimeState.RUNNING : RuntimeState.PAUSED_DISCONNECTED;
            }
        } finally {
            lock.unlock();
        }
        if (valid == wasConnected) {
            return;
        }
        if (!valid) {
            LOG.error("Job {} session has expired; monitoring paused", jobId);
            notifier.notify("Session has expired!\nTime: " + TIME_FORMAT.format(clock.instant().atZone(clock.getZone()))
                    + "\nPlease update the session credential to resume monitoring.");
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "job.session_expired", ownerId, jobId, "paused", Map.of("term", term)));
        } else {
            LOG.info("Job {} session is valid again; monitoring resumed", jobId);
        }
        try {
            store.updateConnected(jobId, valid);
        } catch (IllegalStateException e) {
            LOG.error("Job {} could not persist connectivity: {}", jobId, e.getMessage());
        }
    }

    public void cancel() {
        token.cancel();
    }

    public JobStatusInfo snapshot() {
        lock.lock();
        try {
            return new JobStatusInfo(running, connected, state.name(), lastCheckTime, stats.copy());
        } finally {
            lock.unlock();
        }
    }

    public HealthStatus health() {
        lock.lock();
        try {
            long attempts = stats.getEnrollmentAttempts();
            double successRate = attempts == 0L ? 0.0d : stats.getSuccessfulEnrollments() * 100.0d / attempts;
            return new HealthStatus(
                    HealthStatus.formatUptime(Duration.between(startTime, clock.instant())),
                    lastCheckTime,
                    connected,
                    stats.getErrors(),
                    successRate,
                    stats.getTotalChecks()
            );
        } finally {
            lock.unlock();
        }
    }

    boolean isConnected() {
        lock.lock();
        try {
            return connected;
        } finally {
            lock.unlock();
        }
    }

    private void record(CycleOutcome outcome) {
        switch (outcome) {
            case ENROLLED:
                stats.recordOpening();
                stats.recordAttempt();
                stats.recordSuccess();
                break;
            case ENROLL_FAILED:
                stats.recordOpening();
                stats.recordAttempt();
                break;
            case ENROLL_ERROR:
                stats.recordOpening();
                stats.recordAttempt();
                stats.recordError();
                break;
            default:
                break;
        }
    }

    private void persistStats(Instant checkedAt) {
        JobStats copy;
        Instant lastCheck;
        lock.lock();
        try {
            copy = stats.copy();
            lastCheck = checkedAt == null ? lastCheckTime : checkedAt;
        } finally {
            lock.unlock();
        }
        if (lastCheck == null) {
            lastCheck = clock.instant();
        }
        try {
            store.saveStats(jobId, copy, lastCheck);
        } catch (IllegalStateException e) {
            LOG.error("Job {} could not persist stats: {}", jobId, e.getMessage());
        }
    }

    private void withLock(Runnable mutation) {
        lock.lock();
        try {
            mutation.run();
        } finally {
            lock.unlock();
        }
    }

    private final class LockedTracker implements SectionCycle.FailureTracker {
        @Override
        public boolean shouldNotify(String targetKey, Instant now) {
            lock.lock();
            try {
                return throttle.shouldNotify(stats.getSectionFailures(), targetKey, now);
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void clear(String targetKey) {
            withLock(() -> throttle.clear(stats.getSectionFailures(), targetKey));
        }
    }
}
