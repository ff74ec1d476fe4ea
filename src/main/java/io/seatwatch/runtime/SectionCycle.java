package io.seatwatch.runtime;

import io.seatwatch.client.RegistrationClient;
import io.seatwatch.client.SectionStatus;
import io.seatwatch.model.Target;
import io.seatwatch.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * One poll / verify / act pass over a single target.
 *
 * <p>The status query and its immediate recheck run as one retried unit, then the enrollment
 * call runs as a second one. The section id used for enrollment always comes from the first
 * reading. Errors from the status unit propagate to the caller; errors from the enrollment
 * unit are reported as {@link CycleOutcome#ENROLL_ERROR} and alert like a refused enrollment.
 * A {@link RetryCancelledException} always propagates.
 */
public final class SectionCycle {
    private static final Logger LOG = LoggerFactory.getLogger(SectionCycle.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RegistrationClient client;
    private final RetryExecutor retry;
    private final Notifier notifier;
    private final Clock clock;

    public SectionCycle(RegistrationClient client, RetryExecutor retry, Notifier notifier, Clock clock) {
        this.client = client;
        this.retry = retry;
        this.notifier = notifier;
        this.clock = clock;
    }

    public static boolean shouldAttempt(int availableSeats, int threshold) {
        return availableSeats > 0 && (threshold == 0 || availableSeats <= threshold);
    }

    public CycleOutcome run(String term, int threshold, Target target, FailureTracker tracker) {
        Verification verification = retry.execute(
                "status " + target.displayName(),
                () -> verify(term, threshold, target)
        );
        switch (verification.kind()) {
            case ABSENT:
                LOG.debug("{} not listed for term {}", target.displayName(), term);
                return CycleOutcome.NO_CHANGE;
            case FULL:
                SectionStatus first = verification.first();
                LOG.debug("{} full ({} enrolled/{} total, {} available)", target.displayName(),
                        first.enrolledCount(), first.totalSeats(), first.availableSeats());
                return CycleOutcome.FULL;
            case FALSE_POSITIVE:
                LOG.info("False positive: {} showed availability but recheck failed", target.displayName());
                return CycleOutcome.FALSE_POSITIVE;
            default:
                break;
        }

        String sectionId = verification.first().sectionId();
        LOG.info("{} {} has {} seat(s) available (verified)",
                threshold == 0 ? "Found opening!" : "Seats are at or below threshold (" + threshold + ")!",
                target.displayName(), verification.recheck().availableSeats());
        notifier.notify("Found opening in " + target.displayName() + "!\n\nAttempting enrollment...\nTime: " + now());

        String key = target.key(term);
        boolean enrolled;
        try {
            enrolled = retry.execute(
                    "enroll " + target.displayName(),
                    () -> client.submitAction(term, sectionId)
            );
        } catch (RetryCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Enrollment in {} failed with error: {}", target.displayName(), e.getMessage(), e);
            reportFailure(target, key, tracker);
            return CycleOutcome.ENROLL_ERROR;
        }

        if (enrolled) {
            tracker.clear(key);
            notifier.notify("Successfully enrolled in " + target.displayName() + "!\n\nTime: " + now()
                    + "\nPlease verify on the registration site.");
            return CycleOutcome.ENROLLED;
        }
        reportFailure(target, key, tracker);
        return CycleOutcome.ENROLL_FAILED;
    }

    private void reportFailure(Target target, String key, FailureTracker tracker) {
        if (tracker.shouldNotify(key, clock.instant())) {
            notifier.notify("Failed to enroll in " + target.displayName() + " despite available seats.\n\nTime: "
                    + now() + "\nPlease check the registration site manually.");
        } else {
            LOG.info("Suppressing notification for {} (exceeded daily failure limit)", target.displayName());
        }
    }

    private Verification verify(String term, int threshold, Target target) {
        SectionStatus first = find(client.getSectionStatus(term, target.department(), target.courseCode()), target);
        if (first == null) {
            return new Verification(Kind.ABSENT, null, null);
        }
        if (!shouldAttempt(first.availableSeats(), threshold)) {
            return new Verification(Kind.FULL, first, null);
        }
        SectionStatus recheck = find(client.getSectionStatus(term, target.department(), target.courseCode()), target);
        if (recheck == null || !shouldAttempt(recheck.availableSeats(), threshold)) {
            if (recheck != null) {
                LOG.debug("Recheck {}: available {} -> {}, enrolled {} -> {}", target.displayName(),
                        first.availableSeats(), recheck.availableSeats(),
                        first.enrolledCount(), recheck.enrolledCount());
            }
            return new Verification(Kind.FALSE_POSITIVE, first, recheck);
        }
        return new Verification(Kind.CONFIRMED, first, recheck);
    }

    private static SectionStatus find(List<SectionStatus> sections, Target target) {
        if (sections == null) {
            return null;
        }
        for (SectionStatus section : sections) {
            if (target.label().equals(section.sectionLabel())) {
                return section;
            }
        }
        return null;
    }

    private String now() {
        return TIME_FORMAT.format(clock.instant().atZone(clock.getZone()));
    }

    public interface FailureTracker {
        boolean shouldNotify(String targetKey, Instant now);

        void clear(String targetKey);
    }

    private enum Kind {
        ABSENT,
        FULL,
        FALSE_POSITIVE,
        CONFIRMED
    }

    private record Verification(Kind kind, SectionStatus first, SectionStatus recheck) {
    }
}
