package io.seatwatch.runtime;

import io.seatwatch.client.SessionExpiredException;
import io.seatwatch.client.TransientClientException;
import io.seatwatch.model.FailureRecord;
import io.seatwatch.model.Target;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.seatwatch.runtime.FakeRegistrationClient.section;

final class SectionCycleTest {
    private static final String TERM = "FA26";
    private static final Target LECTURE = Target.lecture("CSE", "100", "A00");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    private final FakeRegistrationClient client = new FakeRegistrationClient();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final Map<String, FailureRecord> failures = new HashMap<>();
    private final NotificationThrottle throttle = new NotificationThrottle(3, ZoneOffset.UTC);
    private final SectionCycle cycle = new SectionCycle(client, new RetryExecutor(3, 1L, 1L, millis -> true), notifier, CLOCK);
    private final SectionCycle.FailureTracker tracker = new SectionCycle.FailureTracker() {
        @Override
        public boolean shouldNotify(String targetKey, Instant now) {
            return throttle.shouldNotify(failures, targetKey, now);
        }

        @Override
        public void clear(String targetKey) {
            throttle.clear(failures, targetKey);
        }
    };

    @Test
    void thresholdDecisionTable() {
        Assertions.assertFalse(SectionCycle.shouldAttempt(0, 0));
        Assertions.assertFalse(SectionCycle.shouldAttempt(-1, 0));
        Assertions.assertTrue(SectionCycle.shouldAttempt(1, 0));
        Assertions.assertTrue(SectionCycle.shouldAttempt(40, 0));
        Assertions.assertTrue(SectionCycle.shouldAttempt(1, 3));
        Assertions.assertTrue(SectionCycle.shouldAttempt(3, 3));
        Assertions.assertFalse(SectionCycle.shouldAttempt(4, 3));
        Assertions.assertFalse(SectionCycle.shouldAttempt(0, 3));
    }

    @Test
    void missingSectionIsNoChange() {
        client.thenStatus(section("B00", "900", 5));

        Assertions.assertEquals(CycleOutcome.NO_CHANGE, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(1, client.statusCalls());
        Assertions.assertEquals(0, client.actionCalls());
    }

    @Test
    void fullSectionMakesOneQueryAndNoAction() {
        client.thenStatus(section("A00", "100", 0));

        Assertions.assertEquals(CycleOutcome.FULL, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(1, client.statusCalls());
        Assertions.assertEquals(0, client.actionCalls());
        Assertions.assertTrue(notifier.messages().isEmpty());
    }

    @Test
    void seatsAboveThresholdCountAsFull() {
        client.thenStatus(section("A00", "100", 5));

        Assertions.assertEquals(CycleOutcome.FULL, cycle.run(TERM, 3, LECTURE, tracker));
        Assertions.assertEquals(0, client.actionCalls());
    }

    @Test
    void recheckFailureIsFalsePositive() {
        client.thenStatus(section("A00", "100", 2)).thenStatus(section("A00", "100", 0));

        Assertions.assertEquals(CycleOutcome.FALSE_POSITIVE, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(2, client.statusCalls());
        Assertions.assertEquals(0, client.actionCalls());
        Assertions.assertTrue(notifier.messages().isEmpty());
    }

    @Test
    void sectionMissingOnRecheckIsFalsePositive() {
        client.thenStatus(section("A00", "100", 2)).thenStatus(section("A01", "101", 2));

        Assertions.assertEquals(CycleOutcome.FALSE_POSITIVE, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(0, client.actionCalls());
    }

    @Test
    void confirmedOpeningEnrollsWithFirstReadingSectionId() {
        client.thenStatus(section("A00", "111", 2))
                .thenStatus(section("A00", "222", 1))
                .thenAction(true);

        Assertions.assertEquals(CycleOutcome.ENROLLED, cycle.run(TERM, 0, LECTURE, tracker));

        Assertions.assertEquals(List.of("111"), client.submittedSectionIds());
        List<String> messages = notifier.messages();
        Assertions.assertEquals(2, messages.size());
        Assertions.assertTrue(messages.get(0).startsWith("Found opening in CSE 100 section A00!"));
        Assertions.assertTrue(messages.get(0).contains("Attempting enrollment"));
        Assertions.assertTrue(messages.get(1).startsWith("Successfully enrolled in CSE 100 section A00!"));
        Assertions.assertTrue(messages.get(1).contains("2026-03-02 10:00:00"));
    }

    @Test
    void successClearsEarlierFailures() {
        failures.put(LECTURE.key(TERM), new FailureRecord(2L, CLOCK.instant()));
        client.defaultStatus(section("A00", "111", 1)).thenAction(true);

        Assertions.assertEquals(CycleOutcome.ENROLLED, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertFalse(failures.containsKey("CSE_100_A00_FA26"));
    }

    @Test
    void failedEnrollmentNotifiesAtMostThreeTimesPerDay() {
        client.defaultStatus(section("A00", "111", 1)).defaultAction(false);

        for (int i = 0; i < 5; i++) {
            Assertions.assertEquals(CycleOutcome.ENROLL_FAILED, cycle.run(TERM, 0, LECTURE, tracker));
        }

        Assertions.assertEquals(5, client.actionCalls());
        Assertions.assertEquals(5L, notifier.countStartingWith("Found opening in"));
        Assertions.assertEquals(3L, notifier.countStartingWith("Failed to enroll in CSE 100 section A00"));
        Assertions.assertEquals(3L, failures.get("CSE_100_A00_FA26").count());
    }

    @Test
    void transientStatusFailuresAreRetriedAsOneUnit() {
        client.thenStatusThrows(new TransientClientException("timeout"))
                .thenStatus(section("A00", "111", 2))
                .thenStatusThrows(new TransientClientException("timeout on recheck"))
                .thenStatus(section("A00", "111", 0));

        Assertions.assertEquals(CycleOutcome.FULL, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(4, client.statusCalls());
        Assertions.assertEquals(0, client.actionCalls());
    }

    @Test
    void exhaustedStatusRetriesPropagate() {
        client.thenStatusThrows(new TransientClientException("a"))
                .thenStatusThrows(new TransientClientException("b"))
                .thenStatusThrows(new TransientClientException("c"));

        Assertions.assertThrows(TransientClientException.class, () -> cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(3, client.statusCalls());
    }

    @Test
    void expiredSessionIsNotRetried() {
        client.thenStatusThrows(new SessionExpiredException("cookie rejected"));

        Assertions.assertThrows(SessionExpiredException.class, () -> cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(1, client.statusCalls());
    }

    @Test
    void exhaustedActionRetriesReportEnrollError() {
        client.defaultStatus(section("A00", "111", 1))
                .thenActionThrows(new TransientClientException("a"))
                .thenActionThrows(new TransientClientException("b"))
                .thenActionThrows(new TransientClientException("c"));

        Assertions.assertEquals(CycleOutcome.ENROLL_ERROR, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(3, client.actionCalls());
        Assertions.assertEquals(1L, notifier.countStartingWith("Found opening in"));
        Assertions.assertEquals(1L, notifier.countStartingWith("Failed to enroll in CSE 100 section A00"));
        Assertions.assertEquals(1L, failures.get("CSE_100_A00_FA26").count());
    }

    @Test
    void enrollmentErrorsShareTheDailyFailureLimit() {
        failures.put(LECTURE.key(TERM), new FailureRecord(3L, CLOCK.instant()));
        client.defaultStatus(section("A00", "111", 1))
                .thenActionThrows(new IllegalStateException("unexpected response"));

        Assertions.assertEquals(CycleOutcome.ENROLL_ERROR, cycle.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(1, client.actionCalls());
        Assertions.assertEquals(0L, notifier.countStartingWith("Failed to enroll"));
        Assertions.assertEquals(3L, failures.get("CSE_100_A00_FA26").count());
    }

    @Test
    void cancelledBackoffPropagatesWithoutFailureAlert() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        SectionCycle cancelled = new SectionCycle(client,
                new RetryExecutor(3, 1L, 1L, RetryExecutor.Sleeper.cancellable(token)), notifier, CLOCK);
        client.defaultStatus(section("A00", "111", 1))
                .thenActionThrows(new TransientClientException("a"));

        Assertions.assertThrows(RetryCancelledException.class, () -> cancelled.run(TERM, 0, LECTURE, tracker));
        Assertions.assertEquals(1, client.actionCalls());
        Assertions.assertEquals(0L, notifier.countStartingWith("Failed to enroll"));
        Assertions.assertTrue(failures.isEmpty());
    }
}
