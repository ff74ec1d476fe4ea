package io.seatwatch.runtime;

import io.seatwatch.client.RegistrationClient;
import io.seatwatch.client.SectionStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Scripted client: queued responses are consumed first, then the defaults apply.
 */
final class FakeRegistrationClient implements RegistrationClient {
    private final Deque<Supplier<List<SectionStatus>>> statusScript = new ArrayDeque<>();
    private final Deque<Supplier<Boolean>> actionScript = new ArrayDeque<>();
    private final List<String> submittedSectionIds = new ArrayList<>();
    private List<SectionStatus> defaultStatus = List.of();
    private boolean defaultAction;
    private boolean sessionValid = true;
    private int statusCalls;
    private int actionCalls;
    private int sessionCalls;

    static SectionStatus section(String label, String id, int available) {
        return new SectionStatus(label, id, available, 30, 30 - Math.max(0, available), 0);
    }

    synchronized FakeRegistrationClient thenStatus(SectionStatus... sections) {
        List<SectionStatus> copy = List.of(sections);
        statusScript.add(() -> copy);
        return this;
    }

    synchronized FakeRegistrationClient thenStatusThrows(RuntimeException error) {
        statusScript.add(() -> {
            throw error;
        });
        return this;
    }

    synchronized FakeRegistrationClient defaultStatus(SectionStatus... sections) {
        defaultStatus = List.of(sections);
        return this;
    }

    synchronized FakeRegistrationClient thenAction(boolean result) {
        actionScript.add(() -> result);
        return this;
    }

    synchronized FakeRegistrationClient thenActionThrows(RuntimeException error) {
        actionScript.add(() -> {
            throw error;
        });
        return this;
    }

    synchronized FakeRegistrationClient thenActionRuns(Supplier<Boolean> action) {
        actionScript.add(action);
        return this;
    }

    synchronized FakeRegistrationClient defaultAction(boolean result) {
        defaultAction = result;
        return this;
    }

    synchronized void setSessionValid(boolean valid) {
        sessionValid = valid;
    }

    @Override
    public List<SectionStatus> getSectionStatus(String term, String department, String courseCode) {
        Supplier<List<SectionStatus>> next;
        synchronized (this) {
            statusCalls++;
            next = statusScript.poll();
            if (next == null) {
                return defaultStatus;
            }
        }
        return next.get();
    }

    @Override
    public boolean submitAction(String term, String sectionId) {
        Supplier<Boolean> next;
        synchronized (this) {
            actionCalls++;
            submittedSectionIds.add(sectionId);
            next = actionScript.poll();
            if (next == null) {
                return defaultAction;
            }
        }
        return next.get();
    }

    @Override
    public synchronized boolean checkSession(String term) {
        sessionCalls++;
        return sessionValid;
    }

    synchronized int statusCalls() {
        return statusCalls;
    }

    synchronized int actionCalls() {
        return actionCalls;
    }

    synchronized int sessionCalls() {
        return sessionCalls;
    }

    synchronized List<String> submittedSectionIds() {
        return List.copyOf(submittedSectionIds);
    }
}
