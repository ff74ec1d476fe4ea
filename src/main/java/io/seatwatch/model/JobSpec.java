package io.seatwatch.model;

import java.util.ArrayList;
import java.util.List;

public record JobSpec(
        String term,
        int pollingIntervalSeconds,
        int seatThreshold,
        MonitoringMode monitoringMode,
        String credential,
        List<CourseSpec> courses
) {
    public JobSpec {
        monitoringMode = monitoringMode == null ? MonitoringMode.INCLUDE : monitoringMode;
        courses = courses == null ? List.of() : List.copyOf(courses);
    }

    public int effectiveThreshold() {
        return monitoringMode.effectiveThreshold(seatThreshold);
    }

    public List<Target> targets() {
        List<Target> out = new ArrayList<>();
        for (CourseSpec course : courses) {
            out.addAll(course.toTargets());
        }
        return out;
    }

    public void validate(int minPollingIntervalSec) {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("term is required");
        }
        if (pollingIntervalSeconds < minPollingIntervalSec) {
            throw new IllegalArgumentException(
                    "pollingIntervalSeconds must be >= " + minPollingIntervalSec + ", got " + pollingIntervalSeconds);
        }
        if (seatThreshold < 0) {
            throw new IllegalArgumentException("seatThreshold must be >= 0");
        }
        if (credential == null || credential.isBlank()) {
            throw new IllegalArgumentException("credential is required");
        }
        if (courses.isEmpty()) {
            throw new IllegalArgumentException("at least one course is required");
        }
        for (CourseSpec course : courses) {
            if (course.sectionGroups().isEmpty()) {
                throw new IllegalArgumentException(
                        "course " + course.department() + " " + course.courseCode() + " has no sections");
            }
        }
        // Target's constructor rejects blank department/code/label.
        targets();
    }
}
