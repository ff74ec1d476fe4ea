package io.seatwatch.client;

public record SectionStatus(
        String sectionLabel,
        String sectionId,
        int availableSeats,
        int totalSeats,
        int enrolledCount,
        int waitlistCount
) {
}
