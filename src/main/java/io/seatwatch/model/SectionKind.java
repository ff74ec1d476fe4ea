package io.seatwatch.model;

public enum SectionKind {
    LECTURE,
    DISCUSSION
}
