package io.seatwatch.model;

import java.util.List;

public record SectionGroup(String lecture, List<String> discussions) {
    public SectionGroup {
        discussions = discussions == null ? List.of() : List.copyOf(discussions);
    }
}
