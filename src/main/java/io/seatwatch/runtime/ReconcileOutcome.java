package io.seatwatch.runtime;

import java.util.List;

public record ReconcileOutcome(List<String> resumed, List<String> deactivated) {
    public ReconcileOutcome {
        resumed = resumed == null ? List.of() : List.copyOf(resumed);
        deactivated = deactivated == null ? List.of() : List.copyOf(deactivated);
    }
}
