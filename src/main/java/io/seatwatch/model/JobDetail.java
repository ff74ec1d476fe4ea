package io.seatwatch.model;

import java.util.List;

public record JobDetail(
        JobRecord job,
        List<Target> targets,
        JobStats stats,
        boolean running
) {
}
