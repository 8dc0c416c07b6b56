package com.storysentinel.collectors.refresh;

import java.time.Duration;
import java.util.Set;

public record RefreshReport(
        long cycle,
        int requested,
        int published,
        Set<Integer> dropped,
        int passes,
        int requestsSent,
        Duration duration
) {
    public RefreshReport {
        dropped = Set.copyOf(dropped);
    }
}
