package com.storysentinel.core.events;

import java.time.Instant;

public record RefreshCompleted(
        Instant timestamp,
        long cycle,
        int requested,
        int published,
        int dropped,
        int passes,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RefreshCompleted";
    }

    public double completeness() {
        return requested == 0 ? 1.0 : (double) published / requested;
    }
}
