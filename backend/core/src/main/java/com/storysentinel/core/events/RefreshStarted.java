package com.storysentinel.core.events;

import java.time.Instant;

public record RefreshStarted(Instant timestamp, long cycle) implements Event {
    @Override
    public String type() {
        return "RefreshStarted";
    }
}
