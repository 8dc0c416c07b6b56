package com.storysentinel.core.events;

import java.time.Instant;

/**
 * Emitted after every fan-out pass, the initial one ({@code pass == 0}) and each retry.
 * {@code requestsSent} counts detail requests that passed the rate limiter.
 */
public record FanOutPassCompleted(
        Instant timestamp,
        long cycle,
        int pass,
        int requested,
        int succeeded,
        int failed,
        int requestsSent,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FanOutPassCompleted";
    }
}
