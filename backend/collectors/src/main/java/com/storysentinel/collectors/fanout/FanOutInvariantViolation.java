package com.storysentinel.collectors.fanout;

/**
 * A fan-out pass did not account for every identifier exactly once. This is a programming error,
 * not an upstream failure, and is never retried.
 */
public class FanOutInvariantViolation extends IllegalStateException {
    public FanOutInvariantViolation(String message) {
        super(message);
    }
}
