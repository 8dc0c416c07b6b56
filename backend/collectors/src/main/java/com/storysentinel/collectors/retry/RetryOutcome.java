package com.storysentinel.collectors.retry;

import com.storysentinel.core.model.Story;

import java.util.List;
import java.util.Set;

/**
 * Stories gathered across the initial pass and all retries, plus the identifiers still failing
 * when retries ran out.
 */
public record RetryOutcome(List<Story> stories, Set<Integer> dropped, int retries) {
    public RetryOutcome {
        stories = List.copyOf(stories);
        dropped = Set.copyOf(dropped);
    }
}
