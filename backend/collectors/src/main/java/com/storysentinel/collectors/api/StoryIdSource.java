package com.storysentinel.collectors.api;

import java.util.List;

@FunctionalInterface
public interface StoryIdSource {
    /**
     * Returns the current best-story identifiers in upstream order. Failures are thrown; there is
     * no partial list.
     */
    List<Integer> bestStoryIds() throws InterruptedException;
}
