package com.storysentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The stories published by one refresh cycle. Instances are never modified after construction;
 * a newer cycle replaces the whole snapshot.
 */
public record StorySnapshot(long cycle, Instant refreshedAt, List<Story> stories) {
    private static final StorySnapshot EMPTY = new StorySnapshot(0, Instant.EPOCH, List.of());

    public StorySnapshot {
        Objects.requireNonNull(refreshedAt, "refreshedAt is required");
        Objects.requireNonNull(stories, "stories is required");
        stories = List.copyOf(stories);
    }

    public static StorySnapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return stories.isEmpty();
    }

    public int size() {
        return stories.size();
    }
}
