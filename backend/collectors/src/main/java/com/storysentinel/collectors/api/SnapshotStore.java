package com.storysentinel.collectors.api;

import com.storysentinel.core.model.StorySnapshot;

/**
 * Holder of the snapshot currently served to readers. Reads never block; a publish replaces the
 * whole snapshot at once.
 */
public interface SnapshotStore {
    StorySnapshot current();

    void publish(StorySnapshot snapshot);
}
