package com.storysentinel.service.store;

import com.storysentinel.collectors.api.SnapshotStore;
import com.storysentinel.core.model.StorySnapshot;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the snapshot currently served to readers. Reads are a single volatile load; a publish
 * swaps the whole snapshot so a reader sees either the previous cycle or the new one.
 */
public final class AtomicSnapshotStore implements SnapshotStore {
    private final AtomicReference<StorySnapshot> current = new AtomicReference<>(StorySnapshot.empty());

    @Override
    public StorySnapshot current() {
        return current.get();
    }

    @Override
    public void publish(StorySnapshot snapshot) {
        current.set(Objects.requireNonNull(snapshot, "snapshot is required"));
    }

    public Optional<Instant> lastPublishedAt() {
        StorySnapshot snapshot = current.get();
        return snapshot.cycle() == 0 ? Optional.empty() : Optional.of(snapshot.refreshedAt());
    }
}
