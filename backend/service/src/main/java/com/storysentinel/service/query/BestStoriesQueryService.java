package com.storysentinel.service.query;

import com.storysentinel.collectors.api.SnapshotStore;
import com.storysentinel.core.model.BestStory;
import com.storysentinel.core.model.Story;
import com.storysentinel.core.model.StorySnapshot;

import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

public final class BestStoriesQueryService {
    private static final Logger LOGGER = Logger.getLogger(BestStoriesQueryService.class.getName());
    private static final Comparator<Story> BY_SCORE_DESCENDING = Comparator.comparingInt(Story::score).reversed();

    private final SnapshotStore snapshotStore;

    public BestStoriesQueryService(SnapshotStore snapshotStore) {
        this.snapshotStore = snapshotStore;
    }

    /**
     * Returns up to {@code n} stories of the current snapshot, highest score first. Equal scores
     * keep their snapshot order.
     *
     * @throws IllegalArgumentException if {@code n < 1}
     */
    public List<BestStory> bestStories(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1, was " + n);
        }
        StorySnapshot snapshot = snapshotStore.current();
        if (snapshot.isEmpty()) {
            LOGGER.info("There are no best stories");
            return List.of();
        }
        return snapshot.stories().stream()
                .sorted(BY_SCORE_DESCENDING)
                .limit(n)
                .map(BestStory::from)
                .toList();
    }
}
