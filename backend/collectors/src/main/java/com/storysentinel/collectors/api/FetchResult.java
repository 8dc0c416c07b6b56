package com.storysentinel.collectors.api;

import com.storysentinel.core.model.Story;

import java.util.Objects;

public record FetchResult(int id, Story story, String failureReason) {
    public static FetchResult success(Story story) {
        Objects.requireNonNull(story, "story is required");
        return new FetchResult(story.id(), story, null);
    }

    public static FetchResult failure(int id, String reason) {
        return new FetchResult(id, null, reason);
    }

    public boolean isSuccess() {
        return story != null;
    }
}
