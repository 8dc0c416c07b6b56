package com.storysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One upstream story as returned by the item endpoint. Field names on the wire follow the
 * Hacker News item schema ({@code by}, {@code time}, {@code descendants}).
 */
public record Story(
        @JsonProperty("id") int id,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("by") String author,
        @JsonProperty("time") long time,
        @JsonProperty("score") int score,
        @JsonProperty("descendants") int commentCount
) {
    public Story {
        if (score < 0) {
            throw new IllegalArgumentException("score must be >= 0 for story " + id);
        }
        if (commentCount < 0) {
            throw new IllegalArgumentException("descendants must be >= 0 for story " + id);
        }
    }

    public Instant postedAt() {
        return Instant.ofEpochSecond(time);
    }
}
