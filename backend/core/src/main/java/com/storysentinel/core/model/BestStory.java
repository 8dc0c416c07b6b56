package com.storysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * One entry of the best-stories response. Every field is written, {@code uri} included when the
 * story has no link.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record BestStory(
        String title,
        String uri,
        String postedBy,
        String time,
        int score,
        int commentCount
) {
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx").withZone(ZoneOffset.UTC);

    public static BestStory from(Story story) {
        return new BestStory(
                story.title(),
                story.url(),
                story.author(),
                TIME_FORMAT.format(story.postedAt()),
                story.score(),
                story.commentCount()
        );
    }
}
