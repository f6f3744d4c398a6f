package com.concord.events.room;

import com.concord.events.StateEventContent;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Content of {@code m.room.avatar}: the picture shown for a room.
 *
 * @param info metadata about the image, may be null
 * @param url where the image can be fetched
 */
public record AvatarEventContent(
        @JsonProperty("info") ImageInfo info,
        @JsonProperty("url") String url) implements StateEventContent {

    public static final String EVENT_TYPE = "m.room.avatar";

    public AvatarEventContent {
        Objects.requireNonNull(url, "url");
    }

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }
}
