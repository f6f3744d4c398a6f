package com.concord.events.room;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata about a thumbnail. Every property is optional.
 *
 * @param height height in pixels ({@code h})
 * @param width width in pixels ({@code w})
 * @param mimetype MIME type of the thumbnail
 * @param size size in bytes
 */
public record ThumbnailInfo(
        @JsonProperty("h") Long height,
        @JsonProperty("w") Long width,
        @JsonProperty("mimetype") String mimetype,
        @JsonProperty("size") Long size) {}
