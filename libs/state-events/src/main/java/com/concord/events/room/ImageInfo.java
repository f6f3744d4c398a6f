package com.concord.events.room;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata about an image. Every property is optional.
 *
 * @param height height in pixels ({@code h})
 * @param width width in pixels ({@code w})
 * @param mimetype MIME type of the image
 * @param size size in bytes
 * @param thumbnailInfo metadata about the thumbnail
 * @param thumbnailUrl URL of the thumbnail
 */
public record ImageInfo(
        @JsonProperty("h") Long height,
        @JsonProperty("w") Long width,
        @JsonProperty("mimetype") String mimetype,
        @JsonProperty("size") Long size,
        @JsonProperty("thumbnail_info") ThumbnailInfo thumbnailInfo,
        @JsonProperty("thumbnail_url") String thumbnailUrl) {}
