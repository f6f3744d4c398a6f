package com.concord.events;

import java.util.Objects;

/**
 * The verbatim text of a JSON value that has not been interpreted yet.
 *
 * <p>The decoder captures {@code content} and {@code prev_content} this way because their schema
 * depends on {@code type}, which may appear later in the same object.
 *
 * @param json the JSON text, never null
 */
public record RawJson(String json) {

    public RawJson {
        Objects.requireNonNull(json, "json");
    }

    @Override
    public String toString() {
        return json;
    }
}
