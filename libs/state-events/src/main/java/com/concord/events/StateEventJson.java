package com.concord.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds the Jackson {@link ObjectMapper} shared by the codec and the bundled content schemas.
 *
 * <p>Unknown content properties are ignored so that newer senders can add keys, and {@code null}
 * properties are left out of the output.
 */
public final class StateEventJson {

    private static final ObjectMapper MAPPER = createMapper();

    private StateEventJson() {
        // utility class
    }

    /** Creates a new, independently configurable mapper with the codec's defaults. */
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /** Returns the shared mapper. Callers must not reconfigure it. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }
}
