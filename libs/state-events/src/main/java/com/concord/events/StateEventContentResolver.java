package com.concord.events;

/**
 * Turns a discriminator and an unparsed payload into typed content.
 *
 * <p>This is the only extension point for new event types: the codec never inspects individual
 * schemas. Implementations are shared between threads and must be safe for concurrent use.
 *
 * @param <C> the content type produced
 */
@FunctionalInterface
public interface StateEventContentResolver<C extends StateEventContent> {

    /**
     * Builds content of the schema selected by {@code eventType} from {@code content}.
     *
     * @param eventType the envelope's {@code type} value
     * @param content the raw {@code content} or {@code prev_content} value
     * @return the typed content, never null
     * @throws InvalidContentException if the type is unknown or the payload does not match its schema
     */
    C fromParts(String eventType, RawJson content);
}
