package com.concord.events;

import com.concord.events.room.AliasesEventContent;
import com.concord.events.room.AvatarEventContent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps each known {@code type} discriminator to the content class that parses its payload.
 *
 * <p>A registry is immutable once built and may be read from any number of threads. New event
 * types are added by registering their content class on a {@link Builder}; the codec itself never
 * changes.
 */
public final class StateEventContentRegistry implements StateEventContentResolver<StateEventContent> {

    private static final Logger log = LoggerFactory.getLogger(StateEventContentRegistry.class);

    private final Map<String, Class<? extends StateEventContent>> contentTypes;
    private final ObjectMapper mapper;

    private StateEventContentRegistry(Map<String, Class<? extends StateEventContent>> contentTypes, ObjectMapper mapper) {
        this.contentTypes = Map.copyOf(contentTypes);
        this.mapper = mapper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A registry of the bundled room schemas: {@code m.room.aliases} and {@code m.room.avatar}. */
    public static StateEventContentRegistry defaultRegistry() {
        return builder()
                .register(AliasesEventContent.EVENT_TYPE, AliasesEventContent.class)
                .register(AvatarEventContent.EVENT_TYPE, AvatarEventContent.class)
                .build();
    }

    @Override
    public StateEventContent fromParts(String eventType, RawJson content) {
        Class<? extends StateEventContent> contentType = contentTypes.get(eventType);
        if (contentType == null) {
            throw InvalidContentException.unknownEventType(eventType);
        }
        StateEventContent parsed;
        try {
            parsed = mapper.readValue(content.json(), contentType);
        } catch (JsonProcessingException e) {
            throw InvalidContentException.schemaMismatch(eventType, e);
        }
        if (parsed == null) {
            throw new InvalidContentException(eventType, "Content of '%s' must not be null".formatted(eventType));
        }
        return parsed;
    }

    /**
     * Parses a bare content object and checks it against the expected class.
     *
     * @throws InvalidContentException if the type is unknown, the payload is invalid, or the
     *     registered class is not {@code expected}
     */
    public <T extends StateEventContent> T deserializeContent(String eventType, RawJson content, Class<T> expected) {
        StateEventContent parsed = fromParts(eventType, content);
        if (!expected.isInstance(parsed)) {
            throw new InvalidContentException(
                    eventType,
                    "'%s' is registered as %s, not %s"
                            .formatted(eventType, parsed.getClass().getSimpleName(), expected.getSimpleName()));
        }
        return expected.cast(parsed);
    }

    public boolean isRegistered(String eventType) {
        return contentTypes.containsKey(eventType);
    }

    public Set<String> eventTypes() {
        return contentTypes.keySet();
    }

    /** Collects registrations; not thread-safe. */
    public static final class Builder {

        private final Map<String, Class<? extends StateEventContent>> contentTypes = new LinkedHashMap<>();
        private ObjectMapper mapper = StateEventJson.objectMapper();

        private Builder() {}

        /**
         * Registers the class whose Jackson binding parses payloads of {@code eventType}.
         *
         * @throws IllegalStateException if {@code eventType} is already registered
         */
        public Builder register(String eventType, Class<? extends StateEventContent> contentType) {
            Objects.requireNonNull(eventType, "eventType");
            Objects.requireNonNull(contentType, "contentType");
            Class<? extends StateEventContent> previous = contentTypes.putIfAbsent(eventType, contentType);
            if (previous != null) {
                throw new IllegalStateException("'%s' is already registered to %s"
                        .formatted(eventType, previous.getName()));
            }
            return this;
        }

        /** Uses {@code mapper} instead of the shared one to parse payloads. */
        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public StateEventContentRegistry build() {
            log.debug("Building state event content registry for types {}", contentTypes.keySet());
            return new StateEventContentRegistry(contentTypes, mapper);
        }
    }
}
