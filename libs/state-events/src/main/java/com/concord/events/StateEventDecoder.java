package com.concord.events;

import com.concord.identifiers.EventId;
import com.concord.identifiers.InvalidIdentifierException;
import com.concord.identifiers.RoomId;
import com.concord.identifiers.UserId;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Decodes the wire form of a state event into a {@link StateEvent}.
 *
 * <p>JSON does not order object keys, yet {@code content} and {@code prev_content} can only be
 * interpreted once {@code type} is known. The decoder therefore walks the object once, keeping the
 * two payloads as {@link RawJson} and parsing every other recognized key eagerly, and only then
 * resolves the payloads through the {@link StateEventContentResolver}. A recognized key seen twice
 * is rejected even when both values are equal.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 *
 * @param <C> the content type produced by the resolver
 */
public final class StateEventDecoder<C extends StateEventContent> {

    private static final Logger log = LoggerFactory.getLogger(StateEventDecoder.class);

    private final StateEventContentResolver<C> resolver;
    private final StateEventCodecConfig config;
    private final ObjectMapper mapper;

    public StateEventDecoder(StateEventContentResolver<C> resolver) {
        this(resolver, StateEventCodecConfig.defaults(), StateEventJson.objectMapper());
    }

    public StateEventDecoder(
            StateEventContentResolver<C> resolver, StateEventCodecConfig config, ObjectMapper mapper) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Decodes a complete JSON document holding exactly one state event object.
     *
     * @throws StateEventDecodeException if the document is malformed or is not a valid state event
     */
    public StateEvent<C> decode(String json) {
        Objects.requireNonNull(json, "json");
        try (JsonParser parser = mapper.createParser(json)) {
            return decodeDocument(parser);
        } catch (JsonProcessingException e) {
            throw StateEventDecodeException.malformed(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw StateEventDecodeException.malformed(e.getMessage(), e);
        }
    }

    /** Decodes a complete UTF-8 JSON document holding exactly one state event object. */
    public StateEvent<C> decode(byte[] json) {
        Objects.requireNonNull(json, "json");
        try (JsonParser parser = mapper.createParser(json)) {
            return decodeDocument(parser);
        } catch (JsonProcessingException e) {
            throw StateEventDecodeException.malformed(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw StateEventDecodeException.malformed(e.getMessage(), e);
        }
    }

    /**
     * Decodes an already parsed JSON object. A tree cannot hold duplicate keys, so
     * {@link StateEventDecodeException.Reason#DUPLICATE_FIELD} never arises here.
     */
    public StateEvent<C> decode(JsonNode json) {
        Objects.requireNonNull(json, "json");
        if (!json.isObject()) {
            throw StateEventDecodeException.malformed("expected a JSON object but found " + json.getNodeType(), null);
        }
        try (JsonParser parser = mapper.treeAsTokens(json)) {
            return decode(parser);
        } catch (IOException e) {
            throw StateEventDecodeException.malformed(e.getMessage(), e);
        }
    }

    /**
     * Decodes the object at the parser's position. The parser may be positioned before the object,
     * on its {@code START_OBJECT}, or on its first {@code FIELD_NAME}; on return it rests on the
     * matching {@code END_OBJECT}.
     *
     * @throws StateEventDecodeException if the object is not a valid state event
     */
    public StateEvent<C> decode(JsonParser parser) {
        try {
            JsonToken token = parser.currentToken();
            if (token == null) {
                token = parser.nextToken();
            }
            if (token == JsonToken.START_OBJECT) {
                token = parser.nextToken();
            } else if (token != JsonToken.FIELD_NAME && token != JsonToken.END_OBJECT) {
                throw StateEventDecodeException.malformed("expected a JSON object but found " + describe(token), null);
            }

            Slots slots = new Slots();
            while (token == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                parser.nextToken();
                Optional<StateEventField> field = StateEventField.fromWireName(name);
                if (field.isPresent()) {
                    collect(slots, field.get(), parser);
                } else if (config.rejectUnknownFields()) {
                    throw StateEventDecodeException.unknownField(name);
                } else {
                    log.trace("Skipping unknown state event key '{}'", name);
                    parser.skipChildren();
                }
                token = parser.nextToken();
            }
            if (token != JsonToken.END_OBJECT) {
                throw StateEventDecodeException.malformed("unterminated object, found " + describe(token), null);
            }
            return resolve(slots);
        } catch (JsonProcessingException e) {
            throw StateEventDecodeException.malformed(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw StateEventDecodeException.malformed(e.getMessage(), e);
        }
    }

    private StateEvent<C> decodeDocument(JsonParser parser) throws IOException {
        StateEvent<C> event = decode(parser);
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw StateEventDecodeException.malformed("trailing content after the object: " + describe(trailing), null);
        }
        return event;
    }

    private void collect(Slots slots, StateEventField field, JsonParser parser) throws IOException {
        switch (field) {
            case TYPE -> {
                checkUnseen(slots.eventType, field);
                slots.eventType = readString(parser, field);
            }
            case CONTENT -> {
                checkUnseen(slots.content, field);
                slots.content = readRaw(parser);
            }
            case EVENT_ID -> {
                checkUnseen(slots.eventId, field);
                slots.eventId = readIdentifier(parser, field, EventId::parse);
            }
            case SENDER -> {
                checkUnseen(slots.sender, field);
                slots.sender = readIdentifier(parser, field, UserId::parse);
            }
            case ORIGIN_SERVER_TS -> {
                checkUnseen(slots.originServerTs, field);
                slots.originServerTs = readTimestamp(parser);
            }
            case ROOM_ID -> {
                checkUnseen(slots.roomId, field);
                slots.roomId = readIdentifier(parser, field, RoomId::parse);
            }
            case STATE_KEY -> {
                checkUnseen(slots.stateKey, field);
                slots.stateKey = readString(parser, field);
            }
            case PREV_CONTENT -> {
                checkUnseen(slots.prevContent, field);
                slots.prevContent = readRaw(parser);
            }
            case UNSIGNED -> {
                checkUnseen(slots.unsigned, field);
                slots.unsigned = readUnsigned(parser);
            }
        }
    }

    private StateEvent<C> resolve(Slots slots) {
        String eventType = require(slots.eventType, StateEventField.TYPE);
        C content = resolveContent(StateEventField.CONTENT, eventType, require(slots.content, StateEventField.CONTENT));
        Optional<C> prevContent = slots.prevContent == null
                ? Optional.empty()
                : Optional.of(resolveContent(StateEventField.PREV_CONTENT, eventType, slots.prevContent));

        EventId eventId = require(slots.eventId, StateEventField.EVENT_ID);
        UserId sender = require(slots.sender, StateEventField.SENDER);
        long originServerTs = require(slots.originServerTs, StateEventField.ORIGIN_SERVER_TS);
        RoomId roomId = require(slots.roomId, StateEventField.ROOM_ID);
        String stateKey = require(slots.stateKey, StateEventField.STATE_KEY);
        UnsignedData unsigned = slots.unsigned == null ? UnsignedData.empty() : slots.unsigned;

        return new StateEvent<>(
                content,
                eventId,
                sender,
                Timestamps.fromWire(originServerTs),
                roomId,
                stateKey,
                prevContent,
                unsigned);
    }

    private C resolveContent(StateEventField field, String eventType, RawJson raw) {
        C content;
        try {
            content = resolver.fromParts(eventType, raw);
        } catch (InvalidContentException e) {
            throw StateEventDecodeException.invalidContent(field, e);
        }
        if (content == null) {
            throw StateEventDecodeException.invalidContent(
                    field, new InvalidContentException(eventType, "resolver produced no content"));
        }
        if (!eventType.equals(content.eventType())) {
            throw StateEventDecodeException.invalidContent(
                    field,
                    new InvalidContentException(
                            eventType, "resolver produced content of type '%s'".formatted(content.eventType())));
        }
        return content;
    }

    private static <T> T require(T value, StateEventField field) {
        if (value == null) {
            throw StateEventDecodeException.missingField(field);
        }
        return value;
    }

    private static void checkUnseen(Object slot, StateEventField field) {
        if (slot != null) {
            throw StateEventDecodeException.duplicateField(field);
        }
    }

    private static String readString(JsonParser parser, StateEventField field) throws IOException {
        JsonToken token = parser.currentToken();
        if (token != JsonToken.VALUE_STRING) {
            throw StateEventDecodeException.invalidField(field, "expected a string but found " + describe(token), null);
        }
        return parser.getText();
    }

    private static <T> T readIdentifier(JsonParser parser, StateEventField field, Function<String, T> factory)
            throws IOException {
        String value = readString(parser, field);
        try {
            return factory.apply(value);
        } catch (InvalidIdentifierException e) {
            throw StateEventDecodeException.invalidField(field, e.getMessage(), e);
        }
    }

    private static long readTimestamp(JsonParser parser) throws IOException {
        JsonToken token = parser.currentToken();
        if (token != JsonToken.VALUE_NUMBER_INT) {
            throw StateEventDecodeException.invalidField(
                    StateEventField.ORIGIN_SERVER_TS, "expected an integer but found " + describe(token), null);
        }
        if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
            throw StateEventDecodeException.timestampOverflow(
                    parser.getText() + " exceeds " + Timestamps.MAX_WIRE_VALUE);
        }
        long millis = parser.getLongValue();
        if (!Timestamps.isRepresentable(millis)) {
            throw StateEventDecodeException.timestampOverflow(
                    millis + " is outside [0, " + Timestamps.MAX_WIRE_VALUE + "]");
        }
        return millis;
    }

    /**
     * Copies the value at the parser's position, leaving the parser on its last token. Numbers are
     * written from their source text, so precision and notation survive the copy.
     */
    private RawJson readRaw(JsonParser parser) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = mapper.getFactory().createGenerator(out)) {
            int depth = 0;
            JsonToken token = parser.currentToken();
            while (true) {
                if (token == null) {
                    throw StateEventDecodeException.malformed("unexpected end of input inside a payload", null);
                }
                if (token.isNumeric()) {
                    generator.writeNumber(parser.getText());
                } else {
                    generator.copyCurrentEvent(parser);
                }
                if (token.isStructStart()) {
                    depth++;
                } else if (token.isStructEnd()) {
                    depth--;
                }
                if (depth == 0) {
                    break;
                }
                token = parser.nextToken();
            }
        }
        return new RawJson(out.toString());
    }

    private UnsignedData readUnsigned(JsonParser parser) throws IOException {
        JsonToken token = parser.currentToken();
        if (token != JsonToken.START_OBJECT) {
            throw StateEventDecodeException.invalidField(
                    StateEventField.UNSIGNED, "expected an object but found " + describe(token), null);
        }
        ObjectNode node = mapper.reader()
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .readTree(parser);
        return UnsignedData.of(node);
    }

    private static String describe(JsonToken token) {
        return token == null ? "end of input" : token.toString();
    }

    /** One slot per recognized key; {@code null} means not seen yet. */
    private static final class Slots {
        String eventType;
        RawJson content;
        EventId eventId;
        UserId sender;
        Long originServerTs;
        RoomId roomId;
        String stateKey;
        RawJson prevContent;
        UnsignedData unsigned;
    }
}
