package com.concord.events;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Writes a {@link StateEvent} in its canonical wire form.
 *
 * <p>Keys are written once each, in the order {@code type}, {@code content}, {@code event_id},
 * {@code sender}, {@code origin_server_ts}, {@code room_id}, {@code state_key}. {@code prev_content}
 * follows only when present and {@code unsigned} only when non-empty; neither is ever written as
 * {@code null}.
 *
 * @param <C> the content type
 */
public final class StateEventEncoder<C extends StateEventContent> {

    private final ObjectMapper mapper;

    public StateEventEncoder() {
        this(StateEventJson.objectMapper());
    }

    public StateEventEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Writes {@code event} as one JSON object to {@code generator}. Nothing is written when the
     * timestamp cannot be represented.
     *
     * @throws StateEventEncodeException if the timestamp is out of range
     * @throws IOException if the generator or the content serializer fails
     */
    public void encode(StateEvent<? extends C> event, JsonGenerator generator) throws IOException {
        write(event, generator);
    }

    /** Writes an event of any content type; content goes through the mapper's own binding. */
    void write(StateEvent<?> event, JsonGenerator generator) throws IOException {
        long originServerTs = wireTimestamp(event);

        generator.writeStartObject();
        generator.writeStringField(StateEventField.TYPE.wireName(), event.content().eventType());
        generator.writeFieldName(StateEventField.CONTENT.wireName());
        mapper.writeValue(generator, event.content());
        generator.writeStringField(StateEventField.EVENT_ID.wireName(), event.eventId().value());
        generator.writeStringField(StateEventField.SENDER.wireName(), event.sender().value());
        generator.writeNumberField(StateEventField.ORIGIN_SERVER_TS.wireName(), originServerTs);
        generator.writeStringField(StateEventField.ROOM_ID.wireName(), event.roomId().value());
        generator.writeStringField(StateEventField.STATE_KEY.wireName(), event.stateKey());

        if (event.prevContent().isPresent()) {
            generator.writeFieldName(StateEventField.PREV_CONTENT.wireName());
            mapper.writeValue(generator, event.prevContent().get());
        }
        if (!event.unsigned().isEmpty()) {
            generator.writeFieldName(StateEventField.UNSIGNED.wireName());
            mapper.writeTree(generator, event.unsigned().toJson());
        }
        generator.writeEndObject();
    }

    /** Encodes {@code event} as a JSON string. */
    public String encodeToString(StateEvent<? extends C> event) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = mapper.createGenerator(out)) {
            encode(event, generator);
        } catch (IOException e) {
            throw serializationFailure(event, e);
        }
        return out.toString();
    }

    /** Encodes {@code event} as UTF-8 JSON bytes. */
    public byte[] encodeToBytes(StateEvent<? extends C> event) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator = mapper.createGenerator(out)) {
            encode(event, generator);
        } catch (IOException e) {
            throw serializationFailure(event, e);
        }
        return out.toByteArray();
    }

    /**
     * Encodes {@code event} as a JSON tree whose key order is the wire order. Integers take the
     * node types a parser would give them and decimals keep their exact value.
     */
    public ObjectNode encodeToTree(StateEvent<? extends C> event) {
        String json = encodeToString(event);
        try {
            return (ObjectNode) mapper.reader()
                    .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .readTree(json);
        } catch (IOException e) {
            throw serializationFailure(event, e);
        }
    }

    private static long wireTimestamp(StateEvent<?> event) {
        try {
            return Timestamps.toWire(event.originServerTs());
        } catch (TimestampOverflowException e) {
            throw new StateEventEncodeException(
                    StateEventEncodeException.Reason.TIMESTAMP_OVERFLOW,
                    "Cannot encode event %s: %s".formatted(event.eventId(), e.getMessage()),
                    e);
        }
    }

    private static StateEventEncodeException serializationFailure(StateEvent<?> event, IOException cause) {
        return new StateEventEncodeException(
                StateEventEncodeException.Reason.CONTENT_SERIALIZATION,
                "Failed to serialize event %s: %s".formatted(event.eventId(), cause.getMessage()),
                cause);
    }
}
