package com.concord.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for decoding and encoding state events of one content type.
 *
 * <pre>{@code
 * StateEventCodec<StateEventContent> codec = StateEventCodec.create(StateEventContentRegistry.defaultRegistry());
 * StateEvent<StateEventContent> event = codec.decode(json);
 * String wire = codec.encode(event);
 * }</pre>
 *
 * @param <C> the content type
 */
public final class StateEventCodec<C extends StateEventContent> {

    private static final Logger log = LoggerFactory.getLogger(StateEventCodec.class);

    private final StateEventDecoder<C> decoder;
    private final StateEventEncoder<C> encoder;

    private StateEventCodec(StateEventDecoder<C> decoder, StateEventEncoder<C> encoder) {
        this.decoder = decoder;
        this.encoder = encoder;
    }

    /** Creates a permissive codec backed by the shared mapper. */
    public static <C extends StateEventContent> StateEventCodec<C> create(StateEventContentResolver<C> resolver) {
        return create(resolver, StateEventCodecConfig.defaults());
    }

    public static <C extends StateEventContent> StateEventCodec<C> create(
            StateEventContentResolver<C> resolver, StateEventCodecConfig config) {
        return create(resolver, config, StateEventJson.objectMapper());
    }

    public static <C extends StateEventContent> StateEventCodec<C> create(
            StateEventContentResolver<C> resolver, StateEventCodecConfig config, ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return new StateEventCodec<>(new StateEventDecoder<>(resolver, config, mapper), new StateEventEncoder<>(mapper));
    }

    /**
     * Decodes a JSON document holding one state event.
     *
     * @throws StateEventDecodeException if the input is malformed or incomplete
     */
    public StateEvent<C> decode(String json) {
        return decoder.decode(json);
    }

    public StateEvent<C> decode(byte[] json) {
        return decoder.decode(json);
    }

    public StateEvent<C> decode(JsonNode json) {
        return decoder.decode(json);
    }

    /** Decodes, returning empty instead of throwing when the input is rejected. */
    public Optional<StateEvent<C>> tryDecode(String json) {
        try {
            return Optional.of(decoder.decode(json));
        } catch (StateEventDecodeException e) {
            log.debug("Rejected state event ({}): {}", e.reason(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Encodes an event as a JSON string.
     *
     * @throws StateEventEncodeException if the timestamp or the content cannot be written
     */
    public String encode(StateEvent<? extends C> event) {
        return encoder.encodeToString(event);
    }

    public byte[] encodeToBytes(StateEvent<? extends C> event) {
        return encoder.encodeToBytes(event);
    }

    public ObjectNode encodeToTree(StateEvent<? extends C> event) {
        return encoder.encodeToTree(event);
    }

    /** A Jackson module that lets an {@link ObjectMapper} read and write {@link StateEvent} with this codec. */
    public StateEventModule module() {
        return new StateEventModule(decoder, encoder);
    }

    public StateEventDecoder<C> decoder() {
        return decoder;
    }

    public StateEventEncoder<C> encoder() {
        return encoder;
    }
}
