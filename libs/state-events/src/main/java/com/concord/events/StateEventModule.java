package com.concord.events;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Jackson module binding {@link StateEvent} to a {@link StateEventDecoder} and
 * {@link StateEventEncoder}, so that a state event can be read or written as a property of a larger
 * document.
 *
 * <p>Codec failures surface as {@link JsonMappingException} with the
 * {@link StateEventDecodeException} or {@link StateEventEncodeException} as cause.
 */
public class StateEventModule extends SimpleModule {

    public <C extends StateEventContent> StateEventModule(StateEventDecoder<C> decoder, StateEventEncoder<C> encoder) {
        super("StateEventModule");
        addSerializer(new Serializer(encoder));
        addDeserializer(StateEvent.class, new Deserializer(decoder));
    }

    private static final class Serializer extends StdSerializer<StateEvent<?>> {

        private final StateEventEncoder<?> encoder;

        Serializer(StateEventEncoder<?> encoder) {
            super(StateEvent.class, false);
            this.encoder = encoder;
        }

        @Override
        public void serialize(StateEvent<?> value, JsonGenerator generator, SerializerProvider provider)
                throws IOException {
            try {
                encoder.write(value, generator);
            } catch (StateEventEncodeException e) {
                throw JsonMappingException.from(provider, e.getMessage(), e);
            }
        }
    }

    private static final class Deserializer extends StdDeserializer<StateEvent<?>> {

        private final StateEventDecoder<?> decoder;

        Deserializer(StateEventDecoder<?> decoder) {
            super(StateEvent.class);
            this.decoder = decoder;
        }

        @Override
        public StateEvent<?> deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            try {
                return decoder.decode(parser);
            } catch (StateEventDecodeException e) {
                throw JsonMappingException.from(parser, e.getMessage(), e);
            }
        }
    }
}
