package com.concord.events;

import com.concord.events.StateEventDecodeException.Reason;
import com.concord.events.room.AliasesEventContent;
import com.concord.identifiers.InvalidIdentifierException;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static com.concord.events.StateEventFixtures.CODEC;
import static com.concord.events.StateEventFixtures.EVENT_ID;
import static com.concord.events.StateEventFixtures.ROOM_ID;
import static com.concord.events.StateEventFixtures.SENDER;
import static com.concord.events.StateEventFixtures.aliases;
import static com.concord.events.StateEventFixtures.aliasesWire;
import static com.concord.events.StateEventFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for StateEventDecoder.
 *
 * Key order independence, missing and duplicate keys, timestamp bounds, content
 * resolution, strict mode, and malformed input.
 */
@DisplayName("StateEventDecoder")
class StateEventDecoderTest {

    private static void assertRejected(ThrowingCallable decode, Reason reason, String field) {
        assertThatThrownBy(decode)
                .isInstanceOf(StateEventDecodeException.class)
                .satisfies(e -> {
                    var failure = (StateEventDecodeException) e;
                    assertThat(failure.reason()).isEqualTo(reason);
                    assertThat(failure.field()).contains(field);
                });
    }

    @Nested
    @DisplayName("well-formed input")
    class WellFormed {

        @Test
        @DisplayName("decodes aliases with prev_content when type comes last")
        void aliasesWithPrevContentTypeLast() {
            var json = """
                    {"content":{"aliases":["#a:x"]},"event_id":"$1:x","origin_server_ts":1,\
                    "prev_content":{"aliases":["#b:x"]},"room_id":"!r:x","sender":"@u:x",\
                    "state_key":"","type":"m.room.aliases"}""";

            var event = CODEC.decode(json);

            assertThat(event.content()).isEqualTo(aliases("#a:x"));
            assertThat(event.prevContent()).contains(aliases("#b:x"));
            assertThat(event.eventId().value()).isEqualTo("$1:x");
            assertThat(event.sender().value()).isEqualTo("@u:x");
            assertThat(event.roomId().value()).isEqualTo("!r:x");
            assertThat(event.originServerTs()).isEqualTo(Instant.ofEpochMilli(1));
            assertThat(event.stateKey()).isEmpty();
            assertThat(event.unsigned().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("decodes without prev_content as absent")
        void withoutPrevContent() {
            var event = CODEC.decode(json(aliasesWire()));

            assertThat(event.prevContent()).isEmpty();
            assertThat(event.content()).isInstanceOf(AliasesEventContent.class);
            assertThat(event.eventId()).isEqualTo(EVENT_ID);
            assertThat(event.sender()).isEqualTo(SENDER);
            assertThat(event.roomId()).isEqualTo(ROOM_ID);
        }

        @Test
        @DisplayName("yields the same event whatever the position of type")
        void orderIndependent() {
            var typeFirst = """
                    {"type":"m.room.aliases","content":{"aliases":["#a:x"]},"prev_content":{"aliases":["#b:x"]},\
                    "event_id":"$1:x","sender":"@u:x","origin_server_ts":7,"room_id":"!r:x","state_key":""}""";
            var typeBetween = """
                    {"content":{"aliases":["#a:x"]},"type":"m.room.aliases","prev_content":{"aliases":["#b:x"]},\
                    "event_id":"$1:x","sender":"@u:x","origin_server_ts":7,"room_id":"!r:x","state_key":""}""";
            var typeLast = """
                    {"content":{"aliases":["#a:x"]},"prev_content":{"aliases":["#b:x"]},"event_id":"$1:x",\
                    "sender":"@u:x","origin_server_ts":7,"room_id":"!r:x","state_key":"","type":"m.room.aliases"}""";

            var expected = CODEC.decode(typeFirst);

            assertThat(CODEC.decode(typeBetween)).isEqualTo(expected);
            assertThat(CODEC.decode(typeLast)).isEqualTo(expected);
        }

        @Test
        @DisplayName("keeps a non-empty state_key")
        void userStateKey() {
            var wire = aliasesWire().put("state_key", "@carl:example.com");
            assertThat(CODEC.decode(json(wire)).stateKey()).isEqualTo("@carl:example.com");
        }

        @Test
        @DisplayName("reads unsigned data")
        void unsigned() {
            var wire = aliasesWire();
            wire.putObject("unsigned").put("age", 1234).put("transaction_id", "txn1");

            var unsigned = CODEC.decode(json(wire)).unsigned();

            assertThat(unsigned.age()).contains(1234L);
            assertThat(unsigned.transactionId()).contains("txn1");
        }

        @Test
        @DisplayName("decodes from bytes and from a tree")
        void bytesAndTree() {
            var wire = aliasesWire();
            var fromString = CODEC.decode(json(wire));

            assertThat(CODEC.decode(json(wire).getBytes(java.nio.charset.StandardCharsets.UTF_8))).isEqualTo(fromString);
            assertThat(CODEC.decode(wire)).isEqualTo(fromString);
        }

        @Test
        @DisplayName("ignores unknown top-level keys, nested structure included")
        void ignoresUnknownKeys() {
            var wire = aliasesWire();
            wire.put("age", 5);
            wire.putObject("redacts").put("type", "m.room.avatar").putObject("content").put("url", "x");
            wire.putArray("auth_events").add("$a:x");

            assertThat(CODEC.decode(json(wire))).isEqualTo(CODEC.decode(json(aliasesWire())));
        }
    }

    @Nested
    @DisplayName("missing fields")
    class MissingFields {

        @ParameterizedTest
        @ValueSource(strings = {"type", "content", "event_id", "sender", "origin_server_ts", "room_id", "state_key"})
        @DisplayName("each required field is reported by name")
        void requiredField(String field) {
            var wire = aliasesWire();
            wire.remove(field);

            assertRejected(() -> CODEC.decode(json(wire)), Reason.MISSING_FIELD, field);
        }

        @Test
        @DisplayName("an empty object lacks type first")
        void emptyObject() {
            assertRejected(() -> CODEC.decode("{}"), Reason.MISSING_FIELD, "type");
        }

        @Test
        @DisplayName("type is checked before content is resolved")
        void typeBeforeContent() {
            assertRejected(
                    () -> CODEC.decode("{\"content\":{\"aliases\":\"not a list\"}}"), Reason.MISSING_FIELD, "type");
        }
    }

    @Nested
    @DisplayName("duplicate fields")
    class DuplicateFields {

        @Test
        @DisplayName("rejects two event_id keys even with equal values")
        void duplicateEventId() {
            var json = json(aliasesWire()).replace(
                    "\"event_id\":\"$h29iv0s8:example.com\"",
                    "\"event_id\":\"$h29iv0s8:example.com\",\"event_id\":\"$h29iv0s8:example.com\"");

            assertRejected(() -> CODEC.decode(json), Reason.DUPLICATE_FIELD, "event_id");
        }

        @Test
        @DisplayName("rejects two type keys")
        void duplicateType() {
            var json = json(aliasesWire()).replaceFirst("\\{", "{\"type\":\"m.room.aliases\",");

            assertRejected(() -> CODEC.decode(json), Reason.DUPLICATE_FIELD, "type");
        }

        @ParameterizedTest
        @ValueSource(strings = {"content", "prev_content", "unsigned"})
        @DisplayName("rejects repeated object-valued keys")
        void duplicateObjects(String field) {
            var json = json(aliasesWire()).replaceFirst(
                    "\\{", "{\"%s\":{},\"%s\":{},".formatted(field, field));

            assertRejected(() -> CODEC.decode(json), Reason.DUPLICATE_FIELD, field);
        }
    }

    @Nested
    @DisplayName("origin_server_ts")
    class OriginServerTs {

        @Test
        @DisplayName("zero is the epoch")
        void zero() {
            var wire = aliasesWire().put("origin_server_ts", 0);
            assertThat(CODEC.decode(json(wire)).originServerTs()).isEqualTo(Instant.EPOCH);
        }

        @Test
        @DisplayName("the largest safe integer is accepted")
        void maximum() {
            var wire = aliasesWire().put("origin_server_ts", Timestamps.MAX_WIRE_VALUE);
            assertThat(CODEC.decode(json(wire)).originServerTs())
                    .isEqualTo(Instant.ofEpochMilli(Timestamps.MAX_WIRE_VALUE));
        }

        @ParameterizedTest
        @ValueSource(strings = {"9007199254740992", "-1", "123456789012345678901234567890"})
        @DisplayName("values outside the wire range overflow")
        void outOfRange(String value) {
            var json = json(aliasesWire()).replace("\"origin_server_ts\":1", "\"origin_server_ts\":" + value);

            assertRejected(() -> CODEC.decode(json), Reason.TIMESTAMP_OVERFLOW, "origin_server_ts");
        }

        @ParameterizedTest
        @ValueSource(strings = {"1.5", "\"1\"", "null"})
        @DisplayName("non-integers are invalid")
        void notAnInteger(String value) {
            var json = json(aliasesWire()).replace("\"origin_server_ts\":1", "\"origin_server_ts\":" + value);

            assertRejected(() -> CODEC.decode(json), Reason.INVALID_FIELD, "origin_server_ts");
        }
    }

    @Nested
    @DisplayName("invalid values")
    class InvalidValues {

        @Test
        @DisplayName("an invalid identifier names its field")
        void invalidIdentifier() {
            var wire = aliasesWire().put("room_id", "roomid:room.com");

            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_FIELD, "room_id");
            assertThatThrownBy(() -> CODEC.decode(json(wire)))
                    .hasCauseInstanceOf(InvalidIdentifierException.class);
        }

        @Test
        @DisplayName("a sender of the wrong JSON type is invalid")
        void senderNotString() {
            var wire = aliasesWire().put("sender", 5);
            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_FIELD, "sender");
        }

        @Test
        @DisplayName("a non-string type is invalid")
        void typeNotString() {
            var wire = aliasesWire();
            wire.putArray("type");
            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_FIELD, "type");
        }

        @Test
        @DisplayName("a null state_key is invalid")
        void nullStateKey() {
            var wire = aliasesWire().putNull("state_key");
            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_FIELD, "state_key");
        }

        @Test
        @DisplayName("unsigned must be an object")
        void unsignedNotObject() {
            var wire = aliasesWire().put("unsigned", "age");
            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_FIELD, "unsigned");
        }
    }

    @Nested
    @DisplayName("content resolution")
    class ContentResolution {

        @Test
        @DisplayName("an unregistered type fails with the discriminator")
        void unknownType() {
            var wire = aliasesWire().put("type", "m.room.topic");

            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_CONTENT, "content");
            assertThatThrownBy(() -> CODEC.decode(json(wire)))
                    .hasMessageContaining("m.room.topic")
                    .cause()
                    .isInstanceOf(InvalidContentException.class)
                    .satisfies(e -> assertThat(((InvalidContentException) e).eventType()).isEqualTo("m.room.topic"));
        }

        @Test
        @DisplayName("content not matching the schema fails")
        void contentSchemaMismatch() {
            var wire = aliasesWire();
            wire.putObject("content").put("aliases", "#somewhere:localhost");

            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_CONTENT, "content");
        }

        @Test
        @DisplayName("prev_content is resolved with the envelope's type")
        void prevContentSchemaMismatch() {
            var wire = aliasesWire();
            wire.putObject("prev_content").put("url", "mxc://matrix.org/avatar");

            assertRejected(() -> CODEC.decode(json(wire)), Reason.INVALID_CONTENT, "prev_content");
        }

        @Test
        @DisplayName("a resolver answering with another type is rejected")
        void resolverTypeMismatch() {
            StateEventContentResolver<StateEventContent> lying = (type, raw) -> () -> "m.room.other";
            var decoder = new StateEventDecoder<>(lying);

            assertRejected(() -> decoder.decode(json(aliasesWire())), Reason.INVALID_CONTENT, "content");
        }

        @Test
        @DisplayName("the resolver receives the payload text untouched")
        void rawPayload() {
            var seen = new java.util.ArrayList<RawJson>();
            StateEventContentResolver<StateEventContent> recording = (type, raw) -> {
                seen.add(raw);
                return () -> type;
            };
            var json = """
                    {"content":{"b":[1,2.5,"x"],"a":{"n":null}},"type":"m.custom","event_id":"$1:x",\
                    "sender":"@u:x","origin_server_ts":1,"room_id":"!r:x","state_key":"k"}""";

            new StateEventDecoder<>(recording).decode(json);

            assertThat(seen).extracting(RawJson::json).containsExactly("{\"b\":[1,2.5,\"x\"],\"a\":{\"n\":null}}");
        }

        @Test
        @DisplayName("hands numbers to the resolver as they were written")
        void rawPayloadNumbers() {
            var seen = new java.util.ArrayList<RawJson>();
            StateEventContentResolver<StateEventContent> recording = (type, raw) -> {
                seen.add(raw);
                return () -> type;
            };
            var payload = "{\"p\":0.10000000000000000000001,\"e\":1e2,\"big\":1e400,\"n\":[-0.0,12345678901234567890]}";
            var json = """
                    {"type":"m.custom","event_id":"$1:x","sender":"@u:x","origin_server_ts":1,\
                    "room_id":"!r:x","state_key":"k","content":%s,"prev_content":%s}""".formatted(payload, payload);

            new StateEventDecoder<>(recording).decode(json);
            new StateEventDecoder<>(recording).decode(json.getBytes(java.nio.charset.StandardCharsets.UTF_8));

            assertThat(seen).extracting(RawJson::json).containsOnly(payload).hasSize(4);
        }
    }

    @Nested
    @DisplayName("unknown keys in strict mode")
    class Strict {

        private final StateEventCodec<StateEventContent> strict =
                StateEventCodec.create(StateEventContentRegistry.defaultRegistry(), StateEventCodecConfig.strict());

        @Test
        @DisplayName("rejects an unrecognized key")
        void rejectsUnknown() {
            var wire = aliasesWire().put("age", 5);
            assertRejected(() -> strict.decode(json(wire)), Reason.UNKNOWN_FIELD, "age");
        }

        @Test
        @DisplayName("accepts a fully recognized object")
        void acceptsKnown() {
            assertThat(strict.decode(json(aliasesWire()))).isEqualTo(CODEC.decode(json(aliasesWire())));
        }
    }

    @Nested
    @DisplayName("malformed input")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {"", "not json", "[1,2]", "\"event\"", "{\"type\":"})
        @DisplayName("anything but a single JSON object is malformed")
        void malformed(String input) {
            assertThatThrownBy(() -> CODEC.decode(input))
                    .isInstanceOf(StateEventDecodeException.class)
                    .extracting(e -> ((StateEventDecodeException) e).reason())
                    .isEqualTo(Reason.MALFORMED_JSON);
        }

        @Test
        @DisplayName("a complete event followed by more content is malformed")
        void trailingContent() {
            var input = json(aliasesWire()) + " {}";
            assertThatThrownBy(() -> CODEC.decode(input))
                    .isInstanceOf(StateEventDecodeException.class)
                    .hasMessageContaining("trailing");
        }

        @Test
        @DisplayName("a non-object tree is malformed")
        void nonObjectTree() {
            var array = StateEventJson.objectMapper().createArrayNode();
            assertThatThrownBy(() -> CODEC.decode(array))
                    .isInstanceOf(StateEventDecodeException.class)
                    .extracting(e -> ((StateEventDecodeException) e).reason())
                    .isEqualTo(Reason.MALFORMED_JSON);
        }
    }
}
