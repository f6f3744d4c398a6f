package com.concord.events;

import java.util.Optional;

/**
 * Thrown when a wire object cannot be decoded into a {@link StateEvent}. Decoding is atomic: no
 * partially populated event is ever returned alongside this exception.
 */
public class StateEventDecodeException extends RuntimeException {

    /** Why decoding failed. */
    public enum Reason {
        /** A required key never appeared. */
        MISSING_FIELD,
        /** A recognized key appeared more than once. */
        DUPLICATE_FIELD,
        /** The content resolver rejected the discriminator or the payload. */
        INVALID_CONTENT,
        /** {@code origin_server_ts} is negative or larger than the wire maximum. */
        TIMESTAMP_OVERFLOW,
        /** A recognized key carries a value of the wrong JSON type or an invalid identifier. */
        INVALID_FIELD,
        /** An unrecognized key was found while unknown keys are rejected. */
        UNKNOWN_FIELD,
        /** The input is not a single well-formed JSON object. */
        MALFORMED_JSON
    }

    private final Reason reason;
    private final String field;

    private StateEventDecodeException(Reason reason, String field, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.field = field;
    }

    public static StateEventDecodeException missingField(StateEventField field) {
        return new StateEventDecodeException(
                Reason.MISSING_FIELD, field.wireName(), "missing field `%s`".formatted(field.wireName()), null);
    }

    public static StateEventDecodeException duplicateField(StateEventField field) {
        return new StateEventDecodeException(
                Reason.DUPLICATE_FIELD, field.wireName(), "duplicate field `%s`".formatted(field.wireName()), null);
    }

    public static StateEventDecodeException invalidContent(StateEventField field, InvalidContentException cause) {
        return new StateEventDecodeException(
                Reason.INVALID_CONTENT,
                field.wireName(),
                "invalid `%s` for type `%s`: %s".formatted(field.wireName(), cause.eventType(), cause.getMessage()),
                cause);
    }

    public static StateEventDecodeException timestampOverflow(String detail) {
        String name = StateEventField.ORIGIN_SERVER_TS.wireName();
        return new StateEventDecodeException(
                Reason.TIMESTAMP_OVERFLOW, name, "`%s` out of range: %s".formatted(name, detail), null);
    }

    public static StateEventDecodeException invalidField(StateEventField field, String detail, Throwable cause) {
        return new StateEventDecodeException(
                Reason.INVALID_FIELD, field.wireName(), "invalid `%s`: %s".formatted(field.wireName(), detail), cause);
    }

    public static StateEventDecodeException unknownField(String name) {
        return new StateEventDecodeException(Reason.UNKNOWN_FIELD, name, "unknown field `%s`".formatted(name), null);
    }

    public static StateEventDecodeException malformed(String detail, Throwable cause) {
        return new StateEventDecodeException(Reason.MALFORMED_JSON, null, "malformed state event: " + detail, cause);
    }

    public Reason reason() {
        return reason;
    }

    /** The wire key the failure relates to, if any. */
    public Optional<String> field() {
        return Optional.ofNullable(field);
    }
}
