package com.concord.events;

/**
 * Thrown when a {@link StateEvent} cannot be written to its wire form.
 */
public class StateEventEncodeException extends RuntimeException {

    /** Why encoding failed. */
    public enum Reason {
        /** {@code origin_server_ts} is before the epoch or beyond the wire maximum. */
        TIMESTAMP_OVERFLOW,
        /** Jackson could not write the content or the output. */
        CONTENT_SERIALIZATION
    }

    private final Reason reason;

    public StateEventEncodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
