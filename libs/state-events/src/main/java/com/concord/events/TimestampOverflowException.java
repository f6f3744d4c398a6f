package com.concord.events;

/**
 * Thrown when a timestamp cannot be represented as wire milliseconds: either it lies before the
 * Unix epoch or it exceeds {@link Timestamps#MAX_WIRE_VALUE}.
 */
public class TimestampOverflowException extends RuntimeException {

    public TimestampOverflowException(String message) {
        super(message);
    }
}
