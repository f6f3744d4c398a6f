package com.concord.events;

import java.time.Duration;
import java.time.Instant;

/**
 * Converts between {@link Instant} and the wire form of {@code origin_server_ts}: a non-negative
 * count of milliseconds since the Unix epoch.
 */
public final class Timestamps {

    /** Largest integer a JSON number can carry without loss of precision (2^53 - 1). */
    public static final long MAX_WIRE_VALUE = 9_007_199_254_740_991L;

    private Timestamps() {
        // utility class
    }

    /**
     * Milliseconds elapsed from the epoch to {@code instant}. Sub-millisecond precision is
     * truncated.
     *
     * @throws TimestampOverflowException if {@code instant} is before the epoch or too far after it
     */
    public static long toWire(Instant instant) {
        if (instant.isBefore(Instant.EPOCH)) {
            throw new TimestampOverflowException("Timestamp " + instant + " is before the Unix epoch");
        }
        long millis;
        try {
            millis = Duration.between(Instant.EPOCH, instant).toMillis();
        } catch (ArithmeticException e) {
            throw new TimestampOverflowException("Timestamp " + instant + " does not fit in 64 bits of milliseconds");
        }
        if (millis > MAX_WIRE_VALUE) {
            throw new TimestampOverflowException(
                    "Timestamp " + instant + " exceeds the maximum of " + MAX_WIRE_VALUE + " ms");
        }
        return millis;
    }

    /** The instant {@code millis} milliseconds after the epoch. Performs no range check. */
    public static Instant fromWire(long millis) {
        return Instant.EPOCH.plusMillis(millis);
    }

    /** Whether {@code millis} lies within {@code [0, MAX_WIRE_VALUE]}. */
    public static boolean isRepresentable(long millis) {
        return millis >= 0 && millis <= MAX_WIRE_VALUE;
    }
}
