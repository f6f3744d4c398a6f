package com.concord.identifiers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Globally unique identifier of an event, e.g. {@code $h29iv0s8:example.com}.
 *
 * @param value the full identifier including its {@code $} sigil
 */
public record EventId(String value) {

    private static final String KIND = "event ID";
    private static final char SIGIL = '$';

    public EventId {
        IdentifierParser.parseServerOptional(KIND, SIGIL, value);
    }

    /**
     * Parses and validates a wire string.
     *
     * @throws InvalidIdentifierException if {@code value} is not a valid event ID
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EventId parse(String value) {
        return new EventId(value);
    }

    /** The identifier as it appears on the wire. */
    @Override
    @JsonValue
    public String value() {
        return value;
    }

    /** The text between the sigil and the server name. */
    public String localpart() {
        return IdentifierParser.parseServerOptional(KIND, SIGIL, value).localpart();
    }

    /**
     * The server name, absent for event IDs of room versions that no longer embed one.
     */
    public Optional<String> serverName() {
        return IdentifierParser.parseServerOptional(KIND, SIGIL, value).serverName();
    }

    @Override
    public String toString() {
        return value;
    }
}
