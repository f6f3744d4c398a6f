package com.concord.identifiers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human-readable alias of a room, e.g. {@code #somewhere:localhost}.
 *
 * @param value the full identifier including its {@code #} sigil
 */
public record RoomAliasId(String value) {

    private static final String KIND = "room alias";
    private static final char SIGIL = '#';

    public RoomAliasId {
        IdentifierParser.parse(KIND, SIGIL, value);
    }

    /**
     * Parses and validates a wire string.
     *
     * @throws InvalidIdentifierException if {@code value} is not a valid room alias
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RoomAliasId parse(String value) {
        return new RoomAliasId(value);
    }

    /** The identifier as it appears on the wire. */
    @Override
    @JsonValue
    public String value() {
        return value;
    }

    /** The text between the sigil and the server name. */
    public String localpart() {
        return IdentifierParser.parse(KIND, SIGIL, value).localpart();
    }

    /**
     * The server name (host with optional port) after the first colon.
     */
    public String serverName() {
        return IdentifierParser.parse(KIND, SIGIL, value).serverName().orElseThrow();
    }

    @Override
    public String toString() {
        return value;
    }
}
