package com.concord.identifiers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifier of a room, e.g. {@code !roomid:room.com}.
 *
 * @param value the full identifier including its {@code !} sigil
 */
public record RoomId(String value) {

    private static final String KIND = "room ID";
    private static final char SIGIL = '!';

    public RoomId {
        IdentifierParser.parse(KIND, SIGIL, value);
    }

    /**
     * Parses and validates a wire string.
     *
     * @throws InvalidIdentifierException if {@code value} is not a valid room ID
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RoomId parse(String value) {
        return new RoomId(value);
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
