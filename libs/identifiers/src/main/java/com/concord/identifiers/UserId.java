package com.concord.identifiers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fully-qualified identifier of a user, e.g. {@code @carl:example.com}.
 *
 * @param value the full identifier including its {@code @} sigil
 */
public record UserId(String value) {

    private static final String KIND = "user ID";
    private static final char SIGIL = '@';

    public UserId {
        IdentifierParser.parse(KIND, SIGIL, value);
    }

    /**
     * Parses and validates a wire string.
     *
     * @throws InvalidIdentifierException if {@code value} is not a valid user ID
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static UserId parse(String value) {
        return new UserId(value);
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
