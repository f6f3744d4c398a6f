package com.concord.identifiers;

/**
 * Thrown when a string does not form a valid protocol identifier of the expected kind.
 */
public class InvalidIdentifierException extends RuntimeException {

    private final String kind;
    private final String value;

    public InvalidIdentifierException(String kind, String value, String reason) {
        super("Invalid %s '%s': %s".formatted(kind, value, reason));
        this.kind = kind;
        this.value = value;
    }

    /** The identifier kind that was expected (e.g. "room ID"). */
    public String kind() {
        return kind;
    }

    /** The rejected input. */
    public String value() {
        return value;
    }
}
