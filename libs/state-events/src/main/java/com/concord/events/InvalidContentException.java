package com.concord.events;

/**
 * Thrown by a {@link StateEventContentResolver} that cannot build content for a discriminator.
 */
public class InvalidContentException extends RuntimeException {

    private final String eventType;

    public InvalidContentException(String eventType, String message) {
        super(message);
        this.eventType = eventType;
    }

    public InvalidContentException(String eventType, String message, Throwable cause) {
        super(message, cause);
        this.eventType = eventType;
    }

    /** No schema is registered for {@code eventType}. */
    public static InvalidContentException unknownEventType(String eventType) {
        return new InvalidContentException(eventType, "Unknown state event type '%s'".formatted(eventType));
    }

    /** The payload does not match the schema registered for {@code eventType}. */
    public static InvalidContentException schemaMismatch(String eventType, Throwable cause) {
        return new InvalidContentException(
                eventType,
                "Content does not match the schema of '%s': %s".formatted(eventType, cause.getMessage()),
                cause);
    }

    /** The discriminator the content was rejected for. */
    public String eventType() {
        return eventType;
    }
}
