package com.concord.events;

/**
 * A content payload that can be carried by a {@link StateEvent}.
 *
 * <p>Implementations are serialized with Jackson when an event is encoded, so their properties
 * must map to the wire schema of their event type.
 */
public interface StateEventContent {

    /** The discriminator written to the event's {@code type} field, e.g. {@code m.room.aliases}. */
    String eventType();
}
