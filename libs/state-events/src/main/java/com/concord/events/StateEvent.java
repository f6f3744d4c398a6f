package com.concord.events;

import com.concord.identifiers.EventId;
import com.concord.identifiers.RoomId;
import com.concord.identifiers.UserId;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A state event: an overwritable fact about a room, keyed by room, {@code type} and
 * {@code stateKey}.
 *
 * <p>The {@code type} discriminator is not stored; it is always {@code content.eventType()}, and
 * {@code prevContent}, when present, must report the same type.
 *
 * @param content data specific to the event type
 * @param eventId globally unique identifier of this event
 * @param sender the user who sent the event
 * @param originServerTs when the originating server received the event
 * @param roomId the room the event belongs to
 * @param stateKey defines the overwrite semantics of this piece of state; often empty, sometimes a
 *     user ID naming the affected user
 * @param prevContent the state this event replaced, if the server included it
 * @param unsigned data outside the event signature
 * @param <C> the content type
 */
public record StateEvent<C extends StateEventContent>(
        C content,
        EventId eventId,
        UserId sender,
        Instant originServerTs,
        RoomId roomId,
        String stateKey,
        Optional<C> prevContent,
        UnsignedData unsigned) {

    public StateEvent {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(originServerTs, "originServerTs");
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(stateKey, "stateKey");
        prevContent = prevContent == null ? Optional.empty() : prevContent;
        unsigned = unsigned == null ? UnsignedData.empty() : unsigned;
        prevContent.ifPresent(prev -> {
            if (!prev.eventType().equals(content.eventType())) {
                throw new IllegalArgumentException("prevContent type '%s' does not match content type '%s'"
                        .formatted(prev.eventType(), content.eventType()));
            }
        });
    }

    /** Creates an event without previous content or unsigned data. */
    public StateEvent(C content, EventId eventId, UserId sender, Instant originServerTs, RoomId roomId, String stateKey) {
        this(content, eventId, sender, originServerTs, roomId, stateKey, Optional.empty(), UnsignedData.empty());
    }

    /** The discriminator of this event, taken from its content. */
    public String eventType() {
        return content.eventType();
    }

    /** Returns a copy carrying {@code prevContent}. */
    public StateEvent<C> withPrevContent(C prevContent) {
        return new StateEvent<>(
                content, eventId, sender, originServerTs, roomId, stateKey, Optional.of(prevContent), unsigned);
    }

    /** Returns a copy carrying {@code unsigned}. */
    public StateEvent<C> withUnsigned(UnsignedData unsigned) {
        return new StateEvent<>(content, eventId, sender, originServerTs, roomId, stateKey, prevContent, unsigned);
    }
}
