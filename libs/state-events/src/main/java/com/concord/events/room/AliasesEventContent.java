package com.concord.events.room;

import com.concord.events.StateEventContent;
import com.concord.identifiers.RoomAliasId;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Content of {@code m.room.aliases}: the aliases a server has published for a room. The state key
 * is the server name.
 *
 * @param aliases the room's aliases on that server, possibly empty
 */
public record AliasesEventContent(@JsonProperty("aliases") List<RoomAliasId> aliases) implements StateEventContent {

    public static final String EVENT_TYPE = "m.room.aliases";

    public AliasesEventContent {
        aliases = List.copyOf(Objects.requireNonNull(aliases, "aliases"));
    }

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }
}
