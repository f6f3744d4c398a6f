package com.concord.events;

import java.util.Optional;

/**
 * Top-level keys of a state event wire object, in canonical encoding order.
 */
public enum StateEventField {
    TYPE("type"),
    CONTENT("content"),
    EVENT_ID("event_id"),
    SENDER("sender"),
    ORIGIN_SERVER_TS("origin_server_ts"),
    ROOM_ID("room_id"),
    STATE_KEY("state_key"),
    PREV_CONTENT("prev_content"),
    UNSIGNED("unsigned");

    private final String wireName;

    StateEventField(String wireName) {
        this.wireName = wireName;
    }

    /** The JSON key (e.g. "origin_server_ts"). */
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a field by its JSON key.
     *
     * @return the matching field, or empty for keys this codec does not recognize
     */
    public static Optional<StateEventField> fromWireName(String name) {
        for (StateEventField field : values()) {
            if (field.wireName.equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
