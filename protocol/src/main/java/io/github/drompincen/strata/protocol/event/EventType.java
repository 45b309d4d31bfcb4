package io.github.drompincen.strata.protocol.event;

public enum EventType {
    READY("ready"),
    TOKEN("token"),
    SET_TEXT("set_text"),
    PERMISSION_REQUEST("permission_request"),
    RESULT("result"),
    ERROR("error"),
    TURN_COMPLETE("turn_complete"),
    TOOL_ACTIVITY("tool_activity"),
    TOOL_PROGRESS("tool_progress"),
    TOOL_USE_SUMMARY("tool_use_summary"),
    DEBUG("debug"),
    UNKNOWN("");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /** Tags this version does not know map to {@link #UNKNOWN}, never to an error. */
    public static EventType fromWire(String tag) {
        if (tag == null || tag.isEmpty()) return UNKNOWN;
        for (EventType type : values()) {
            if (type.wireName.equals(tag)) return type;
        }
        return UNKNOWN;
    }
}
