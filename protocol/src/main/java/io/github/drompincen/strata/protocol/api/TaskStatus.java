package io.github.drompincen.strata.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    DELETED("deleted");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    /** Unrecognized or missing statuses read as {@link #PENDING}. */
    @JsonCreator
    public static TaskStatus fromWire(String value) {
        for (TaskStatus status : values()) {
            if (status.wireName.equals(value)) return status;
        }
        return PENDING;
    }
}
