package io.github.drompincen.strata.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    USER, ASSISTANT, SYSTEM, TOOL;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
