package io.github.drompincen.strata.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A finished tool invocation. {@code input} is always an object node (possibly empty);
 * {@code result} is whatever the backend sent, including a plain string or null.
 */
public record ToolActivityEvent(String toolName, JsonNode input, JsonNode result) implements BridgeEvent {
    @Override public EventType type() { return EventType.TOOL_ACTIVITY; }
}
