package io.github.drompincen.strata.protocol.event;

import java.util.Map;

/**
 * @param input the tool input flattened to strings; nested values keep their JSON text
 */
public record PermissionRequestEvent(
        String requestId,
        String toolName,
        Map<String, String> input,
        String reason
) implements BridgeEvent {
    public PermissionRequestEvent {
        input = input == null ? Map.of() : Map.copyOf(input);
    }

    @Override public EventType type() { return EventType.PERMISSION_REQUEST; }
}
