package io.github.drompincen.strata.protocol.event;

public record DebugEvent(String message) implements BridgeEvent {
    @Override public EventType type() { return EventType.DEBUG; }
}
