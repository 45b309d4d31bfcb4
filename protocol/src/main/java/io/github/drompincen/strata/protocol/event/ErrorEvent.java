package io.github.drompincen.strata.protocol.event;

public record ErrorEvent(String message) implements BridgeEvent {
    @Override public EventType type() { return EventType.ERROR; }
}
