package io.github.drompincen.strata.protocol.event;

public record TokenEvent(String text) implements BridgeEvent {
    @Override public EventType type() { return EventType.TOKEN; }
}
