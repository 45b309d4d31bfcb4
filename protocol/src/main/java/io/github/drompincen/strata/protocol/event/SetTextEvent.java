package io.github.drompincen.strata.protocol.event;

/** Full replacement of the text streamed so far in the current turn. */
public record SetTextEvent(String text) implements BridgeEvent {
    @Override public EventType type() { return EventType.SET_TEXT; }
}
