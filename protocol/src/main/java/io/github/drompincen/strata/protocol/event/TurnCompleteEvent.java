package io.github.drompincen.strata.protocol.event;

public record TurnCompleteEvent() implements BridgeEvent {
    public static final TurnCompleteEvent INSTANCE = new TurnCompleteEvent();

    @Override public EventType type() { return EventType.TURN_COMPLETE; }
}
