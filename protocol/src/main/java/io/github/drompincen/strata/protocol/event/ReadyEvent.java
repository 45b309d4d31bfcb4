package io.github.drompincen.strata.protocol.event;

/** Handshake; {@code nonce} must echo the value generated at launch. May be null. */
public record ReadyEvent(String nonce) implements BridgeEvent {
    @Override public EventType type() { return EventType.READY; }
}
