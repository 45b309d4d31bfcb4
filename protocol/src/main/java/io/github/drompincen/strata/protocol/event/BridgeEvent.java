package io.github.drompincen.strata.protocol.event;

/**
 * A decoded line from the bridge's stdout.
 */
public interface BridgeEvent {

    EventType type();
}
