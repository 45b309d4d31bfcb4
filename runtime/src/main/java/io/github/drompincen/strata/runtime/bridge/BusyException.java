package io.github.drompincen.strata.runtime.bridge;

/** Thrown by {@link BridgeChannel#send} when a request is already in flight. */
public class BusyException extends BridgeException {

    public BusyException(String message) {
        super(message);
    }
}
