package io.github.drompincen.strata.runtime.bridge;

/**
 * Base of every failure of the bridge process or its protocol. Failures of a running
 * process are delivered through {@link BridgeListener#onFailure}, not thrown.
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
