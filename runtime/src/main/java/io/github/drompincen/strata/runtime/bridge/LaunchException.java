package io.github.drompincen.strata.runtime.bridge;

/** The interpreter or bridge script could not be found, or the process failed to start. */
public class LaunchException extends BridgeException {

    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
