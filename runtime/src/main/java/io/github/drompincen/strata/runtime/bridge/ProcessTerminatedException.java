package io.github.drompincen.strata.runtime.bridge;

public class ProcessTerminatedException extends BridgeException {

    public ProcessTerminatedException(String message) {
        super(message);
    }

    public ProcessTerminatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
