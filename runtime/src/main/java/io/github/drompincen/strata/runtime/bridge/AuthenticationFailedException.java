package io.github.drompincen.strata.runtime.bridge;

/** The first message of a freshly launched process was not a handshake carrying its nonce. */
public class AuthenticationFailedException extends BridgeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
