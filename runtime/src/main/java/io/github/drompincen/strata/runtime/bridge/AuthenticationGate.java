package io.github.drompincen.strata.runtime.bridge;

import io.github.drompincen.strata.protocol.codec.EventDecoder;
import io.github.drompincen.strata.protocol.event.BridgeEvent;
import io.github.drompincen.strata.protocol.event.ReadyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Decodes the lines of one process launch and lets events through only after the process
 * proved it was started by us: its first well-formed message must be {@code ready} with
 * the nonce handed to it in the environment. A wrong first message rejects the process
 * for good.
 * <p>
 * Not thread-safe; used from the reader thread of its process only.
 */
public class AuthenticationGate {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationGate.class);

    public enum State { AWAITING_HANDSHAKE, AUTHENTICATED, REJECTED }

    private final byte[] expectedNonce;
    private final EventDecoder decoder;
    private final int malformedWarnThreshold;

    private State state = State.AWAITING_HANDSHAKE;
    private int consecutiveMalformed;

    public AuthenticationGate(String nonce, EventDecoder decoder, int malformedWarnThreshold) {
        this.expectedNonce = nonce.getBytes(StandardCharsets.UTF_8);
        this.decoder = decoder;
        this.malformedWarnThreshold = malformedWarnThreshold;
    }

    /**
     * @return the event to forward; empty for malformed lines, the handshake itself and
     *         anything arriving after a rejection
     * @throws AuthenticationFailedException once, when the first decoded message is not
     *         a valid handshake
     */
    public Optional<BridgeEvent> admit(String line) {
        if (state == State.REJECTED) {
            return Optional.empty();
        }

        Optional<BridgeEvent> decoded = decoder.decode(line);
        if (decoded.isEmpty()) {
            consecutiveMalformed++;
            if (consecutiveMalformed == malformedWarnThreshold) {
                log.warn("{} consecutive malformed lines from bridge process", consecutiveMalformed);
            }
            return Optional.empty();
        }
        consecutiveMalformed = 0;

        BridgeEvent event = decoded.get();
        if (state == State.AWAITING_HANDSHAKE) {
            if (event instanceof ReadyEvent && nonceMatches(((ReadyEvent) event).nonce())) {
                state = State.AUTHENTICATED;
                log.info("Bridge process authenticated");
                return Optional.empty();
            }
            state = State.REJECTED;
            throw new AuthenticationFailedException("Bridge authentication failed.");
        }

        if (event instanceof ReadyEvent) {
            log.debug("Ignoring repeated ready message");
            return Optional.empty();
        }
        return decoded;
    }

    public State state() {
        return state;
    }

    private boolean nonceMatches(String nonce) {
        return nonce != null && MessageDigest.isEqual(expectedNonce, nonce.getBytes(StandardCharsets.UTF_8));
    }
}
