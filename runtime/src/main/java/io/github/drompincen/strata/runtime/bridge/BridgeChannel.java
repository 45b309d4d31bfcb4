package io.github.drompincen.strata.runtime.bridge;

import io.github.drompincen.strata.protocol.command.BridgeCommand;

/**
 * The session's only way to talk to the backend.
 */
public interface BridgeChannel {

    void setListener(BridgeListener listener);

    /**
     * Writes a command, launching the process first when needed.
     *
     * @throws BusyException if the command starts a request while another one is in flight
     */
    void send(BridgeCommand command);

    /** Asks the backend to abandon the current request and forgets it locally. */
    void cancel();

    void respondToPermission(String requestId, boolean allow, String message);

    boolean isRunning();

    void shutdown();
}
