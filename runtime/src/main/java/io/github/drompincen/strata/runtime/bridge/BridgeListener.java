package io.github.drompincen.strata.runtime.bridge;

import io.github.drompincen.strata.protocol.event.BridgeEvent;

/**
 * Receives what the bridge process produces. Both callbacks run on the dispatcher,
 * in the order the process wrote its output.
 */
public interface BridgeListener {

    void onEvent(BridgeEvent event);

    void onFailure(BridgeException failure);
}
