package io.github.drompincen.strata.protocol.event;

import io.github.drompincen.strata.protocol.api.UsageInfo;

/**
 * Completion of an exchange.
 *
 * @param sessionId continuation token for the next query, may be null
 * @param usage token accounting, null when the backend sent none
 */
public record ResultEvent(String text, String sessionId, UsageInfo usage) implements BridgeEvent {
    @Override public EventType type() { return EventType.RESULT; }
}
