package io.github.drompincen.strata.protocol.event;

/**
 * A well-formed message the session does not act on: the reserved
 * {@code tool_progress}/{@code tool_use_summary} tags, or a tag newer than this client.
 *
 * @param wireType the tag as received
 */
public record IgnoredEvent(EventType type, String wireType) implements BridgeEvent {}
