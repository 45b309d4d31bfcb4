package io.github.drompincen.strata.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only projection of a session, complete enough to rebuild it without
 * replaying the protocol. Produced on demand for the persistence layer.
 *
 * @param continuationToken backend session id used to resume context, may be null
 */
public record SessionSnapshot(
        int version,
        UUID id,
        String name,
        Instant createdAt,
        SessionSettings settings,
        List<ChatMessageDto> messages,
        String continuationToken,
        double totalCost,
        UsageInfo lastUsage,
        List<SessionTask> tasks
) {
    public static final int CURRENT_VERSION = 1;

    public SessionSnapshot {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
