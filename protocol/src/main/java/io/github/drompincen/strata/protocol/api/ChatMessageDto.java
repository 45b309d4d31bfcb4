package io.github.drompincen.strata.protocol.api;

import java.time.Instant;
import java.util.UUID;

public record ChatMessageDto(
        UUID id,
        MessageRole role,
        String text,
        Instant timestamp,
        ToolActivity toolActivity
) {}
