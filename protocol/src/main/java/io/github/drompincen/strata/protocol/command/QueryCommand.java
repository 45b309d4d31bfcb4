package io.github.drompincen.strata.protocol.command;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Starts a new exchange. {@code sessionId} is the continuation token of the previous
 * exchange, or null for a fresh conversation.
 */
public record QueryCommand(
        String prompt,
        String cwd,
        String permissionMode,
        String sessionId,
        String model,
        String systemPrompt
) implements BridgeCommand {

    @JsonIgnore
    @Override
    public CommandType commandType() { return CommandType.QUERY; }
}
