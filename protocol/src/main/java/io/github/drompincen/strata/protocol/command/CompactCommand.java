package io.github.drompincen.strata.protocol.command;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record CompactCommand(
        String sessionId,
        String cwd,
        String permissionMode,
        String model,
        String focusInstructions
) implements BridgeCommand {

    @JsonIgnore
    @Override
    public CommandType commandType() { return CommandType.COMPACT; }
}
