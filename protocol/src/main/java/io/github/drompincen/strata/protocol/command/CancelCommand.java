package io.github.drompincen.strata.protocol.command;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record CancelCommand() implements BridgeCommand {

    public static final CancelCommand INSTANCE = new CancelCommand();

    @JsonIgnore
    @Override
    public CommandType commandType() { return CommandType.CANCEL; }
}
