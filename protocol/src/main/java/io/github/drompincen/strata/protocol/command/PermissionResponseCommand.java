package io.github.drompincen.strata.protocol.command;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record PermissionResponseCommand(
        String requestId,
        String behavior,
        String message
) implements BridgeCommand {

    public static final String ALLOW = "allow";
    public static final String DENY = "deny";

    public static PermissionResponseCommand allow(String requestId) {
        return new PermissionResponseCommand(requestId, ALLOW, null);
    }

    public static PermissionResponseCommand deny(String requestId, String message) {
        return new PermissionResponseCommand(requestId, DENY, message);
    }

    @JsonIgnore
    @Override
    public CommandType commandType() { return CommandType.PERMISSION_RESPONSE; }
}
