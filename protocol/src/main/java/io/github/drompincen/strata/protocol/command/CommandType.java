package io.github.drompincen.strata.protocol.command;

public enum CommandType {
    QUERY("query"),
    COMPACT("compact"),
    PERMISSION_RESPONSE("permission_response"),
    CANCEL("cancel");

    private final String wireName;

    CommandType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
