package io.github.drompincen.strata.protocol.api;

public record DiffLine(Kind kind, String text, Integer lineNumber) {

    public enum Kind { ADDITION, REMOVAL, CONTEXT, ELLIPSIS }

    public static DiffLine ellipsis() {
        return new DiffLine(Kind.ELLIPSIS, "...", null);
    }
}
