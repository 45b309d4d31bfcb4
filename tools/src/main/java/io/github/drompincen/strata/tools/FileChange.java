package io.github.drompincen.strata.tools;

import io.github.drompincen.strata.protocol.api.DiffLine;

import java.util.List;

/**
 * A file change block found in assistant text, e.g. {@code Update(src/Main.java)}
 * followed by a summary line and numbered diff lines.
 */
public record FileChange(Action action, String filePath, String summaryLine, List<DiffLine> diffLines) {

    public enum Action { UPDATE, WRITE, READ, CREATE, DELETE }

    public FileChange {
        diffLines = List.copyOf(diffLines);
    }

    public String fileName() {
        int slash = filePath.lastIndexOf('/');
        return slash >= 0 ? filePath.substring(slash + 1) : filePath;
    }
}
