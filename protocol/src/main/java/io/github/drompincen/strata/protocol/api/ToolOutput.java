package io.github.drompincen.strata.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Tool-specific projection of a tool result payload. Only the fields relevant to
 * the tool are populated; {@code raw} holds the payload for tools nobody interprets.
 */
public record ToolOutput(
        String stdout,
        String stderr,
        boolean interrupted,
        String fileContent,
        List<String> filenames,
        Integer fileCount,
        List<DiffLine> diffLines,
        SessionTask task,
        List<SessionTask> tasks,
        JsonNode raw
) {
    public ToolOutput {
        filenames = filenames == null ? null : List.copyOf(filenames);
        diffLines = diffLines == null ? null : List.copyOf(diffLines);
        tasks = tasks == null ? null : List.copyOf(tasks);
    }

    public static ToolOutput empty() {
        return builder().build();
    }

    public static ToolOutput ofStdout(String stdout) {
        return builder().stdout(stdout).build();
    }

    public static ToolOutput ofRaw(JsonNode raw) {
        return builder().raw(raw).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private String stdout;
        private String stderr;
        private boolean interrupted;
        private String fileContent;
        private List<String> filenames;
        private Integer fileCount;
        private List<DiffLine> diffLines;
        private SessionTask task;
        private List<SessionTask> tasks;
        private JsonNode raw;

        public Builder stdout(String stdout) { this.stdout = stdout; return this; }
        public Builder stderr(String stderr) { this.stderr = stderr; return this; }
        public Builder interrupted(boolean interrupted) { this.interrupted = interrupted; return this; }
        public Builder fileContent(String fileContent) { this.fileContent = fileContent; return this; }
        public Builder filenames(List<String> filenames) { this.filenames = filenames; return this; }
        public Builder fileCount(Integer fileCount) { this.fileCount = fileCount; return this; }
        public Builder diffLines(List<DiffLine> diffLines) { this.diffLines = diffLines; return this; }
        public Builder task(SessionTask task) { this.task = task; return this; }
        public Builder tasks(List<SessionTask> tasks) { this.tasks = tasks; return this; }
        public Builder raw(JsonNode raw) { this.raw = raw; return this; }

        public ToolOutput build() {
            return new ToolOutput(stdout, stderr, interrupted, fileContent, filenames, fileCount,
                    diffLines, task, tasks, raw);
        }
    }
}
