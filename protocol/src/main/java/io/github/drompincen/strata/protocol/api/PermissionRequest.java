package io.github.drompincen.strata.protocol.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * A request from the backend to allow or deny a tool use.
 *
 * @param id correlation id; the matching permission_response must carry it back
 * @param inputSummary the tool input flattened to strings
 * @param workingDirectory directory the session is scoped to, may be null
 */
public record PermissionRequest(
        String id,
        String toolName,
        Map<String, String> inputSummary,
        String reason,
        Path workingDirectory
) {
    public PermissionRequest {
        inputSummary = inputSummary == null ? Map.of() : Map.copyOf(inputSummary);
    }

    public String displayDescription() {
        return switch (toolName) {
            case "Bash" -> inputSummary.getOrDefault("command", "Run a command");
            case "Edit" -> "Edit " + inputSummary.getOrDefault("file_path", "a file");
            case "Write" -> "Write to " + inputSummary.getOrDefault("file_path", "a file")
                    + " (" + inputSummary.getOrDefault("contentLength", "?") + " chars)";
            case "Read" -> "Read " + inputSummary.getOrDefault("file_path", "a file");
            default -> toolName;
        };
    }

    /**
     * Whether the targeted file lies outside the working directory. Both paths are
     * normalized first, so {@code ..} segments cannot escape and {@code /project}
     * does not contain {@code /projectEVIL}.
     */
    public boolean targetsOutsideWorkingDirectory() {
        if (workingDirectory == null) return false;
        String target = inputSummary.getOrDefault("file_path", inputSummary.getOrDefault("path", ""));
        if (target.isEmpty()) return false;

        Path cwd = workingDirectory.toAbsolutePath().normalize();
        Path file = cwd.resolve(target).normalize();
        return !file.startsWith(cwd);
    }
}
