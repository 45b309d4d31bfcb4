package io.github.drompincen.strata.protocol.api;

import java.nio.file.Path;

/**
 * Per-session settings handed to a session when it is created or restored.
 * {@code model} and {@code systemPrompt} are optional overrides and may be null.
 */
public record SessionSettings(
        Path workingDirectory,
        PermissionMode permissionMode,
        String model,
        String systemPrompt
) {
    public SessionSettings {
        if (permissionMode == null) permissionMode = PermissionMode.DEFAULT;
        if (systemPrompt != null && systemPrompt.isBlank()) systemPrompt = null;
        if (model != null && model.isBlank()) model = null;
    }

    public static SessionSettings defaults(Path workingDirectory) {
        return new SessionSettings(workingDirectory, PermissionMode.DEFAULT, null, null);
    }

    public SessionSettings withWorkingDirectory(Path dir) {
        return new SessionSettings(dir, permissionMode, model, systemPrompt);
    }

    public SessionSettings withPermissionMode(PermissionMode mode) {
        return new SessionSettings(workingDirectory, mode, model, systemPrompt);
    }
}
