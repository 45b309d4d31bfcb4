package io.github.drompincen.strata.runtime.bridge;

import java.nio.file.Path;
import java.util.List;

/**
 * Interpreter and script of the bridge process. The process runs in the script's directory.
 */
public record LaunchSpec(Path interpreter, Path script) {

    public List<String> command() {
        return List.of(interpreter.toString(), script.toString());
    }

    public Path directory() {
        Path parent = script.toAbsolutePath().getParent();
        return parent != null ? parent : script.toAbsolutePath();
    }
}
