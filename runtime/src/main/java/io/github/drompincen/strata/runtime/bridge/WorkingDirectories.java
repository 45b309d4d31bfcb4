package io.github.drompincen.strata.runtime.bridge;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

public final class WorkingDirectories {

    private WorkingDirectories() {}

    /**
     * Canonicalizes a working directory, resolving symlinks.
     *
     * @return the real path, or empty when the value holds a NUL character, cannot be
     *         resolved, or is not an existing directory
     */
    public static Optional<Path> validate(String rawPath) {
        if (rawPath == null || rawPath.isEmpty() || rawPath.indexOf('\0') >= 0) {
            return Optional.empty();
        }
        try {
            Path real = Path.of(rawPath).toRealPath();
            return Files.isDirectory(real) ? Optional.of(real) : Optional.empty();
        } catch (InvalidPathException | IOException e) {
            return Optional.empty();
        }
    }

    public static Optional<Path> validate(Path path) {
        return path == null ? Optional.empty() : validate(path.toString());
    }
}
