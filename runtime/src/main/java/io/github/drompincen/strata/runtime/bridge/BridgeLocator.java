package io.github.drompincen.strata.runtime.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the Node.js interpreter and the bridge script.
 * <p>
 * Interpreter order: the configured path, {@code /usr/local/bin/node},
 * {@code /opt/homebrew/bin/node}, the newest {@code ~/.nvm/versions/node/*}{@code /bin/node},
 * {@code /usr/bin/node}, then every {@code PATH} entry. Script order: the configured path,
 * {@code bridge/claude-bridge.mjs} under the working directory, then the classpath resource
 * of the same name.
 */
public class BridgeLocator {

    private static final Logger log = LoggerFactory.getLogger(BridgeLocator.class);

    public static final String SCRIPT_NAME = "claude-bridge.mjs";
    public static final String SCRIPT_RESOURCE = "bridge/" + SCRIPT_NAME;

    private final Path configuredInterpreter;
    private final Path configuredScript;
    private final List<Path> leadingInstalls;
    private final Path nvmVersionsDir;
    private final List<Path> trailingInstalls;
    private final String pathVariable;
    private final String scriptResource;

    private Path extractedScript;

    public BridgeLocator(Path configuredInterpreter, Path configuredScript) {
        this(configuredInterpreter, configuredScript,
                List.of(Path.of("/usr/local/bin/node"), Path.of("/opt/homebrew/bin/node")),
                Path.of(System.getProperty("user.home"), ".nvm", "versions", "node"),
                List.of(Path.of("/usr/bin/node")),
                System.getenv("PATH"),
                SCRIPT_RESOURCE);
    }

    BridgeLocator(Path configuredInterpreter, Path configuredScript, List<Path> leadingInstalls,
                  Path nvmVersionsDir, List<Path> trailingInstalls, String pathVariable, String scriptResource) {
        this.configuredInterpreter = configuredInterpreter;
        this.configuredScript = configuredScript;
        this.leadingInstalls = List.copyOf(leadingInstalls);
        this.nvmVersionsDir = nvmVersionsDir;
        this.trailingInstalls = List.copyOf(trailingInstalls);
        this.pathVariable = pathVariable;
        this.scriptResource = scriptResource;
    }

    public LaunchSpec locate(Path workingDirectory) {
        Path interpreter = findInterpreter()
                .orElseThrow(() -> new LaunchException("Node.js not found. Install it or set strata.bridge.node-path."));
        Path script = findScript(workingDirectory)
                .orElseThrow(() -> new LaunchException("Bridge script " + SCRIPT_NAME + " not found."));
        log.debug("Bridge launch: interpreter={} script={}", interpreter, script);
        return new LaunchSpec(interpreter, script);
    }

    public Optional<Path> findInterpreter() {
        List<Path> candidates = new ArrayList<>();
        if (configuredInterpreter != null) candidates.add(configuredInterpreter);
        candidates.addAll(leadingInstalls);
        newestNvmInterpreter().ifPresent(candidates::add);
        candidates.addAll(trailingInstalls);
        if (pathVariable != null) {
            for (String entry : pathVariable.split(File.pathSeparator)) {
                if (!entry.isEmpty()) candidates.add(Path.of(entry, "node"));
            }
        }
        return candidates.stream().filter(BridgeLocator::isExecutable).findFirst();
    }

    public Optional<Path> findScript(Path workingDirectory) {
        if (configuredScript != null && Files.isRegularFile(configuredScript)) {
            return Optional.of(configuredScript);
        }
        if (workingDirectory != null) {
            Path local = workingDirectory.resolve("bridge").resolve(SCRIPT_NAME);
            if (Files.isRegularFile(local)) return Optional.of(local);
        }
        return classpathScript();
    }

    Optional<Path> newestNvmInterpreter() {
        if (nvmVersionsDir == null || !Files.isDirectory(nvmVersionsDir)) return Optional.empty();

        Path best = null;
        int[] bestVersion = null;
        try (DirectoryStream<Path> versions = Files.newDirectoryStream(nvmVersionsDir)) {
            for (Path dir : versions) {
                Path node = dir.resolve("bin").resolve("node");
                if (!isExecutable(node)) continue;
                int[] version = parseVersion(dir.getFileName().toString());
                if (bestVersion == null || compareVersions(version, bestVersion) > 0) {
                    best = node;
                    bestVersion = version;
                }
            }
        } catch (IOException e) {
            log.debug("Cannot list {}: {}", nvmVersionsDir, e.getMessage());
        }
        return Optional.ofNullable(best);
    }

    private synchronized Optional<Path> classpathScript() {
        if (extractedScript != null && Files.isRegularFile(extractedScript)) {
            return Optional.of(extractedScript);
        }
        URL url = Thread.currentThread().getContextClassLoader().getResource(scriptResource);
        if (url == null) return Optional.empty();

        try {
            if ("file".equals(url.getProtocol())) {
                extractedScript = Path.of(url.toURI());
            } else {
                Path temp = Files.createTempFile("claude-bridge", ".mjs");
                try (InputStream in = url.openStream()) {
                    Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                }
                temp.toFile().deleteOnExit();
                extractedScript = temp;
            }
            return Optional.of(extractedScript);
        } catch (IOException | URISyntaxException e) {
            log.warn("Failed to extract bridge script from {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    static int[] parseVersion(String name) {
        String[] parts = (name.startsWith("v") ? name.substring(1) : name).split("\\.");
        int[] version = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                version[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                version[i] = -1;
            }
        }
        return version;
    }

    static int compareVersions(int[] a, int[] b) {
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            int x = i < a.length ? a[i] : 0;
            int y = i < b.length ? b[i] : 0;
            if (x != y) return Integer.compare(x, y);
        }
        return 0;
    }
}
