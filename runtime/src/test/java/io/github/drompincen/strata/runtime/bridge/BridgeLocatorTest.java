package io.github.drompincen.strata.runtime.bridge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class BridgeLocatorTest {

    private static final String NO_RESOURCE = "bridge/not-on-classpath.mjs";

    @TempDir
    Path tempDir;

    private Path executable(Path path) throws Exception {
        Files.createDirectories(path.getParent());
        Files.writeString(path, "#!/bin/sh\n");
        path.toFile().setExecutable(true);
        return path;
    }

    private BridgeLocator locator(Path configuredNode, Path configuredScript, List<Path> leading,
                                  List<Path> trailing, String pathVariable) {
        return new BridgeLocator(configuredNode, configuredScript, leading,
                tempDir.resolve("nvm"), trailing, pathVariable, NO_RESOURCE);
    }

    @Test
    void configuredInterpreterWins() throws Exception {
        Path configured = executable(tempDir.resolve("custom/node"));
        Path installed = executable(tempDir.resolve("usr/local/bin/node"));

        assertThat(locator(configured, null, List.of(installed), List.of(), null).findInterpreter())
                .contains(configured);
    }

    @Test
    void nonExecutableCandidatesAreSkipped() throws Exception {
        Path plain = tempDir.resolve("plain/node");
        Files.createDirectories(plain.getParent());
        Files.writeString(plain, "");
        Path fallback = executable(tempDir.resolve("usr/bin/node"));

        assertThat(locator(plain, null, List.of(), List.of(fallback), null).findInterpreter()).contains(fallback);
    }

    @Test
    void newestNvmVersionBeatsLaterLocations() throws Exception {
        executable(tempDir.resolve("nvm/v9.11.2/bin/node"));
        Path newest = executable(tempDir.resolve("nvm/v20.3.0/bin/node"));
        executable(tempDir.resolve("nvm/v18.19.1/bin/node"));
        Path usrBin = executable(tempDir.resolve("usr/bin/node"));

        assertThat(locator(null, null, List.of(tempDir.resolve("absent/node")), List.of(usrBin), null)
                .findInterpreter()).contains(newest);
    }

    @Test
    void searchesPathLast() throws Exception {
        Path onPath = executable(tempDir.resolve("bin2/node"));
        String path = tempDir.resolve("bin1") + java.io.File.pathSeparator + tempDir.resolve("bin2");

        assertThat(locator(null, null, List.of(), List.of(), path).findInterpreter()).contains(onPath);
    }

    @Test
    void scriptFromConfigurationThenWorkingDirectory() throws Exception {
        Path configured = Files.writeString(tempDir.resolve("my-bridge.mjs"), "");
        Path project = Files.createDirectories(tempDir.resolve("project"));
        Path local = Files.createDirectories(project.resolve("bridge")).resolve(BridgeLocator.SCRIPT_NAME);
        Files.writeString(local, "");

        assertThat(locator(null, configured, List.of(), List.of(), null).findScript(project)).contains(configured);
        assertThat(locator(null, tempDir.resolve("gone.mjs"), List.of(), List.of(), null).findScript(project))
                .contains(local);
    }

    @Test
    void bundledScriptIsTheLastResort() throws Exception {
        BridgeLocator locator = new BridgeLocator(null, tempDir.resolve("gone.mjs"), List.of(),
                tempDir.resolve("nvm"), List.of(), null, BridgeLocator.SCRIPT_RESOURCE);
        Path project = Files.createDirectories(tempDir.resolve("empty-project"));

        Path script = locator.findScript(project).orElseThrow();

        assertThat(script.getFileName()).hasToString(BridgeLocator.SCRIPT_NAME);
        assertThat(Files.readString(script)).contains(EnvironmentSanitizer.NONCE_VARIABLE);
        assertThat(locator.findScript(project)).contains(script);
    }

    @Test
    void missingPiecesRaiseLaunchException() throws Exception {
        assertThatThrownBy(() -> locator(null, null, List.of(), List.of(), null).locate(tempDir))
                .isInstanceOf(LaunchException.class)
                .hasMessageContaining("Node.js");

        Path node = executable(tempDir.resolve("n/node"));
        assertThatThrownBy(() -> locator(node, null, List.of(), List.of(), null).locate(tempDir))
                .isInstanceOf(LaunchException.class)
                .hasMessageContaining(BridgeLocator.SCRIPT_NAME);
    }

    @Test
    void launchSpecRunsInScriptDirectory() throws Exception {
        Path node = executable(tempDir.resolve("n/node"));
        Path script = Files.createDirectories(tempDir.resolve("s")).resolve("b.mjs");
        Files.writeString(script, "");

        LaunchSpec spec = locator(node, script, List.of(), List.of(), null).locate(tempDir);

        assertThat(spec.command()).containsExactly(node.toString(), script.toString());
        assertThat(spec.directory()).isEqualTo(tempDir.resolve("s").toAbsolutePath());
    }

    @Test
    void versionOrdering() {
        assertThat(BridgeLocator.compareVersions(BridgeLocator.parseVersion("v20.3.0"),
                BridgeLocator.parseVersion("v9.11.2"))).isPositive();
        assertThat(BridgeLocator.compareVersions(BridgeLocator.parseVersion("v18.1"),
                BridgeLocator.parseVersion("v18.1.0"))).isZero();
    }
}
