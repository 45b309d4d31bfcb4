package io.github.drompincen.strata.runtime.config;

import io.github.drompincen.strata.protocol.api.PermissionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "strata.bridge")
public class BridgeProperties {

    /** Node.js executable; searched for when unset. */
    private Path nodePath;

    /** Bridge script; searched for when unset. */
    private Path scriptPath;

    /** Delay before the single write retry after a lazy launch. */
    private Duration retryDelay = Duration.ofMillis(500);

    /** Consecutive malformed lines after which one warning is logged. */
    private int malformedLineWarnThreshold = 100;

    private int contextWindowTokens = 200_000;

    private PermissionMode defaultPermissionMode = PermissionMode.DEFAULT;

    private String defaultModel;

    private String defaultSystemPrompt;

    public Path getNodePath() { return nodePath; }
    public void setNodePath(Path nodePath) { this.nodePath = nodePath; }

    public Path getScriptPath() { return scriptPath; }
    public void setScriptPath(Path scriptPath) { this.scriptPath = scriptPath; }

    public Duration getRetryDelay() { return retryDelay; }
    public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }

    public int getMalformedLineWarnThreshold() { return malformedLineWarnThreshold; }
    public void setMalformedLineWarnThreshold(int malformedLineWarnThreshold) {
        this.malformedLineWarnThreshold = malformedLineWarnThreshold;
    }

    public int getContextWindowTokens() { return contextWindowTokens; }
    public void setContextWindowTokens(int contextWindowTokens) { this.contextWindowTokens = contextWindowTokens; }

    public PermissionMode getDefaultPermissionMode() { return defaultPermissionMode; }
    public void setDefaultPermissionMode(PermissionMode defaultPermissionMode) {
        this.defaultPermissionMode = defaultPermissionMode;
    }

    public String getDefaultModel() { return defaultModel; }
    public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

    public String getDefaultSystemPrompt() { return defaultSystemPrompt; }
    public void setDefaultSystemPrompt(String defaultSystemPrompt) { this.defaultSystemPrompt = defaultSystemPrompt; }
}
