package io.github.drompincen.strata.runtime.session;

import io.github.drompincen.strata.protocol.api.SessionSettings;
import io.github.drompincen.strata.protocol.api.SessionSnapshot;
import io.github.drompincen.strata.runtime.bridge.BridgeLocator;
import io.github.drompincen.strata.runtime.bridge.ProcessSupervisor;
import io.github.drompincen.strata.runtime.config.BridgeProperties;
import io.github.drompincen.strata.tools.ToolInterpreterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Creates sessions, fresh or restored, each with its own process supervisor.
 */
public class ChatSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionFactory.class);

    private final BridgeProperties properties;
    private final Executor dispatcher;
    private final ScheduledExecutorService scheduler;
    private final ToolInterpreterRegistry interpreters;

    public ChatSessionFactory(BridgeProperties properties, Executor dispatcher,
                              ScheduledExecutorService scheduler, ToolInterpreterRegistry interpreters) {
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.interpreters = interpreters;
    }

    public SessionSettings defaultSettings(Path workingDirectory) {
        return new SessionSettings(workingDirectory, properties.getDefaultPermissionMode(),
                properties.getDefaultModel(), properties.getDefaultSystemPrompt());
    }

    public ChatSession create(String name, Path workingDirectory) {
        return create(name, defaultSettings(workingDirectory));
    }

    public ChatSession create(String name, SessionSettings settings) {
        ChatSession session = new ChatSession(name, settings, newSupervisor(settings.workingDirectory()),
                interpreters, properties.getContextWindowTokens());
        log.info("Created session {} ({}) in {}", session.id(), name, settings.workingDirectory());
        return session;
    }

    public ChatSession restore(SessionSnapshot snapshot) {
        ChatSession session = ChatSession.restore(snapshot, newSupervisor(snapshot.settings().workingDirectory()),
                interpreters, properties.getContextWindowTokens());
        log.info("Restored session {} with {} messages", session.id(), session.messages().size());
        return session;
    }

    private ProcessSupervisor newSupervisor(Path workingDirectory) {
        return new ProcessSupervisor(
                new BridgeLocator(properties.getNodePath(), properties.getScriptPath()),
                workingDirectory,
                dispatcher,
                scheduler,
                properties.getRetryDelay(),
                properties.getMalformedLineWarnThreshold());
    }
}
