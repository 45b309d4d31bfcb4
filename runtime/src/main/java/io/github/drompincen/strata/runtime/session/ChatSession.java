package io.github.drompincen.strata.runtime.session;

import io.github.drompincen.strata.protocol.api.ChatMessageDto;
import io.github.drompincen.strata.protocol.api.PermissionRequest;
import io.github.drompincen.strata.protocol.api.SessionSettings;
import io.github.drompincen.strata.protocol.api.SessionSnapshot;
import io.github.drompincen.strata.protocol.api.SessionTask;
import io.github.drompincen.strata.protocol.api.ToolActivity;
import io.github.drompincen.strata.protocol.api.UsageInfo;
import io.github.drompincen.strata.protocol.command.BridgeCommand;
import io.github.drompincen.strata.protocol.command.CompactCommand;
import io.github.drompincen.strata.protocol.command.QueryCommand;
import io.github.drompincen.strata.protocol.event.BridgeEvent;
import io.github.drompincen.strata.protocol.event.DebugEvent;
import io.github.drompincen.strata.protocol.event.ErrorEvent;
import io.github.drompincen.strata.protocol.event.IgnoredEvent;
import io.github.drompincen.strata.protocol.event.PermissionRequestEvent;
import io.github.drompincen.strata.protocol.event.ReadyEvent;
import io.github.drompincen.strata.protocol.event.ResultEvent;
import io.github.drompincen.strata.protocol.event.SetTextEvent;
import io.github.drompincen.strata.protocol.event.TokenEvent;
import io.github.drompincen.strata.protocol.event.ToolActivityEvent;
import io.github.drompincen.strata.protocol.event.TurnCompleteEvent;
import io.github.drompincen.strata.runtime.bridge.BridgeChannel;
import io.github.drompincen.strata.runtime.bridge.BridgeException;
import io.github.drompincen.strata.runtime.bridge.BridgeListener;
import io.github.drompincen.strata.runtime.bridge.BusyException;
import io.github.drompincen.strata.runtime.bridge.WorkingDirectories;
import io.github.drompincen.strata.tools.ToolInterpreterRegistry;
import io.github.drompincen.strata.tools.ToolKinds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A conversation with the backend and its state machine.
 * <p>
 * Idle until {@link #send} or {@link #compact} starts a request, responding until the
 * request ends with a result, an error, a bridge failure or {@link #cancel}. Not
 * thread-safe: bridge events arrive on the dispatcher and every command must be called
 * from that same dispatcher.
 */
public class ChatSession implements BridgeListener {

    private static final Logger log = LoggerFactory.getLogger(ChatSession.class);

    static final String COMPACTING_TEXT = "Compacting conversation…";
    static final String COMPACTED_TEXT = "Conversation compacted";
    static final String COMPACTION_FAILED_TEXT = "Compaction failed";
    static final String COMPACTION_CANCELLED_TEXT = "Compaction cancelled";
    static final String CANCELLED_MARKER = "\n\n*[Cancelled]*";
    static final String DENIED_MESSAGE = "User denied permission";

    private final UUID id;
    private final Instant createdAt;
    private final BridgeChannel channel;
    private final ToolInterpreterRegistry interpreters;
    private final int contextWindowTokens;

    private final List<ChatMessage> messages = new ArrayList<>();
    private final TaskTable tasks = new TaskTable();
    private final StringBuilder streamingBuffer = new StringBuilder();
    private final Deque<PermissionRequest> queuedPermissions = new ArrayDeque<>();
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();

    private String name;
    private SessionSettings settings;
    private String continuationToken;
    private double totalCost;
    private UsageInfo lastUsage;
    private boolean responding;
    private boolean compacting;
    private boolean turnBoundary;
    private ChatMessage compactionStatus;
    private PermissionRequest pendingPermission;

    public ChatSession(String name, SessionSettings settings, BridgeChannel channel,
                       ToolInterpreterRegistry interpreters, int contextWindowTokens) {
        this(UUID.randomUUID(), name, Instant.now(), settings, channel, interpreters, contextWindowTokens);
    }

    private ChatSession(UUID id, String name, Instant createdAt, SessionSettings settings, BridgeChannel channel,
                        ToolInterpreterRegistry interpreters, int contextWindowTokens) {
        this.id = id;
        this.name = name;
        this.createdAt = createdAt;
        this.settings = settings;
        this.channel = channel;
        this.interpreters = interpreters;
        this.contextWindowTokens = contextWindowTokens;
        channel.setListener(this);
    }

    /**
     * Rebuilds a session from a snapshot without replaying the protocol. Every restored
     * message is sealed; the channel should be fresh.
     */
    public static ChatSession restore(SessionSnapshot snapshot, BridgeChannel channel,
                                      ToolInterpreterRegistry interpreters, int contextWindowTokens) {
        ChatSession session = new ChatSession(
                snapshot.id() != null ? snapshot.id() : UUID.randomUUID(),
                snapshot.name(),
                snapshot.createdAt() != null ? snapshot.createdAt() : Instant.now(),
                snapshot.settings(), channel, interpreters, contextWindowTokens);
        for (ChatMessageDto dto : snapshot.messages()) {
            session.messages.add(ChatMessage.fromDto(dto));
        }
        session.continuationToken = snapshot.continuationToken();
        session.totalCost = snapshot.totalCost();
        session.lastUsage = snapshot.lastUsage();
        session.tasks.replaceAll(snapshot.tasks());
        return session;
    }

    public SessionSnapshot snapshot() {
        List<ChatMessageDto> dtos = new ArrayList<>();
        for (ChatMessage message : messages) {
            dtos.add(message.toDto());
        }
        return new SessionSnapshot(SessionSnapshot.CURRENT_VERSION, id, name, createdAt, settings, dtos,
                continuationToken, totalCost, lastUsage, tasks.list());
    }

    // ---- commands ----

    /**
     * Starts a request with the given prompt.
     *
     * @return false when the text is blank, a request is already running or the working
     *         directory is unusable; the transcript is unchanged except for a visible error
     *         in the last case
     */
    public boolean send(String text) {
        if (text == null || text.isBlank()) return false;
        if (responding) {
            log.debug("Session {} busy, rejecting send", id);
            return false;
        }

        Optional<Path> cwd = validWorkingDirectory();
        if (cwd.isEmpty()) return false;

        messages.add(ChatMessage.user(text));
        messages.add(ChatMessage.assistant(""));
        streamingBuffer.setLength(0);
        turnBoundary = false;
        responding = true;
        fireChanged();

        dispatch(new QueryCommand(
                text,
                cwd.get().toString(),
                settings.permissionMode().wireName(),
                continuationToken,
                settings.model(),
                settings.systemPrompt()));
        return true;
    }

    /**
     * Asks the backend to summarize the conversation so far.
     *
     * @return false when idle is not the current state or there is nothing to compact yet
     */
    public boolean compact(String focusInstructions) {
        if (responding || continuationToken == null) return false;
        Optional<Path> cwd = validWorkingDirectory();
        if (cwd.isEmpty()) return false;

        compactionStatus = ChatMessage.system(COMPACTING_TEXT);
        messages.add(compactionStatus);
        messages.add(ChatMessage.assistant(""));
        streamingBuffer.setLength(0);
        turnBoundary = false;
        responding = true;
        compacting = true;
        fireChanged();

        String focus = focusInstructions != null && !focusInstructions.isBlank() ? focusInstructions : null;
        dispatch(new CompactCommand(
                continuationToken,
                cwd.get().toString(),
                settings.permissionMode().wireName(),
                settings.model(),
                focus));
        return true;
    }

    private Optional<Path> validWorkingDirectory() {
        Optional<Path> cwd = WorkingDirectories.validate(settings.workingDirectory());
        if (cwd.isEmpty()) {
            messages.add(ChatMessage.system("Error: Invalid working directory: " + settings.workingDirectory()));
            fireChanged();
        }
        return cwd;
    }

    /** Abandons the running request. Does nothing when idle. */
    public void cancel() {
        if (!responding) return;

        try {
            channel.cancel();
        } catch (BridgeException e) {
            log.warn("Cancel could not be delivered: {}", e.getMessage());
        }
        endRequest(COMPACTION_CANCELLED_TEXT);

        ChatMessage last = trailingOpenAssistant();
        if (last != null) {
            if (last.text().isEmpty()) {
                messages.remove(messages.size() - 1);
            } else {
                last.setText(last.text() + CANCELLED_MARKER);
            }
        }
        sealAssistantMessages();
        clearPermissions();
        fireChanged();
    }

    /**
     * Answers the presented permission request.
     *
     * @return false when {@code requestId} is not the presented request
     */
    public boolean respondToPermission(String requestId, boolean allow) {
        if (pendingPermission == null || !pendingPermission.id().equals(requestId)) {
            log.debug("No pending permission request {}", requestId);
            return false;
        }
        pendingPermission = queuedPermissions.poll();
        fireChanged();
        try {
            channel.respondToPermission(requestId, allow, allow ? null : DENIED_MESSAGE);
        } catch (BridgeException e) {
            onFailure(e);
        }
        return true;
    }

    public void updateSettings(SessionSettings newSettings) {
        this.settings = newSettings;
    }

    public void rename(String newName) {
        this.name = newName;
        fireChanged();
    }

    public void close() {
        channel.shutdown();
    }

    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    // ---- bridge callbacks ----

    @Override
    public void onEvent(BridgeEvent event) {
        if (event instanceof TokenEvent) {
            onToken((TokenEvent) event);
        } else if (event instanceof SetTextEvent) {
            onSetText((SetTextEvent) event);
        } else if (event instanceof TurnCompleteEvent) {
            if (ignoredWhileIdle(event)) return;
            turnBoundary = true;
        } else if (event instanceof ToolActivityEvent) {
            onToolActivity((ToolActivityEvent) event);
        } else if (event instanceof ResultEvent) {
            onResult((ResultEvent) event);
        } else if (event instanceof ErrorEvent) {
            onError((ErrorEvent) event);
        } else if (event instanceof PermissionRequestEvent) {
            onPermissionRequest((PermissionRequestEvent) event);
        } else if (event instanceof DebugEvent) {
            log.debug("[bridge] {}", ((DebugEvent) event).message());
        } else if (event instanceof IgnoredEvent) {
            log.debug("Ignoring bridge event {}", ((IgnoredEvent) event).wireType());
        } else if (event instanceof ReadyEvent) {
            log.debug("Ignoring ready event");
        }
    }

    @Override
    public void onFailure(BridgeException failure) {
        log.warn("Session {} bridge failure: {}", id, failure.getMessage());
        if (responding) {
            endRequest(COMPACTION_FAILED_TEXT);
            closeOpenAssistant();
            sealAssistantMessages();
        }
        if (!(failure instanceof BusyException)) {
            clearPermissions();
        }
        messages.add(ChatMessage.system("Error: " + failure.getMessage()));
        fireChanged();
    }

    private void onToken(TokenEvent event) {
        if (ignoredWhileIdle(event)) return;
        ChatMessage target = prepareAssistant();
        streamingBuffer.append(event.text());
        target.setText(streamingBuffer.toString());
        fireChanged();
    }

    private void onSetText(SetTextEvent event) {
        if (ignoredWhileIdle(event)) return;
        ChatMessage target = prepareAssistant();
        streamingBuffer.setLength(0);
        streamingBuffer.append(event.text());
        target.setText(streamingBuffer.toString());
        fireChanged();
    }

    private void onToolActivity(ToolActivityEvent event) {
        if (ignoredWhileIdle(event)) return;

        ToolActivity activity = interpreters.interpret(event.toolName(), event.input(), event.result());
        closeOpenAssistant();
        messages.add(ChatMessage.tool(activity));
        reconcileTasks(activity);
        streamingBuffer.setLength(0);
        turnBoundary = true;
        fireChanged();
    }

    private void onResult(ResultEvent event) {
        if (event.sessionId() != null) {
            continuationToken = event.sessionId();
        }
        if (event.usage() != null) {
            lastUsage = event.usage();
            // the bridge reports the cumulative cost of the conversation
            totalCost = event.usage().costUsd();
        }
        if (!responding) {
            log.debug("Result after the request ended; kept token and usage only");
            fireChanged();
            return;
        }

        endRequest(COMPACTED_TEXT);
        ChatMessage last = trailingOpenAssistant();
        if (last != null && streamingBuffer.length() == 0 && last.text().isEmpty()
                && event.text() != null && !event.text().isBlank()) {
            last.setText(event.text());
        }
        closeOpenAssistant();
        sealAssistantMessages();
        clearPermissions();
        fireChanged();
    }

    private void onError(ErrorEvent event) {
        if (responding) {
            endRequest(COMPACTION_FAILED_TEXT);
            closeOpenAssistant();
            sealAssistantMessages();
        }
        clearPermissions();
        messages.add(ChatMessage.system("Error: " + event.message()));
        fireChanged();
    }

    private void onPermissionRequest(PermissionRequestEvent event) {
        PermissionRequest request = new PermissionRequest(
                event.requestId(), event.toolName(), event.input(), event.reason(), settings.workingDirectory());
        if (pendingPermission == null) {
            pendingPermission = request;
        } else {
            log.warn("Permission request {} arrived while {} is pending; queued",
                    request.id(), pendingPermission.id());
            queuedPermissions.add(request);
        }
        fireChanged();
    }

    // ---- helpers ----

    private void dispatch(BridgeCommand command) {
        try {
            channel.send(command);
        } catch (BridgeException e) {
            onFailure(e);
        }
    }

    private boolean ignoredWhileIdle(BridgeEvent event) {
        if (responding) return false;
        log.debug("Ignoring {} while idle", event.type().wireName());
        return true;
    }

    /**
     * Returns the assistant message the next content goes to. After a turn boundary this is
     * a fresh message, unless the transcript already ends with an empty placeholder.
     */
    private ChatMessage prepareAssistant() {
        if (turnBoundary) {
            turnBoundary = false;
            streamingBuffer.setLength(0);
            ChatMessage last = trailingOpenAssistant();
            if (last != null && !last.text().isEmpty()) {
                last.seal();
            }
        }
        ChatMessage last = trailingOpenAssistant();
        if (last != null) return last;

        ChatMessage fresh = ChatMessage.assistant("");
        messages.add(fresh);
        return fresh;
    }

    private ChatMessage trailingOpenAssistant() {
        if (messages.isEmpty()) return null;
        ChatMessage last = messages.get(messages.size() - 1);
        return last.isAssistant() && !last.isSealed() ? last : null;
    }

    /** Drops a trailing empty placeholder, or seals trailing streamed text. */
    private void closeOpenAssistant() {
        ChatMessage last = trailingOpenAssistant();
        if (last == null) return;
        if (last.text().isEmpty()) {
            messages.remove(messages.size() - 1);
        } else {
            last.seal();
        }
    }

    private void sealAssistantMessages() {
        for (ChatMessage message : messages) {
            if (message.isAssistant()) message.seal();
        }
        streamingBuffer.setLength(0);
        turnBoundary = false;
    }

    private void endRequest(String compactionOutcome) {
        responding = false;
        if (compacting) {
            compacting = false;
            if (compactionStatus != null) {
                compactionStatus.replaceSystemText(compactionOutcome);
                compactionStatus = null;
            }
        }
    }

    private void clearPermissions() {
        pendingPermission = null;
        queuedPermissions.clear();
    }

    private void reconcileTasks(ToolActivity activity) {
        String tool = activity.toolName();
        if (ToolKinds.isSingleTaskTool(tool) && activity.output().task() != null) {
            tasks.apply(activity.output().task());
        } else if (ToolKinds.isTaskListTool(tool) && activity.output().tasks() != null) {
            tasks.replaceAll(activity.output().tasks());
        }
    }

    private void fireChanged() {
        for (Runnable listener : changeListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Session change listener failed", e);
            }
        }
    }

    // ---- queries ----

    public UUID id() { return id; }
    public String name() { return name; }
    public Instant createdAt() { return createdAt; }
    public SessionSettings settings() { return settings; }
    public String continuationToken() { return continuationToken; }
    public double totalCost() { return totalCost; }
    public UsageInfo lastUsage() { return lastUsage; }
    public boolean isResponding() { return responding; }
    public boolean isCompacting() { return compacting; }

    public List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<SessionTask> tasks() {
        return tasks.list();
    }

    public Optional<PermissionRequest> pendingPermission() {
        return Optional.ofNullable(pendingPermission);
    }

    public int queuedPermissionCount() {
        return queuedPermissions.size();
    }

    /** Share of the context window used by the last exchange, 0 to 100. */
    public double contextUsagePercent() {
        if (lastUsage == null || contextWindowTokens <= 0) return 0;
        return Math.min(100.0, lastUsage.contextTokens() * 100.0 / contextWindowTokens);
    }
}
