package io.github.drompincen.strata.runtime.session;

import io.github.drompincen.strata.protocol.api.ChatMessageDto;
import io.github.drompincen.strata.protocol.api.MessageRole;
import io.github.drompincen.strata.protocol.api.ToolActivity;

import java.time.Instant;
import java.util.UUID;

/**
 * One transcript entry. Assistant text stays writable while it streams and is sealed when
 * the turn ends; other roles are sealed from the start.
 */
public class ChatMessage {

    private final UUID id;
    private final MessageRole role;
    private final Instant timestamp;
    private final ToolActivity toolActivity;
    private String text;
    private boolean sealed;

    private ChatMessage(UUID id, MessageRole role, String text, Instant timestamp,
                        ToolActivity toolActivity, boolean sealed) {
        this.id = id;
        this.role = role;
        this.text = text;
        this.timestamp = timestamp;
        this.toolActivity = toolActivity;
        this.sealed = sealed;
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(UUID.randomUUID(), MessageRole.USER, text, Instant.now(), null, true);
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage(UUID.randomUUID(), MessageRole.ASSISTANT, text, Instant.now(), null, false);
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(UUID.randomUUID(), MessageRole.SYSTEM, text, Instant.now(), null, true);
    }

    public static ChatMessage tool(ToolActivity activity) {
        return new ChatMessage(UUID.randomUUID(), MessageRole.TOOL, activity.summary(), Instant.now(), activity, true);
    }

    static ChatMessage fromDto(ChatMessageDto dto) {
        return new ChatMessage(
                dto.id() != null ? dto.id() : UUID.randomUUID(),
                dto.role(),
                dto.text() != null ? dto.text() : "",
                dto.timestamp() != null ? dto.timestamp() : Instant.now(),
                dto.toolActivity(),
                true);
    }

    public ChatMessageDto toDto() {
        return new ChatMessageDto(id, role, text, timestamp, toolActivity);
    }

    public UUID id() { return id; }
    public MessageRole role() { return role; }
    public String text() { return text; }
    public Instant timestamp() { return timestamp; }
    public ToolActivity toolActivity() { return toolActivity; }
    public boolean isSealed() { return sealed; }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }

    /**
     * @throws IllegalStateException if the message is sealed
     */
    void setText(String newText) {
        if (sealed) {
            throw new IllegalStateException("Message " + id + " is sealed");
        }
        this.text = newText;
    }

    /**
     * Changes the text of a sealed system message in place (compaction status line).
     */
    void replaceSystemText(String newText) {
        if (role != MessageRole.SYSTEM) {
            throw new IllegalStateException("Only system messages can be rewritten");
        }
        this.text = newText;
    }

    void seal() {
        sealed = true;
    }

    @Override
    public String toString() {
        return role.wireName() + ": " + text;
    }
}
