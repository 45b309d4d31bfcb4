package io.github.drompincen.strata.protocol.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.strata.protocol.codec.BridgeJson;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SessionSnapshotTest {

    private final ObjectMapper mapper = BridgeJson.newMapper();

    @Test
    void snapshotSurvivesJson() throws Exception {
        ToolActivity bash = new ToolActivity("Bash", ToolInput.empty(), ToolOutput.ofStdout("a.txt"), "ls", null);
        SessionSnapshot snapshot = new SessionSnapshot(
                SessionSnapshot.CURRENT_VERSION,
                UUID.randomUUID(),
                "Session - project",
                Instant.parse("2026-01-02T03:04:05Z"),
                new SessionSettings(Path.of("/tmp"), PermissionMode.ACCEPT_EDITS, null, "Be terse"),
                List.of(
                        new ChatMessageDto(UUID.randomUUID(), MessageRole.USER, "run ls", Instant.now(), null),
                        new ChatMessageDto(UUID.randomUUID(), MessageRole.TOOL, "ls", Instant.now(), bash)),
                "s1",
                0.42,
                new UsageInfo(1, 2, 3, 4, 0.42, 100, 900),
                List.of(new SessionTask("1", "Write tests", TaskStatus.IN_PROGRESS, "Writing tests", null, null)));

        String json = mapper.writeValueAsString(snapshot);
        SessionSnapshot restored = mapper.readValue(json, SessionSnapshot.class);

        assertThat(json).contains("\"role\":\"tool\"").contains("\"status\":\"in_progress\"")
                .contains("\"permissionMode\":\"acceptEdits\"");
        assertThat(restored.continuationToken()).isEqualTo("s1");
        assertThat(restored.settings().permissionMode()).isEqualTo(PermissionMode.ACCEPT_EDITS);
        assertThat(restored.messages()).extracting(ChatMessageDto::role)
                .containsExactly(MessageRole.USER, MessageRole.TOOL);
        assertThat(restored.messages().get(1).toolActivity().output().stdout()).isEqualTo("a.txt");
        assertThat(restored.tasks().get(0).status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(restored.lastUsage().contextTokens()).isEqualTo(900);
    }
}
