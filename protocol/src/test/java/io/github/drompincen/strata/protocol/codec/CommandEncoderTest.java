package io.github.drompincen.strata.protocol.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.strata.protocol.command.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandEncoderTest {

    private final CommandEncoder encoder = new CommandEncoder();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void queryStartsWithTypeAndOmitsAbsentOptionals() throws Exception {
        String line = encoder.encode(new QueryCommand("hello", "/work", "default", null, null, null));

        assertThat(line).startsWith("{\"type\":\"query\"");
        assertThat(line).doesNotContain("\n");
        JsonNode json = mapper.readTree(line);
        assertThat(json.get("prompt").asText()).isEqualTo("hello");
        assertThat(json.get("cwd").asText()).isEqualTo("/work");
        assertThat(json.get("permissionMode").asText()).isEqualTo("default");
        assertThat(json.has("sessionId")).isFalse();
        assertThat(json.has("model")).isFalse();
        assertThat(json.has("systemPrompt")).isFalse();
    }

    @Test
    void queryCarriesContinuationAndOverrides() throws Exception {
        JsonNode json = mapper.readTree(encoder.encode(
                new QueryCommand("hi", "/w", "plan", "s1", "claude-opus-4-20250514", "Be terse")));

        assertThat(json.get("sessionId").asText()).isEqualTo("s1");
        assertThat(json.get("model").asText()).isEqualTo("claude-opus-4-20250514");
        assertThat(json.get("systemPrompt").asText()).isEqualTo("Be terse");
    }

    @Test
    void cancelIsJustTheTag() {
        assertThat(encoder.encode(CancelCommand.INSTANCE)).isEqualTo("{\"type\":\"cancel\"}");
    }

    @Test
    void permissionResponseShapes() throws Exception {
        assertThat(encoder.encode(PermissionResponseCommand.allow("r1")))
                .isEqualTo("{\"type\":\"permission_response\",\"requestId\":\"r1\",\"behavior\":\"allow\"}");

        JsonNode deny = mapper.readTree(encoder.encode(PermissionResponseCommand.deny("r2", "User denied permission")));
        assertThat(deny.get("behavior").asText()).isEqualTo("deny");
        assertThat(deny.get("message").asText()).isEqualTo("User denied permission");
    }

    @Test
    void compactIncludesFocusWhenGiven() throws Exception {
        JsonNode json = mapper.readTree(encoder.encode(
                new CompactCommand("s1", "/w", "default", null, "keep the API notes")));

        assertThat(json.get("type").asText()).isEqualTo("compact");
        assertThat(json.get("sessionId").asText()).isEqualTo("s1");
        assertThat(json.get("focusInstructions").asText()).isEqualTo("keep the API notes");
        assertThat(json.has("model")).isFalse();
    }
}
