package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.strata.protocol.api.ToolActivity;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ToolInterpreterRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ToolInterpreterRegistry registry = ToolInterpreterRegistry.loadDefault();

    @Test
    void loadsBuiltInInterpretersViaSpi() {
        assertThat(registry.toolNames()).contains(
                "Bash", "Edit", "Read", "Write", "Glob", "Grep",
                "TaskCreate", "TaskUpdate", "TaskGet", "TodoWrite", "TodoUpdate", "TaskList", "TodoRead");
        assertThat(registry.get("Bash")).get().isInstanceOf(BashInterpreter.class);
        assertThat(registry.get("WebFetch")).isEmpty();
    }

    @Test
    void interpretsBashResult() throws Exception {
        ToolActivity activity = registry.interpret("Bash",
                mapper.readTree("{\"command\":\"ls\"}"),
                mapper.readTree("{\"stdout\":\"a\\nb\",\"stderr\":\"\",\"interrupted\":false}"));

        assertThat(activity.toolName()).isEqualTo("Bash");
        assertThat(activity.input().command()).isEqualTo("ls");
        assertThat(activity.output().stdout()).isEqualTo("a\nb");
        assertThat(activity.summary()).isEqualTo("ls");
        assertThat(activity.detail()).isNull();
    }

    @Test
    void plainStringResultBecomesStdoutForAnyTool() throws Exception {
        ToolActivity activity = registry.interpret("Grep",
                mapper.readTree("{\"pattern\":\"foo\"}"),
                mapper.readTree("\"no matches\""));

        assertThat(activity.output().stdout()).isEqualTo("no matches");
        assertThat(activity.output().raw()).isNull();
    }

    @Test
    void nonObjectResultIsKeptRaw() throws Exception {
        JsonNode result = mapper.readTree("[1,2,3]");

        ToolActivity activity = registry.interpret("Bash", mapper.readTree("{}"), result);

        assertThat(activity.output().raw()).isEqualTo(result);
        assertThat(activity.output().stdout()).isNull();
    }

    @Test
    void unknownToolPassesPayloadThrough() throws Exception {
        JsonNode result = mapper.readTree("{\"status\":200}");

        ToolActivity activity = registry.interpret("WebFetch", mapper.readTree("{\"url\":\"x\"}"), result);

        assertThat(activity.output().raw()).isEqualTo(result);
        assertThat(activity.summary()).isEqualTo("WebFetch");
        assertThat(activity.input().raw().path("url").asText()).isEqualTo("x");
    }

    @Test
    void missingInputAndResultAreTolerated() {
        ToolActivity activity = registry.interpret("Write", null, null);

        assertThat(activity.input()).isEqualTo(ToolInput.empty());
        assertThat(activity.output().raw().isNull()).isTrue();
        assertThat(activity.summary()).isEqualTo("Write file");
    }

    @Test
    void registeredInterpreterReplacesBuiltIn() throws Exception {
        registry.register(new ToolResultInterpreter() {
            @Override public Set<String> toolNames() { return Set.of("Bash"); }
            @Override public ToolOutput interpret(ToolInput input, JsonNode result) { return ToolOutput.ofStdout("custom"); }
            @Override public String summarize(String toolName, ToolInput input, ToolOutput output) { return "shell"; }
        });

        ToolActivity activity = registry.interpret("Bash", mapper.readTree("{}"), mapper.readTree("{}"));

        assertThat(activity.output().stdout()).isEqualTo("custom");
        assertThat(activity.summary()).isEqualTo("shell");
    }
}
