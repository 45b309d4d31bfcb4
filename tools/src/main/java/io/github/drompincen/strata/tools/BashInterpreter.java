package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.Set;

public class BashInterpreter extends ObjectResultInterpreter {

    private static final int MAX_SUMMARY = 80;

    @Override public Set<String> toolNames() { return Set.of("Bash"); }

    @Override
    protected ToolOutput interpretObject(ToolInput input, JsonNode result) {
        return ToolOutput.builder()
                .stdout(ToolInputParser.text(result, "stdout"))
                .stderr(ToolInputParser.text(result, "stderr"))
                .interrupted(result.path("interrupted").asBoolean(false))
                .build();
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        String command = input.command() != null ? input.command() : "command";
        return command.length() > MAX_SUMMARY ? command.substring(0, MAX_SUMMARY - 3) + "..." : command;
    }

    @Override
    public String detail(ToolInput input, ToolOutput output) {
        return output.interrupted() ? "Interrupted" : null;
    }
}
