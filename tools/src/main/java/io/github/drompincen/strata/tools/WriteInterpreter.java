package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.Set;

public class WriteInterpreter extends ObjectResultInterpreter {

    @Override public Set<String> toolNames() { return Set.of("Write"); }

    @Override
    protected ToolOutput interpretObject(ToolInput input, JsonNode result) {
        return ToolOutput.empty();
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        return "Write " + fileName(input.filePath(), "file");
    }
}
