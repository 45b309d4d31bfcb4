package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.Set;

public class ReadInterpreter extends ObjectResultInterpreter {

    @Override public Set<String> toolNames() { return Set.of("Read"); }

    @Override
    protected ToolOutput interpretObject(ToolInput input, JsonNode result) {
        JsonNode file = result.path("file");
        String content = file.isObject()
                ? ToolInputParser.text(file, "content")
                : ToolInputParser.text(result, "content");
        return ToolOutput.builder().fileContent(content).build();
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        return "Read " + fileName(input.filePath(), "file");
    }
}
