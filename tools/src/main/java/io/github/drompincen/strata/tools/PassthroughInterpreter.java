package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.Set;

/**
 * Used for any tool no registered interpreter claims: the payload is kept as-is.
 */
public class PassthroughInterpreter implements ToolResultInterpreter {

    @Override public Set<String> toolNames() { return Set.of(); }

    @Override
    public ToolOutput interpret(ToolInput input, JsonNode result) {
        return ToolOutput.ofRaw(result);
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        return toolName;
    }
}
