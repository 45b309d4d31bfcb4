package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.Set;

/**
 * Projects the raw result of one kind of tool into a {@link ToolOutput} and a display
 * summary. Implementations are stateless and discovered through {@link java.util.ServiceLoader}.
 */
public interface ToolResultInterpreter {

    /** Tool names (as sent by the backend) this interpreter handles. */
    Set<String> toolNames();

    /**
     * @param result the raw result payload; never a text node (plain string results are
     *               handled by the registry), may be a {@code NullNode}
     */
    ToolOutput interpret(ToolInput input, JsonNode result);

    String summarize(String toolName, ToolInput input, ToolOutput output);

    default String detail(ToolInput input, ToolOutput output) {
        return null;
    }
}
