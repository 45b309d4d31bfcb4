package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

/**
 * Base for interpreters that only understand object payloads; anything else is kept raw.
 */
public abstract class ObjectResultInterpreter implements ToolResultInterpreter {

    @Override
    public final ToolOutput interpret(ToolInput input, JsonNode result) {
        if (result == null || !result.isObject()) {
            return ToolOutput.ofRaw(result);
        }
        return interpretObject(input, result);
    }

    protected abstract ToolOutput interpretObject(ToolInput input, JsonNode result);

    protected static String fileName(String path, String fallback) {
        if (path == null || path.isEmpty()) return fallback;
        int slash = path.lastIndexOf('/');
        return slash >= 0 && slash < path.length() - 1 ? path.substring(slash + 1) : path;
    }

    protected static String plural(int count, String singular, String pluralForm) {
        return count + " " + (count == 1 ? singular : pluralForm);
    }
}
