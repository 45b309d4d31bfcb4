package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.drompincen.strata.protocol.api.ToolInput;

public final class ToolInputParser {

    private ToolInputParser() {}

    public static ToolInput parse(JsonNode input) {
        if (input == null || !input.isObject()) {
            return ToolInput.empty();
        }
        return new ToolInput(
                text(input, "file_path"),
                text(input, "command"),
                text(input, "description"),
                text(input, "old_string"),
                text(input, "new_string"),
                text(input, "content"),
                text(input, "pattern"),
                text(input, "path"),
                text(input, "subject"),
                text(input, "taskId"),
                text(input, "status"),
                text(input, "activeForm"),
                input.deepCopy());
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    static JsonNode orNull(JsonNode node) {
        return node == null ? JsonNodeFactory.instance.nullNode() : node;
    }
}
