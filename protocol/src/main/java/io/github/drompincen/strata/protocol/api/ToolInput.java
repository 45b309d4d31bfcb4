package io.github.drompincen.strata.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Typed view over the input object of a tool invocation. Every field is optional;
 * which ones are set depends on the tool. {@code raw} keeps the untouched input.
 */
public record ToolInput(
        String filePath,
        String command,
        String description,
        String oldString,
        String newString,
        String content,
        String pattern,
        String path,
        String subject,
        String taskId,
        String taskStatus,
        String activeForm,
        JsonNode raw
) {
    public static ToolInput empty() {
        return new ToolInput(null, null, null, null, null, null, null, null,
                null, null, null, null, JsonNodeFactory.instance.objectNode());
    }
}
