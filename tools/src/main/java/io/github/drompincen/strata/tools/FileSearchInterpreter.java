package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Glob and Grep both answer with a file listing.
 */
public class FileSearchInterpreter extends ObjectResultInterpreter {

    @Override public Set<String> toolNames() { return Set.of("Glob", "Grep"); }

    @Override
    protected ToolOutput interpretObject(ToolInput input, JsonNode result) {
        List<String> filenames = null;
        JsonNode names = result.path("filenames");
        if (names.isArray()) {
            filenames = new ArrayList<>();
            for (JsonNode name : names) {
                if (name.isTextual()) filenames.add(name.asText());
            }
        }
        JsonNode count = result.path("numFiles");
        return ToolOutput.builder()
                .filenames(filenames)
                .fileCount(count.isNumber() ? count.asInt() : null)
                .build();
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        int count = output.fileCount() != null ? output.fileCount() : 0;
        if ("Grep".equals(toolName)) {
            String pattern = input.pattern() != null ? input.pattern() : "pattern";
            return "Grep /" + pattern + "/ (" + plural(count, "match", "matches") + ")";
        }
        String pattern = input.pattern() != null ? input.pattern() : "files";
        return "Search " + pattern + " (" + plural(count, "file", "files") + ")";
    }
}
