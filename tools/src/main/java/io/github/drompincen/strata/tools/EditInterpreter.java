package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.DiffLine;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class EditInterpreter extends ObjectResultInterpreter {

    @Override public Set<String> toolNames() { return Set.of("Edit"); }

    @Override
    protected ToolOutput interpretObject(ToolInput input, JsonNode result) {
        String oldString = firstNonNull(ToolInputParser.text(result, "oldString"), input.oldString());
        String newString = firstNonNull(ToolInputParser.text(result, "newString"), input.newString());
        if (oldString.isEmpty() && newString.isEmpty()) {
            return ToolOutput.empty();
        }
        return ToolOutput.builder()
                .diffLines(DiffCalculator.fromEdit(oldString, newString))
                .build();
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        return "Edit " + fileName(input.filePath(), "file");
    }

    @Override
    public String detail(ToolInput input, ToolOutput output) {
        if (output.diffLines() == null) return null;
        long added = output.diffLines().stream().filter(l -> l.kind() == DiffLine.Kind.ADDITION).count();
        long removed = output.diffLines().stream().filter(l -> l.kind() == DiffLine.Kind.REMOVAL).count();
        if (added == 0 && removed == 0) return null;

        List<String> parts = new ArrayList<>();
        if (added > 0) parts.add(added + " added");
        if (removed > 0) parts.add(removed + " removed");
        return String.join(", ", parts);
    }

    private static String firstNonNull(String a, String b) {
        if (a != null) return a;
        return b != null ? b : "";
    }
}
