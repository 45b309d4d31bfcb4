package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.SessionTask;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.List;
import java.util.Set;

/**
 * List tools answer with a bare array, a {@code tasks} array or a {@code newTodos} array.
 */
public class TaskListInterpreter implements ToolResultInterpreter {

    @Override public Set<String> toolNames() { return Set.of("TaskList", "TodoRead"); }

    @Override
    public ToolOutput interpret(ToolInput input, JsonNode result) {
        if (result == null) {
            return ToolOutput.empty();
        }
        if (result.isArray()) {
            return ToolOutput.builder().tasks(TaskPayloads.parseTaskList(result)).build();
        }
        if (result.path("tasks").isArray()) {
            return ToolOutput.builder().tasks(TaskPayloads.parseTaskList(result.get("tasks"))).build();
        }
        if (result.path("newTodos").isArray()) {
            return ToolOutput.builder().tasks(TaskPayloads.parseTodoList(result.get("newTodos"))).build();
        }
        return ToolOutput.ofRaw(result);
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        List<SessionTask> tasks = output.tasks() != null ? output.tasks() : List.of();
        int count = tasks.size();
        return "Listed " + count + (count == 1 ? " task" : " tasks");
    }
}
