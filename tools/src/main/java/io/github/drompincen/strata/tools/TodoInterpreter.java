package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.SessionTask;
import io.github.drompincen.strata.protocol.api.TaskStatus;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.List;
import java.util.Set;

/**
 * Todo tools replace the whole list; the result's {@code newTodos} (or the request's
 * {@code todos}) is the authoritative list.
 */
public class TodoInterpreter extends ObjectResultInterpreter {

    @Override public Set<String> toolNames() { return Set.of("TodoWrite", "TodoUpdate"); }

    @Override
    protected ToolOutput interpretObject(ToolInput input, JsonNode result) {
        JsonNode todos = result.path("newTodos");
        if (!todos.isArray()) {
            todos = input.raw() != null ? input.raw().path("todos") : todos;
        }
        if (!todos.isArray()) {
            return ToolOutput.ofRaw(result);
        }
        return ToolOutput.builder().tasks(TaskPayloads.parseTodoList(todos)).build();
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        List<SessionTask> tasks = output.tasks() != null ? output.tasks() : List.of();
        if ("TodoWrite".equals(toolName)) {
            for (SessionTask task : tasks) {
                if (task.status() == TaskStatus.IN_PROGRESS) return task.subject();
            }
        }
        return "Updated " + plural(tasks.size(), "task", "tasks");
    }
}
