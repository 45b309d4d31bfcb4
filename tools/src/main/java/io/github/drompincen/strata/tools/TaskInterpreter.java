package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.SessionTask;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;

import java.util.Set;

/**
 * Single-task tools. The result carries the task either at the top level or under {@code task}.
 */
public class TaskInterpreter extends ObjectResultInterpreter {

    @Override public Set<String> toolNames() { return ToolKinds.SINGLE_TASK_TOOLS; }

    @Override
    protected ToolOutput interpretObject(ToolInput input, JsonNode result) {
        JsonNode nested = result.path("task");
        JsonNode source = nested.isObject() ? nested : result;
        SessionTask task = TaskPayloads.parseTask(source);
        if (input.taskId() != null) {
            SessionTask requested = TaskPayloads.parseTask(input.raw());
            task = task == null ? requested : TaskPayloads.withRequest(task, source, requested);
        }
        return ToolOutput.builder().task(task).build();
    }

    @Override
    public String summarize(String toolName, ToolInput input, ToolOutput output) {
        SessionTask task = output.task();
        String id = task != null ? task.id() : input.taskId();
        switch (toolName) {
            case "TaskCreate": {
                String subject = task != null ? task.subject() : input.subject();
                return subject != null ? "Created task: " + subject : "Created task";
            }
            case "TaskUpdate": {
                String status = task != null && input.taskStatus() == null
                        ? task.status().wireName()
                        : input.taskStatus();
                return "Task #" + (id != null ? id : "?") + (status != null ? " -> " + status : " updated");
            }
            default:
                return "Fetched task #" + (id != null ? id : "?");
        }
    }
}
