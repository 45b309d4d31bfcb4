package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.SessionTask;
import io.github.drompincen.strata.protocol.api.TaskStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsing of task and todo objects as they appear in task tool results.
 */
public final class TaskPayloads {

    private TaskPayloads() {}

    /**
     * Reads a task object. The id may be a string or a number under {@code id}, or a
     * string under {@code taskId}; the subject falls back to {@code title}, then to "Task #id".
     *
     * @return the task, or null when no id can be found
     */
    public static SessionTask parseTask(JsonNode node) {
        if (node == null || !node.isObject()) return null;

        String id = readId(node);
        if (id == null) return null;

        String subject = ToolInputParser.text(node, "subject");
        if (subject == null) subject = ToolInputParser.text(node, "title");
        if (subject == null) subject = "Task #" + id;

        return new SessionTask(
                id,
                subject,
                TaskStatus.fromWire(ToolInputParser.text(node, "status")),
                ToolInputParser.text(node, "activeForm"),
                ToolInputParser.text(node, "description"),
                readBlockedBy(node.path("blockedBy")));
    }

    /**
     * Completes a task read from a tool result with the fields of the request that produced it.
     * Results often echo only the id, so status and subject are taken from the result only when
     * it states them.
     *
     * @param node the result object {@code parsed} was read from
     * @param requested the task read from the request, or null
     */
    public static SessionTask withRequest(SessionTask parsed, JsonNode node, SessionTask requested) {
        if (requested == null || !requested.id().equals(parsed.id())) return parsed;

        boolean hasStatus = ToolInputParser.text(node, "status") != null;
        boolean hasSubject = ToolInputParser.text(node, "subject") != null
                || ToolInputParser.text(node, "title") != null;
        return new SessionTask(
                parsed.id(),
                hasSubject ? parsed.subject() : requested.subject(),
                hasStatus ? parsed.status() : requested.status(),
                parsed.activeForm() != null ? parsed.activeForm() : requested.activeForm(),
                parsed.description() != null ? parsed.description() : requested.description(),
                parsed.blockedBy() != null ? parsed.blockedBy() : requested.blockedBy());
    }

    /**
     * Reads one entry of a todo list. Todo items carry no id of their own; the position
     * in the list (1-based) is used.
     */
    public static SessionTask parseTodoItem(JsonNode node, int index) {
        String id = String.valueOf(index + 1);
        String subject = node.isObject() ? ToolInputParser.text(node, "content") : null;
        if (subject == null) subject = "Task " + id;
        return new SessionTask(
                id,
                subject,
                TaskStatus.fromWire(node.isObject() ? ToolInputParser.text(node, "status") : null),
                node.isObject() ? ToolInputParser.text(node, "activeForm") : null,
                null,
                null);
    }

    public static List<SessionTask> parseTodoList(JsonNode array) {
        List<SessionTask> tasks = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            tasks.add(parseTodoItem(array.get(i), i));
        }
        return tasks;
    }

    public static List<SessionTask> parseTaskList(JsonNode array) {
        List<SessionTask> tasks = new ArrayList<>();
        for (JsonNode item : array) {
            SessionTask task = parseTask(item);
            if (task != null) tasks.add(task);
        }
        return tasks;
    }

    private static String readId(JsonNode node) {
        JsonNode id = node.get("id");
        if (id != null && id.isTextual()) return id.asText();
        if (id != null && id.isIntegralNumber()) return String.valueOf(id.asLong());
        JsonNode taskId = node.get("taskId");
        if (taskId != null && (taskId.isTextual() || taskId.isIntegralNumber())) return taskId.asText();
        return null;
    }

    private static List<String> readBlockedBy(JsonNode node) {
        if (!node.isArray()) return null;
        List<String> ids = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode()) ids.add(item.asText());
        }
        return ids;
    }
}
