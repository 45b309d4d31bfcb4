package io.github.drompincen.strata.tools;

import java.util.Set;

/**
 * Groups tool names by how their results affect the session task table.
 */
public final class ToolKinds {

    /** Tools whose result describes one task to upsert (or delete). */
    public static final Set<String> SINGLE_TASK_TOOLS = Set.of("TaskCreate", "TaskUpdate", "TaskGet");

    /** Tools whose result is the complete task list. */
    public static final Set<String> TASK_LIST_TOOLS = Set.of("TodoWrite", "TodoUpdate", "TaskList", "TodoRead");

    private ToolKinds() {}

    public static boolean isSingleTaskTool(String toolName) {
        return SINGLE_TASK_TOOLS.contains(toolName);
    }

    public static boolean isTaskListTool(String toolName) {
        return TASK_LIST_TOOLS.contains(toolName);
    }
}
