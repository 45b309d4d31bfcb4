package io.github.drompincen.strata.protocol.api;

import java.util.List;

/**
 * A task tracked by the backend's task and todo tools.
 *
 * @param activeForm present-continuous label shown while the task runs (e.g. "Running tests")
 * @param blockedBy ids of tasks blocking this one, or null
 */
public record SessionTask(
        String id,
        String subject,
        TaskStatus status,
        String activeForm,
        String description,
        List<String> blockedBy
) {
    public SessionTask {
        if (status == null) status = TaskStatus.PENDING;
        blockedBy = blockedBy == null ? null : List.copyOf(blockedBy);
    }

    public SessionTask withStatus(TaskStatus newStatus) {
        return new SessionTask(id, subject, newStatus, activeForm, description, blockedBy);
    }
}
