package io.github.drompincen.strata.runtime.session;

import io.github.drompincen.strata.protocol.api.SessionTask;
import io.github.drompincen.strata.protocol.api.TaskStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The session's view of the backend task list, keyed by task id in insertion order.
 * Deleted tasks are removed, never kept with a deleted status.
 */
public class TaskTable {

    private final Map<String, SessionTask> tasks = new LinkedHashMap<>();

    /**
     * Inserts or updates one task. A {@code deleted} status removes it. When the incoming
     * task only carries a placeholder subject, the known subject is kept, as are known
     * optional fields the update leaves out.
     */
    public void apply(SessionTask task) {
        if (task.status() == TaskStatus.DELETED) {
            tasks.remove(task.id());
            return;
        }
        SessionTask existing = tasks.get(task.id());
        tasks.put(task.id(), existing == null ? task : merge(existing, task));
    }

    /** Replaces the whole table; deleted entries of the new list are dropped. */
    public void replaceAll(Collection<SessionTask> replacement) {
        tasks.clear();
        for (SessionTask task : replacement) {
            if (task.status() != TaskStatus.DELETED) tasks.put(task.id(), task);
        }
    }

    public Optional<SessionTask> get(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public List<SessionTask> list() {
        return List.copyOf(tasks.values());
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    private static SessionTask merge(SessionTask existing, SessionTask update) {
        String subject = update.subject().equals("Task #" + update.id()) ? existing.subject() : update.subject();
        return new SessionTask(
                update.id(),
                subject,
                update.status(),
                update.activeForm() != null ? update.activeForm() : existing.activeForm(),
                update.description() != null ? update.description() : existing.description(),
                update.blockedBy() != null ? update.blockedBy() : existing.blockedBy());
    }
}
