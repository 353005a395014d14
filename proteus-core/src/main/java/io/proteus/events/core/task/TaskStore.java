package io.proteus.events.core.task;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface TaskStore
{
    StoredTask getTaskById(String taskId)
        throws TaskNotFoundException;

    /**
     * Tasks in state ready addressed to the probe and created at or after {@code since},
     * oldest first.
     */
    List<StoredTask> getReadyTasksOfProbe(String probeId, Instant since);

    StoredTask addTask(String probeId, TaskTemplate template, Instant now);

    /**
     * Moves the task to {@code to} only if its current state is one of {@code allowedFrom}.
     *
     * @return true if the row was updated
     */
    boolean updateState(String taskId, Collection<TaskStateCode> allowedFrom, TaskStateCode to,
            TaskTimestamp timestamp, Instant now);
}
