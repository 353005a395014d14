package io.proteus.events.core.task;

import io.proteus.events.core.repository.ResourceNotFoundException;

/**
 * No task has the requested id.
 *
 * This exception is deterministic.
 */
public class TaskNotFoundException
        extends ResourceNotFoundException
{
    private final String taskId;

    public TaskNotFoundException(String taskId)
    {
        super("Task does not exist: id=" + taskId);
        this.taskId = taskId;
    }

    public String getTaskId()
    {
        return taskId;
    }
}
