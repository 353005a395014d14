package io.proteus.events.core.task;

import io.proteus.events.core.repository.ResourceForbiddenException;

/**
 * The task exists but belongs to another probe.
 *
 * This exception is deterministic.
 */
public class TaskAccessDeniedException
        extends ResourceForbiddenException
{
    public TaskAccessDeniedException(String taskId, String probeId)
    {
        super("Probe " + probeId + " is not allowed to access task " + taskId);
    }
}
