package io.proteus.events.core.task;

import io.proteus.events.core.repository.ResourceConflictException;

/**
 * The task is not in a state the requested transition may start from,
 * either because of the request itself or because a concurrent transition won.
 *
 * This exception is deterministic.
 */
public class InconsistentTaskStateException
        extends ResourceConflictException
{
    public InconsistentTaskStateException(String message)
    {
        super(message);
    }
}
