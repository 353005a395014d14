package io.proteus.events.core.repository;

/**
 * An exception thrown when a resource is not in the state a write requires,
 * for example a task that another caller already moved forward.
 *
 * This exception is deterministic.
 */
public class ResourceConflictException extends Exception
{
    public ResourceConflictException(String message)
    {
        super(message);
    }
}
