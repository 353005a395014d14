package io.proteus.events.core.repository;

/**
 * An exception thrown when a required resource (job, task, probe, etc.) does not exist.
 *
 * This exception is deterministic.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }
}
