package io.proteus.events.core.repository;

/**
 * An exception thrown when a resource exists but the caller is not allowed to touch it.
 *
 * This exception is deterministic.
 */
public class ResourceForbiddenException extends Exception
{
    public ResourceForbiddenException(String message)
    {
        super(message);
    }
}
