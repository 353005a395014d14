package io.proteus.events.core.repository;

/**
 * An unexpected failure of the underlying database.
 *
 * Unlike the Resource*Exception family this exception is not deterministic.
 * Callers may retry the same request later.
 */
public class StorageException
        extends RuntimeException
{
    public StorageException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
