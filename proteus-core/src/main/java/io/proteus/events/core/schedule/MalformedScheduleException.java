package io.proteus.events.core.schedule;

/**
 * A schedule string could not be parsed.
 *
 * This exception is deterministic.
 */
public class MalformedScheduleException
        extends Exception
{
    public MalformedScheduleException(String message)
    {
        super(message);
    }

    public MalformedScheduleException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
