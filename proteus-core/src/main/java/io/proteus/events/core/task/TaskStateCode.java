package io.proteus.events.core.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum TaskStateCode
{
    READY(0),
    NOTIFIED(1),
    ACCEPTED(2),
    REJECTED(3),
    DONE(4);

    // ready -> notified: the probe was told about the task
    // ready, notified -> accepted: the probe started working on it
    // ready, notified, accepted -> rejected: the probe gave it up
    // accepted -> done
    //
    // rejected and done are terminal

    public static TaskStateCode of(int code)
    {
        switch(code) {
        case 0:
            return READY;
        case 1:
            return NOTIFIED;
        case 2:
            return ACCEPTED;
        case 3:
            return REJECTED;
        case 4:
            return DONE;
        default:
            throw new IllegalStateException("Unknown task state code: " + code);
        }
    }

    @JsonCreator
    public static TaskStateCode fromString(String name)
    {
        try {
            return TaskStateCode.valueOf(name.toUpperCase(ENGLISH));
        }
        catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown task state: " + name, ex);
        }
    }

    private final short code;

    private TaskStateCode(int code)
    {
        this.code = (short) code;
    }

    public short get()
    {
        return code;
    }

    @JsonValue
    @Override
    public String toString()
    {
        return name().toLowerCase(ENGLISH);
    }
}
