package io.proteus.events.core.task;

/**
 * Per-transition timestamp columns of the tasks table.
 */
public enum TaskTimestamp
{
    NOTIFY_TIME("notify_time"),
    ACCEPT_TIME("accept_time"),
    DONE_TIME("done_time");

    private final String column;

    private TaskTimestamp(String column)
    {
        this.column = column;
    }

    public String getColumnName()
    {
        return column;
    }
}
