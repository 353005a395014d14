package io.proteus.events.core.task;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.collect.Sets;

import static io.proteus.events.core.task.TaskStateCode.ACCEPTED;
import static io.proteus.events.core.task.TaskStateCode.NOTIFIED;
import static io.proteus.events.core.task.TaskStateCode.READY;
import static io.proteus.events.core.task.TaskStateCode.REJECTED;

/**
 * Legal state transitions of a task. Creation in {@code ready} happens only
 * through materialization and is not listed here.
 */
public enum TaskTransition
{
    NOTIFY(NOTIFIED, TaskTimestamp.NOTIFY_TIME, READY),
    ACCEPT(ACCEPTED, TaskTimestamp.ACCEPT_TIME, READY, NOTIFIED),
    REJECT(REJECTED, TaskTimestamp.DONE_TIME, READY, NOTIFIED, ACCEPTED),
    DONE(TaskStateCode.DONE, TaskTimestamp.DONE_TIME, ACCEPTED);

    private final TaskStateCode to;
    private final TaskTimestamp timestamp;
    private final Set<TaskStateCode> from;

    private TaskTransition(TaskStateCode to, TaskTimestamp timestamp, TaskStateCode first, TaskStateCode... rest)
    {
        this.to = to;
        this.timestamp = timestamp;
        this.from = Sets.immutableEnumSet(EnumSet.of(first, rest));
    }

    public TaskStateCode getTargetState()
    {
        return to;
    }

    public TaskTimestamp getTimestamp()
    {
        return timestamp;
    }

    public Set<TaskStateCode> getAllowedFrom()
    {
        return from;
    }

    /**
     * Finds the transition that permits moving to {@code target} from every state
     * in {@code allowedFrom} while stamping {@code timestamp}.
     */
    public static Optional<TaskTransition> find(TaskStateCode target, Collection<TaskStateCode> allowedFrom, TaskTimestamp timestamp)
    {
        if (allowedFrom.isEmpty()) {
            return Optional.absent();
        }
        for (TaskTransition transition : values()) {
            if (transition.to == target
                    && transition.timestamp == timestamp
                    && transition.from.containsAll(allowedFrom)) {
                return Optional.of(transition);
            }
        }
        return Optional.absent();
    }
}
