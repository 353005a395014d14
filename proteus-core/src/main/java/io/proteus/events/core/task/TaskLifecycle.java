package io.proteus.events.core.task;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import io.proteus.events.core.database.TransactionManager;
import io.proteus.events.core.schedule.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probe-facing access to tasks.
 *
 * Reads and writes check that the calling probe owns the task. State changes are
 * guarded by a conditional update in the store so that out of several concurrent
 * transitions from the same state only one succeeds.
 */
public class TaskLifecycle
{
    private static final Logger logger = LoggerFactory.getLogger(TaskLifecycle.class);

    public static final Instant DEFAULT_SINCE = Instant.parse("2016-10-20T10:30:00Z");

    private final TransactionManager tm;
    private final TaskStore taskStore;
    private final TimeSource clock;

    @Inject
    public TaskLifecycle(TransactionManager tm, TaskStore taskStore, TimeSource clock)
    {
        this.tm = tm;
        this.taskStore = taskStore;
        this.clock = clock;
    }

    public StoredTask getTask(String taskId, String probeId)
        throws TaskNotFoundException, TaskAccessDeniedException
    {
        StoredTask task = tm.autoCommit(() -> taskStore.getTaskById(taskId), TaskNotFoundException.class);
        checkOwner(task, probeId);
        return task;
    }

    public List<StoredTask> getTasksForProbe(String probeId, Optional<Instant> since)
    {
        return tm.autoCommit(() -> taskStore.getReadyTasksOfProbe(probeId, since.or(DEFAULT_SINCE)));
    }

    public StoredTask notify(String taskId, String probeId)
        throws TaskNotFoundException, TaskAccessDeniedException, InconsistentTaskStateException
    {
        return apply(TaskTransition.NOTIFY, taskId, probeId);
    }

    public StoredTask accept(String taskId, String probeId)
        throws TaskNotFoundException, TaskAccessDeniedException, InconsistentTaskStateException
    {
        return apply(TaskTransition.ACCEPT, taskId, probeId);
    }

    public StoredTask reject(String taskId, String probeId)
        throws TaskNotFoundException, TaskAccessDeniedException, InconsistentTaskStateException
    {
        return apply(TaskTransition.REJECT, taskId, probeId);
    }

    public StoredTask done(String taskId, String probeId)
        throws TaskNotFoundException, TaskAccessDeniedException, InconsistentTaskStateException
    {
        return apply(TaskTransition.DONE, taskId, probeId);
    }

    public StoredTask apply(TaskTransition transition, String taskId, String probeId)
        throws TaskNotFoundException, TaskAccessDeniedException, InconsistentTaskStateException
    {
        return advance(taskId, probeId, transition.getTargetState(), transition.getAllowedFrom(), transition.getTimestamp());
    }

    /**
     * Moves a task owned by {@code probeId} to {@code target}.
     *
     * @throws IllegalArgumentException if the combination is not a legal transition
     * @throws TaskNotFoundException if no task has the id
     * @throws TaskAccessDeniedException if the task belongs to another probe
     * @throws InconsistentTaskStateException if the task is not in one of {@code allowedFrom},
     *     including when a concurrent transition changed it first
     */
    public StoredTask advance(String taskId, String probeId, TaskStateCode target,
            Collection<TaskStateCode> allowedFrom, TaskTimestamp timestamp)
        throws TaskNotFoundException, TaskAccessDeniedException, InconsistentTaskStateException
    {
        Optional<TaskTransition> transition = TaskTransition.find(target, allowedFrom, timestamp);
        if (!transition.isPresent()) {
            throw new IllegalArgumentException(String.format(
                        "Transition from %s to %s stamping %s is not allowed",
                        allowedFrom, target, timestamp.getColumnName()));
        }
        ImmutableSet<TaskStateCode> from = ImmutableSet.copyOf(allowedFrom);

        return tm.<StoredTask, TaskNotFoundException, TaskAccessDeniedException, InconsistentTaskStateException>autoCommit(() -> {
            StoredTask task = taskStore.getTaskById(taskId);
            checkOwner(task, probeId);
            if (!from.contains(task.getState())) {
                throw new InconsistentTaskStateException(String.format(
                            "Task %s is %s and can't become %s", taskId, task.getState(), target));
            }
            if (!taskStore.updateState(taskId, from, target, timestamp, clock.now())) {
                logger.debug("Task {} changed concurrently before becoming {}", taskId, target);
                throw new InconsistentTaskStateException(String.format(
                            "Task %s is no longer in %s and can't become %s", taskId, from, target));
            }
            logger.debug("Task {} of probe {} became {}", taskId, probeId, target);
            return taskStore.getTaskById(taskId);
        }, TaskNotFoundException.class, TaskAccessDeniedException.class, InconsistentTaskStateException.class);
    }

    private static void checkOwner(StoredTask task, String probeId)
        throws TaskAccessDeniedException
    {
        if (!task.getProbeId().equals(probeId)) {
            throw new TaskAccessDeniedException(task.getId(), probeId);
        }
    }
}
