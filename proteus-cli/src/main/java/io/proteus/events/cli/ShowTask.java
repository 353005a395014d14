package io.proteus.events.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.proteus.events.core.ProteusEmbed;
import io.proteus.events.core.task.InconsistentTaskStateException;
import io.proteus.events.core.task.StoredTask;
import io.proteus.events.core.task.TaskAccessDeniedException;
import io.proteus.events.core.task.TaskLifecycle;
import io.proteus.events.core.task.TaskNotFoundException;
import io.proteus.events.core.task.TaskTransition;

import java.time.Instant;

import static io.proteus.events.cli.SystemExitException.systemExit;

public class ShowTask
    extends EmbedCommand
{
    @Parameter(names = {"-p", "--probe"})
    String probeId = null;

    @Override
    public void main()
            throws Exception
    {
        if (args.isEmpty() || args.size() > 2) {
            throw usage(null);
        }
        if (probeId == null) {
            throw usage("--probe option is required");
        }
        String taskId = args.get(0);
        Optional<TaskTransition> transition = Optional.absent();
        if (args.size() == 2) {
            transition = Optional.of(parseTransition(args.get(1)));
        }

        try (ProteusEmbed embed = openEmbed()) {
            TaskLifecycle lifecycle = embed.getTaskLifecycle();
            StoredTask task;
            try {
                if (transition.isPresent()) {
                    task = lifecycle.apply(transition.get(), taskId, probeId);
                }
                else {
                    task = lifecycle.getTask(taskId, probeId);
                }
            }
            catch (TaskNotFoundException ex) {
                throw systemExit("Task not found: " + taskId);
            }
            catch (TaskAccessDeniedException ex) {
                throw systemExit("Task " + taskId + " is not assigned to probe " + probeId);
            }
            catch (InconsistentTaskStateException ex) {
                throw systemExit("Task state changed: " + ex.getMessage());
            }
            show(task);
        }
    }

    private TaskTransition parseTransition(String action)
        throws SystemExitException
    {
        switch (action) {
        case "notify":
            return TaskTransition.NOTIFY;
        case "accept":
            return TaskTransition.ACCEPT;
        case "reject":
            return TaskTransition.REJECT;
        case "done":
            return TaskTransition.DONE;
        default:
            throw usage("Unknown action '" + action + "'");
        }
    }

    private void show(StoredTask task)
    {
        out.println("  id: " + task.getId());
        out.println("  probe: " + task.getProbeId());
        out.println("  test: " + task.getTestName());
        out.println("  arguments: " + task.getArguments());
        out.println("  state: " + task.getState());
        out.println("  created at: " + task.getCreatedAt());
        out.println("  updated at: " + task.getUpdatedAt());
        out.println("  notified at: " + formatTime(task.getNotifyTime()));
        out.println("  accepted at: " + formatTime(task.getAcceptTime()));
        out.println("  done at: " + formatTime(task.getDoneTime()));
    }

    private static String formatTime(Optional<Instant> time)
    {
        return time.transform(Instant::toString).or("");
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " task <id> [notify|accept|reject|done] --probe ID");
        err.println("  Options:");
        err.println("    -p, --probe ID                   probe that owns the task");
        showDatabaseOptions(err);
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
