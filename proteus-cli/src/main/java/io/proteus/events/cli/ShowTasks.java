package io.proteus.events.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.proteus.events.core.ProteusEmbed;
import io.proteus.events.core.task.StoredTask;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import static io.proteus.events.cli.SystemExitException.systemExit;

public class ShowTasks
    extends EmbedCommand
{
    @Parameter(names = {"-p", "--probe"})
    String probeId = null;

    @Parameter(names = {"--since"})
    String since = null;

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        if (probeId == null) {
            throw usage("--probe option is required");
        }
        Optional<Instant> sinceTime = Optional.absent();
        if (since != null) {
            try {
                sinceTime = Optional.of(Instant.parse(since));
            }
            catch (DateTimeParseException ex) {
                throw usage("--since must be an ISO-8601 instant such as 2016-10-20T10:30:00Z");
            }
        }

        try (ProteusEmbed embed = openEmbed()) {
            List<StoredTask> tasks = embed.getTaskLifecycle().getTasksForProbe(probeId, sinceTime);
            TablePrinter table = new TablePrinter(out);
            table.row("ID", "TEST", "STATE", "CREATED AT", "ARGUMENTS");
            for (StoredTask task : tasks) {
                table.row(
                        task.getId(),
                        task.getTestName(),
                        task.getState().toString(),
                        task.getCreatedAt().toString(),
                        task.getArguments().toString());
            }
            table.print();
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " tasks --probe ID [--since TIME]");
        err.println("  Options:");
        err.println("    -p, --probe ID                   probe that owns the tasks");
        err.println("        --since TIME                 show tasks created at or after this time (default: 2016-10-20T10:30:00Z)");
        showDatabaseOptions(err);
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
