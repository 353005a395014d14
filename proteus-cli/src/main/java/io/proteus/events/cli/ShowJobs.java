package io.proteus.events.cli;

import io.proteus.events.core.ProteusEmbed;
import io.proteus.events.core.job.StoredJob;

import java.util.List;

import static io.proteus.events.cli.SystemExitException.systemExit;

public class ShowJobs
    extends EmbedCommand
{
    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }

        try (ProteusEmbed embed = openEmbed()) {
            List<StoredJob> jobs = embed.getJobScheduler().listJobs();
            TablePrinter table = new TablePrinter(out);
            table.row("ID", "COMMENT", "SCHEDULE", "DELAY", "TEST", "TIMES RUN", "NEXT RUN AT", "DONE");
            for (StoredJob job : jobs) {
                table.row(
                        job.getId(),
                        job.getComment(),
                        job.getSchedule(),
                        Long.toString(job.getDelay()),
                        job.getTask().getTestName(),
                        Integer.toString(job.getTimesRun()),
                        job.getNextRunAt().toString(),
                        Boolean.toString(job.getDone()));
            }
            table.print();
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " jobs");
        err.println("  Options:");
        showDatabaseOptions(err);
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
