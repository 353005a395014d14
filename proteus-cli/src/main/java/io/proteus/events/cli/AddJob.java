package io.proteus.events.cli;

import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.proteus.events.core.ProteusEmbed;
import io.proteus.events.core.job.JobRequest;
import io.proteus.events.core.probe.Target;
import io.proteus.events.core.schedule.MalformedScheduleException;
import io.proteus.events.core.task.TaskTemplate;

import java.util.ArrayList;
import java.util.List;

import static io.proteus.events.cli.SystemExitException.systemExit;

public class AddJob
    extends EmbedCommand
{
    @Parameter(names = {"-s", "--schedule"})
    String schedule = null;

    @Parameter(names = {"-d", "--delay"})
    long delay = 0;

    @Parameter(names = {"--comment"})
    String comment = "";

    @Parameter(names = {"-t", "--test-name"})
    String testName = null;

    @Parameter(names = {"-a", "--arguments"})
    String arguments = "{}";

    @Parameter(names = {"--country"})
    List<String> countries = new ArrayList<>();

    @Parameter(names = {"--platform"})
    List<String> platforms = new ArrayList<>();

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 1 || !args.get(0).equals("add")) {
            throw usage(null);
        }
        if (schedule == null) {
            throw usage("--schedule option is required");
        }
        if (testName == null || testName.isEmpty()) {
            throw usage("--test-name option is required");
        }
        if (delay < 0) {
            throw usage("--delay must not be negative");
        }

        try (ProteusEmbed embed = openEmbed()) {
            ObjectMapper mapper = embed.getInjector().getInstance(ObjectMapper.class);
            JsonNode taskArguments;
            try {
                taskArguments = mapper.readTree(arguments);
            }
            catch (JsonProcessingException ex) {
                throw systemExit("--arguments must be JSON: " + arguments);
            }
            if (taskArguments.isMissingNode()) {
                throw systemExit("--arguments must be JSON: " + arguments);
            }

            JobRequest request = JobRequest.builder()
                .schedule(schedule)
                .delay(delay)
                .comment(comment)
                .task(TaskTemplate.of(testName, taskArguments))
                .target(Target.of(countries, platforms))
                .build();

            String jobId;
            try {
                jobId = embed.getJobScheduler().addJob(request);
            }
            catch (MalformedScheduleException ex) {
                throw systemExit("Invalid schedule: " + ex.getMessage());
            }
            out.println("Job id: " + jobId);
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " job add [options...]");
        err.println("  Options:");
        err.println("    -s, --schedule SCHEDULE          start[/interval[/count]] or R[count]/start/interval");
        err.println("    -d, --delay SECONDS              delay of the first firing (default: 0)");
        err.println("        --comment TEXT               free-form description");
        err.println("    -t, --test-name NAME             test that probes run");
        err.println("    -a, --arguments JSON             arguments of the test, any JSON value (default: {})");
        err.println("        --country CC                 target probes in this country (use multiple times to set many)");
        err.println("        --platform NAME              target probes on this platform (use multiple times to set many)");
        showDatabaseOptions(err);
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
