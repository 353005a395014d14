package io.proteus.events.cli;

import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class MainTest
{
    private static final Pattern JOB_ID = Pattern.compile("Job id: (\\S+)");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private String database;

    @Before
    public void setUp()
            throws Exception
    {
        database = folder.newFolder("db").toString();
    }

    private static class CommandResult
    {
        final int code;
        final String out;
        final String err;

        CommandResult(int code, String out, String err)
        {
            this.code = code;
            this.out = out;
            this.err = err;
        }
    }

    private CommandResult main(String... args)
            throws Exception
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try (PrintStream outStream = new PrintStream(out, true, "UTF-8");
                PrintStream errStream = new PrintStream(err, true, "UTF-8")) {
            code = new Main(
                    ImmutableMap.of("XDG_CONFIG_HOME", folder.getRoot().toString()),
                    outStream, errStream)
                .cli(args);
        }
        return new CommandResult(code,
                new String(out.toByteArray(), StandardCharsets.UTF_8),
                new String(err.toByteArray(), StandardCharsets.UTF_8));
    }

    private CommandResult withDatabase(String... args)
            throws Exception
    {
        List<String> list = new ArrayList<>(Arrays.asList(args));
        list.add("-o");
        list.add(database);
        list.add("-l");
        list.add("warn");
        return main(list.toArray(new String[0]));
    }

    @Test
    public void noArgumentsShowsUsage()
            throws Exception
    {
        CommandResult result = main();
        assertThat(result.code, is(0));
        assertThat(result.err, containsString("Usage: proteus <command>"));
    }

    @Test
    public void unknownCommandFails()
            throws Exception
    {
        CommandResult result = main("unknown");
        assertThat(result.code, is(1));
        assertThat(result.err, containsString("available commands are"));
    }

    @Test
    public void commandHelpExitsWithZero()
            throws Exception
    {
        CommandResult result = main("job", "--help");
        assertThat(result.code, is(0));
        assertThat(result.err, containsString("--schedule"));
    }

    @Test
    public void malformedScheduleIsReported()
            throws Exception
    {
        CommandResult result = withDatabase("job", "add", "--schedule", "not-a-time", "--test-name", "web_connectivity");
        assertThat(result.code, is(1));
        assertThat(result.err, containsString("Invalid schedule"));

        CommandResult jobs = withDatabase("jobs");
        assertThat(jobs.code, is(0));
        assertThat(jobs.out, not(containsString("web_connectivity")));
    }

    @Test
    public void addedJobIsListed()
            throws Exception
    {
        CommandResult added = withDatabase("job", "add",
                "--schedule", "R3/2024-01-01T00:00:00Z/PT1H",
                "--delay", "60",
                "--comment", "daily-check",
                "--test-name", "web_connectivity",
                "--arguments", "{\"urls\":[\"https://example.org\"]}",
                "--country", "IT", "--country", "DE");
        assertThat(added.err, added.code, is(0));
        Matcher m = JOB_ID.matcher(added.out);
        assertThat(m.find(), is(true));

        CommandResult jobs = withDatabase("jobs");
        assertThat(jobs.code, is(0));
        assertThat(jobs.out, containsString(m.group(1)));
        assertThat(jobs.out, containsString("daily-check"));
        assertThat(jobs.out, containsString("2024-01-01T00:01:00Z"));
    }

    @Test
    public void arrayArgumentsAreAccepted()
            throws Exception
    {
        CommandResult result = withDatabase("job", "add", "--schedule", "2030-01-01T00:00:00Z", "--test-name", "ndt",
                "--arguments", "[1, 2]");
        assertThat(result.err, result.code, is(0));
        assertThat(JOB_ID.matcher(result.out).find(), is(true));
    }

    @Test
    public void malformedArgumentsAreRejected()
            throws Exception
    {
        CommandResult result = withDatabase("job", "add", "--schedule", "now", "--test-name", "web_connectivity",
                "--arguments", "{\"urls\":");
        assertThat(result.code, is(1));
        assertThat(result.err, containsString("--arguments must be JSON"));
    }

    @Test
    public void probeIsRegistered()
            throws Exception
    {
        CommandResult result = withDatabase("probe", "--id", "p1", "--country", "IT", "--platform", "android");
        assertThat(result.err, result.code, is(0));

        CommandResult tasks = withDatabase("tasks", "--probe", "p1");
        assertThat(tasks.code, is(0));
        assertThat(tasks.out, containsString("STATE"));
    }

    @Test
    public void missingTaskIsReported()
            throws Exception
    {
        CommandResult result = withDatabase("task", "no-such-task", "accept", "--probe", "p1");
        assertThat(result.code, is(1));
        assertThat(result.err, containsString("Task not found: no-such-task"));
    }

    @Test
    public void unknownTaskActionFails()
            throws Exception
    {
        CommandResult result = withDatabase("task", "t1", "finish", "--probe", "p1");
        assertThat(result.code, is(1));
        assertThat(result.err, containsString("Unknown action 'finish'"));
    }

    @Test
    public void migrateCheckAfterRun()
            throws Exception
    {
        CommandResult run = withDatabase("migrate", "run");
        assertThat(run.err, run.code, is(0));
        assertThat(run.out, containsString("Migrations successfully finished"));

        CommandResult check = withDatabase("migrate", "check");
        assertThat(check.code, is(0));
        assertThat(check.out, containsString("No update"));
    }
}
