package io.proteus.events.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Strings.isNullOrEmpty;
import static io.proteus.events.cli.ConfigUtil.defaultConfigPath;
import static io.proteus.events.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

/**
 * Entry point of the {@code proteus} command.
 */
public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "proteus";

    // log level -> print stack traces of errors
    private static final Map<String, Boolean> LOG_LEVELS = ImmutableMap.<String, Boolean>builder()
        .put("error", false)
        .put("warn", false)
        .put("info", false)
        .put("debug", true)
        .put("trace", true)
        .build();

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.proteus.events.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-c", "--config"})
        protected String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    public int cli(String... args)
    {
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        MainOptions mainOpts = new MainOptions();
        JCommander jc = buildCommander(mainOpts);
        boolean verbose = false;
        try {
            Command command = parse(jc, mainOpts, args);
            verbose = processCommonOptions(mainOpts, command);
            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            reportError(ex, verbose);
            return 1;
        }
    }

    private JCommander buildCommander(MainOptions mainOpts)
    {
        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
            }
        });

        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);
        jc.addCommand("server", injector.getInstance(Server.class));
        jc.addCommand("migrate", injector.getInstance(Migrate.class));
        jc.addCommand("jobs", injector.getInstance(ShowJobs.class));
        jc.addCommand("job", injector.getInstance(AddJob.class));
        jc.addCommand("probe", injector.getInstance(PutProbe.class));
        jc.addCommand("tasks", injector.getInstance(ShowTasks.class));
        jc.addCommand("task", injector.getInstance(ShowTask.class));

        // values starting with @ are taken literally
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));
        return jc;
    }

    private Command parse(JCommander jc, MainOptions mainOpts, String... args)
            throws SystemExitException
    {
        try {
            jc.parse(args);
        }
        catch (MissingCommandException ex) {
            throw usage("available commands are: " + jc.getCommands().keySet());
        }
        if (mainOpts.help || jc.getParsedCommand() == null) {
            throw usage(null);
        }
        return (Command) jc.getCommands().get(jc.getParsedCommand()).getObjects().get(0);
    }

    private boolean processCommonOptions(MainOptions mainOpts, Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }
        Boolean verbose = LOG_LEVELS.get(command.logLevel);
        if (verbose == null) {
            throw usage("Unknown log level '" + command.logLevel + "'");
        }
        if (command.configPath == null) {
            command.configPath = mainOpts.configPath;
        }

        configureLogging(command.logLevel, command.logPath);

        command.systemProperties.forEach(System::setProperty);
        return verbose;
    }

    private void reportError(Exception ex, boolean verbose)
    {
        String message = formatExceptionMessage(ex);
        if (message.trim().isEmpty()) {
            ex.printStackTrace(err);
            return;
        }
        err.println("error: " + message);
        if (verbose) {
            ex.printStackTrace(err);
        }
    }

    private static void configureLogging(String level, String logPath)
    {
        // the logback resources read these system properties
        System.setProperty("proteus.log.level", Level.toLevel(level.toUpperCase(ENGLISH), Level.INFO).toString());
        String resource;
        if (logPath.equals("-")) {
            resource = "/io/proteus/events/cli/logback-console.xml";
        }
        else {
            System.setProperty("proteus.log.path", logPath);
            resource = "/io/proteus/events/cli/logback-file.xml";
        }

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(Main.class.getResource(resource));
        }
        catch (JoranException ex) {
            throw new IllegalStateException("Failed to configure logging with " + resource, ex);
        }
    }

    /**
     * One line per distinct message in the cause chain, each tagged with a readable exception kind:
     * {@code Task not found: t1 (task not found)}.
     */
    static String formatExceptionMessage(Throwable ex)
    {
        List<String> seen = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        for (Throwable cause : Throwables.getCausalChain(ex)) {
            String message = isNullOrEmpty(cause.getMessage()) ? cause.getClass().getSimpleName() : cause.getMessage();
            if (seen.stream().anyMatch(s -> s.contains(message))) {
                continue;
            }
            seen.add(message);
            if (sb.length() > 0) {
                sb.append("\n> ");
            }
            sb.append(message).append(" (").append(describeKind(cause)).append(")");
        }
        return sb.toString();
    }

    // TaskNotFoundException -> "task not found"
    private static String describeKind(Throwable ex)
    {
        return ex.getClass().getSimpleName()
            .replaceFirst("(?:Exception|Error)$", "")
            .replaceAll("([A-Z]+)([A-Z][a-z])", "$1 $2")
            .replaceAll("([a-z])([A-Z])", "$1 $2")
            .toLowerCase(ENGLISH);
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    server                             run job runners until terminated");
        err.println("    migrate (run|check)                migrate database");
        err.println("    jobs                               show jobs");
        err.println("    job add --schedule S --test-name T add a job");
        err.println("    probe --id ID                      register or update a probe");
        err.println("    tasks --probe ID                   show ready tasks of a probe");
        err.println("    task <id> --probe ID               show a task");
        err.println("    task <id> <action> --probe ID      notify, accept, reject or done");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
        }
        return systemExit(error);
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -c, --config PATH.properties     configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     add a system config");
        err.println("");
    }
}
