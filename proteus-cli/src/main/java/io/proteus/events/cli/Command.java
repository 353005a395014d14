package io.proteus.events.cli;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import io.proteus.events.core.config.PropertyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Base of every subcommand. Holds the options shared by all of them.
 */
public abstract class Command
{
    private static final Logger logger = LoggerFactory.getLogger(Command.class);

    static final String CONFIG_ENV = "PROTEUS_CONFIG";

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    /**
     * Merges configuration sources. Later sources override earlier ones:
     * the default file (skipped when --config is given), $PROTEUS_CONFIG,
     * JVM system properties and -X options, then the --config file.
     */
    protected Properties loadSystemProperties()
        throws IOException
    {
        Properties props = new Properties();
        if (configPath == null) {
            props.putAll(loadDefaultConfigFile());
        }
        props.putAll(loadConfigEnv());
        props.putAll(System.getProperties());
        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }
        return props;
    }

    private Properties loadDefaultConfigFile()
        throws IOException
    {
        Path path = ConfigUtil.defaultConfigPath(env);
        try {
            return PropertyUtils.loadFile(path);
        }
        catch (NoSuchFileException ex) {
            logger.trace("No configuration file at {}", path);
            return new Properties();
        }
    }

    private Properties loadConfigEnv()
        throws IOException
    {
        Properties props = new Properties();
        String text = Strings.nullToEmpty(env.get(CONFIG_ENV));
        props.load(new StringReader(text));
        return props;
    }
}
