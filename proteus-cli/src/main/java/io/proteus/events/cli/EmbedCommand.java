package io.proteus.events.cli;

import com.beust.jcommander.Parameter;
import io.proteus.events.core.ProteusEmbed;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * A command that works on the database directly.
 */
public abstract class EmbedCommand
    extends Command
{
    @Parameter(names = {"-o", "--database"})
    protected String database = null;

    @Parameter(names = {"-m", "--memory"})
    protected boolean memoryDatabase = false;

    protected Properties buildSystemProperties()
        throws IOException, SystemExitException
    {
        if (database != null && memoryDatabase) {
            throw usage("Setting both --database and --memory is invalid");
        }

        Properties props = loadSystemProperties();
        if (database != null) {
            props.setProperty("database.type", "h2");
            props.setProperty("database.path", Paths.get(database).toAbsolutePath().toString());
        }
        else if (memoryDatabase) {
            props.setProperty("database.type", "memory");
        }
        return props;
    }

    /**
     * Opens the database without starting job runners.
     */
    protected ProteusEmbed openEmbed()
        throws IOException, SystemExitException
    {
        return new ProteusEmbed.Bootstrap()
            .setSystemConfig(buildSystemProperties())
            .withScheduler(false)
            .initialize();
    }

    protected static void showDatabaseOptions(PrintStream err)
    {
        err.println("    -o, --database DIR               use the H2 database in this directory");
        err.println("    -m, --memory                     use a memory database");
    }
}
