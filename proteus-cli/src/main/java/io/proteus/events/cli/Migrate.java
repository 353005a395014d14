package io.proteus.events.cli;

import io.proteus.events.core.ObjectMappers;
import io.proteus.events.core.config.ConfigFactory;
import io.proteus.events.core.config.PropertyUtils;
import io.proteus.events.core.database.DataSourceProvider;
import io.proteus.events.core.database.DatabaseConfig;
import io.proteus.events.core.database.DatabaseMigrator;
import io.proteus.events.core.database.migrate.Migration;
import org.jdbi.v3.core.Jdbi;

import java.util.List;

import static io.proteus.events.cli.SystemExitException.systemExit;

/**
 * Applies or lists schema migrations without starting anything else.
 */
public class Migrate
    extends EmbedCommand
{
    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 1) {
            throw usage("Invalid parameters");
        }
        String action = args.get(0);
        if (!action.equals("run") && !action.equals("check")) {
            throw usage("Unknown action '" + action + "'");
        }
        if (database == null && configPath == null) {
            throw usage("--database, or --config option is required");
        }

        DatabaseConfig dbConfig = DatabaseConfig.convertFrom(
                PropertyUtils.toConfig(buildSystemProperties(), new ConfigFactory(ObjectMappers.objectMapper())));
        try (DataSourceProvider dsp = new DataSourceProvider(dbConfig)) {
            DatabaseMigrator migrator = new DatabaseMigrator(Jdbi.create(dsp.get()), dbConfig);
            if (action.equals("run")) {
                run(migrator);
            }
            else {
                check(migrator);
            }
        }
    }

    private void run(DatabaseMigrator migrator)
    {
        if (migrator.migrate() == 0) {
            out.println("No update");
        }
        else {
            out.println("Migrations successfully finished");
        }
    }

    private void check(DatabaseMigrator migrator)
    {
        if (!migrator.existsSchemaMigrationsTable()) {
            out.println("No table exist");
            return;
        }
        List<Migration> pending = migrator.getApplicableMigration();
        if (pending.isEmpty()) {
            out.println("No update");
        }
        for (Migration m : pending) {
            out.println(m.getVersion());
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " migrate (run|check)");
        err.println("    run      apply pending migrations");
        err.println("    check    list pending migrations");
        err.println("  Options:");
        err.println("    -c, --config PATH.properties     configuration file (default: " + ConfigUtil.defaultConfigPath(env) + ")");
        showDatabaseOptions(err);
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
