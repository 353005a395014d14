package io.proteus.events.core.database;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.proteus.events.core.database.migrate.Migration;
import io.proteus.events.core.database.migrate.MigrationContext;
import io.proteus.events.core.database.migrate.Migration_20161020103000_CreateTables;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = ImmutableList.sortedCopyOf(
            Comparator.comparing(Migration::getVersion),
            ImmutableList.of(
                new Migration_20161020103000_CreateTables()
            ));

    private final Jdbi dbi;
    private final String databaseType;

    @Inject
    public DatabaseMigrator(Jdbi dbi, DatabaseConfig config)
    {
        this(dbi, config.getType());
    }

    DatabaseMigrator(Jdbi dbi, String databaseType)
    {
        this.dbi = dbi;
        this.databaseType = databaseType;
    }

    public static String getDriverClassName(String type)
    {
        switch (type) {
        case "h2":
            return "org.h2.Driver";
        case "postgresql":
            return "org.postgresql.Driver";
        default:
            throw new RuntimeException("Unsupported database type: " + type);
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        MigrationContext context = new MigrationContext(databaseType);
        Set<String> appliedSet;
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                createSchemaMigrationsTable(handle, context);
            }
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(context, m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            logger.info("{} migrations applied.", numApplied);
        }
        return numApplied;
    }

    // synchronized so that threads of this process don't run the same migration twice
    private synchronized boolean applyMigrationIfNotDone(MigrationContext context, Migration m)
    {
        try (Handle handle = dbi.open()) {
            return handle.inTransaction((h) -> {
                if (context.isPostgres()) {
                    // other processes may be migrating the same database
                    h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                    if (checkIfMigrationApplied(h, m.getVersion())) {
                        return false;
                    }
                }
                logger.info("Applying database migration: {}", m.getVersion());
                applyMigration(m, h, context);
                return true;
            });
        }
    }

    /**
     * Called from cli migrate.
     *
     * @return migrations not applied yet
     */
    public List<Migration> getApplicableMigration()
    {
        List<Migration> applicableMigrations = new ArrayList<>();
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                return new ArrayList<>(migrations);
            }

            Set<String> appliedSet = getAppliedMigrationNames(handle);
            for (Migration m : migrations) {
                if (!appliedSet.contains(m.getVersion())) {
                    applicableMigrations.add(m);
                }
            }
        }
        return applicableMigrations;
    }

    private Set<String> getAppliedMigrationNames(Handle handle)
    {
        return new HashSet<>(
                handle.createQuery("select name from schema_migrations")
                .mapTo(String.class)
                .list());
    }

    private boolean checkIfMigrationApplied(Handle handle, String name)
    {
        return handle.createQuery("select name from schema_migrations where name = :name limit 1")
            .bind("name", name)
            .mapTo(String.class)
            .findFirst()
            .isPresent();
    }

    @VisibleForTesting
    void createSchemaMigrationsTable(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("schema_migrations")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
    }

    // Called from cli migrate
    public boolean existsSchemaMigrationsTable()
    {
        try (Handle handle = dbi.open()) {
            return existsSchemaMigrationsTable(handle);
        }
    }

    private boolean existsSchemaMigrationsTable(Handle handle)
    {
        try {
            handle.createQuery("select name from schema_migrations limit 1")
                    .mapTo(String.class)
                    .list();
            return true;
        }
        catch (RuntimeException re) {
            logger.trace("schema_migrations table is not readable", re);
            return false;
        }
    }

    private void applyMigration(Migration m, Handle handle, MigrationContext context)
    {
        m.migrate(handle, context);
        handle.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
    }
}
