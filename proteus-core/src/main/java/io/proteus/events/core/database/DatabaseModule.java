package io.proteus.events.core.database;

import javax.sql.DataSource;

import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import io.proteus.events.core.job.JobStore;
import io.proteus.events.core.probe.ProbeRegistry;
import io.proteus.events.core.task.TaskStore;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(Jdbi.class).toProvider(JdbiProvider.class);
        binder.bind(AutoMigrator.class).in(Scopes.SINGLETON);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(JsonNodeMapper.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseMigrator.class).in(Scopes.SINGLETON);
        binder.bind(JobStore.class).to(DatabaseJobStoreManager.class).in(Scopes.SINGLETON);
        binder.bind(TaskStore.class).to(DatabaseTaskStoreManager.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseProbeRegistry.class).in(Scopes.SINGLETON);
        binder.bind(ProbeRegistry.class).to(DatabaseProbeRegistry.class);
    }

    public static class AutoMigrator
    {
        private final DatabaseMigrator migrator;
        private final boolean enabled;

        @Inject
        public AutoMigrator(DatabaseMigrator migrator, DatabaseConfig config)
        {
            this.migrator = migrator;
            this.enabled = config.getAutoMigrate();
        }

        public void migrate()
        {
            if (enabled) {
                migrator.migrate();
            }
        }
    }

    public static class JdbiProvider
            implements Provider<Jdbi>
    {
        private final DataSource ds;

        @Inject
        public JdbiProvider(DataSource ds)
        {
            this.ds = ds;
        }

        @Override
        public Jdbi get()
        {
            Jdbi jdbi = Jdbi.create(ds);
            jdbi.installPlugin(new SqlObjectPlugin());
            return jdbi;
        }
    }
}
