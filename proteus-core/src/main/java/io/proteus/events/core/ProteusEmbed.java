package io.proteus.events.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.util.Modules;
import io.proteus.events.core.config.Config;
import io.proteus.events.core.config.ConfigFactory;
import io.proteus.events.core.config.PropertyUtils;
import io.proteus.events.core.database.DataSourceProvider;
import io.proteus.events.core.database.DatabaseModule;
import io.proteus.events.core.database.TransactionManager;
import io.proteus.events.core.job.JobModule;
import io.proteus.events.core.job.JobScheduler;
import io.proteus.events.core.task.TaskLifecycle;
import io.proteus.events.core.task.TaskModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine together.
 *
 * <pre>
 *   try (ProteusEmbed embed = new ProteusEmbed.Bootstrap()
 *           .setSystemConfig(props)
 *           .initialize()) {
 *       embed.getJobScheduler().addJob(request);
 *   }
 * </pre>
 */
public class ProteusEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(ProteusEmbed.class);

    public static class Bootstrap
    {
        private final List<Module> additionalModules = new ArrayList<>();
        private final List<Module> overridingModules = new ArrayList<>();
        private Properties systemConfig = new Properties();
        private boolean withScheduler = true;

        public Bootstrap addModules(Module... modules)
        {
            additionalModules.addAll(Arrays.asList(modules));
            return this;
        }

        public Bootstrap overrideModulesWith(Module... modules)
        {
            overridingModules.addAll(Arrays.asList(modules));
            return this;
        }

        public Bootstrap setSystemConfig(Properties systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        /**
         * If false, jobs are only stored and no runner starts.
         */
        public Bootstrap withScheduler(boolean v)
        {
            this.withScheduler = v;
            return this;
        }

        public ProteusEmbed initialize()
        {
            Injector injector = Guice.createInjector(
                    Modules.override(standardModules()).with(overridingModules));
            ProteusEmbed embed = new ProteusEmbed(injector, withScheduler);
            embed.start();
            return embed;
        }

        private List<Module> standardModules()
        {
            Properties props = systemConfig;
            return ImmutableList.<Module>builder()
                .add(new DatabaseModule())
                .add(new JobModule())
                .add(new TaskModule())
                .add((binder) -> {
                    binder.bind(ObjectMapper.class).toInstance(ObjectMappers.objectMapper());
                    binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
                    binder.bind(Properties.class).toInstance(props);
                    binder.bind(Config.class).toProvider(SystemConfigProvider.class).in(Scopes.SINGLETON);
                })
                .addAll(additionalModules)
                .build();
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(Properties props, ConfigFactory cf)
        {
            this.systemConfig = PropertyUtils.toConfig(props, cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;
    private final boolean withScheduler;

    ProteusEmbed(Injector injector, boolean withScheduler)
    {
        this.injector = injector;
        this.withScheduler = withScheduler;
    }

    private void start()
    {
        injector.getInstance(DatabaseModule.AutoMigrator.class).migrate();
        if (withScheduler) {
            getJobScheduler().start();
        }
    }

    public Injector getInjector()
    {
        return injector;
    }

    public JobScheduler getJobScheduler()
    {
        return injector.getInstance(JobScheduler.class);
    }

    public TaskLifecycle getTaskLifecycle()
    {
        return injector.getInstance(TaskLifecycle.class);
    }

    public TransactionManager getTransactionManager()
    {
        return injector.getInstance(TransactionManager.class);
    }

    @Override
    public void close()
    {
        try {
            if (withScheduler) {
                getJobScheduler().shutdown();
            }
        }
        finally {
            injector.getInstance(DataSourceProvider.class).close();
            logger.debug("Closed database");
        }
    }
}
