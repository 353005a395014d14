package io.proteus.events.core.job;

import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import io.proteus.events.core.config.Config;
import io.proteus.events.core.schedule.SystemTimeSource;
import io.proteus.events.core.schedule.TimeSource;

public class JobModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(SchedulerConfig.class).toProvider(SchedulerConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(TimeSource.class).to(SystemTimeSource.class).in(Scopes.SINGLETON);
        binder.bind(JobScheduler.class).in(Scopes.SINGLETON);
    }

    public static class SchedulerConfigProvider
            implements Provider<SchedulerConfig>
    {
        private final SchedulerConfig config;

        @Inject
        public SchedulerConfigProvider(Config systemConfig)
        {
            this.config = SchedulerConfig.convertFrom(systemConfig);
        }

        @Override
        public SchedulerConfig get()
        {
            return config;
        }
    }
}
