package io.proteus.events.core.job;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.proteus.events.core.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableSchedulerConfig.class)
@JsonDeserialize(as = ImmutableSchedulerConfig.class)
public interface SchedulerConfig
{
    boolean getEnabled();

    /**
     * Seconds to wait for in-flight firings at shutdown.
     */
    int getShutdownWait();

    /**
     * Seconds until a failed firing of a one-shot job is attempted again.
     * Repeating jobs retry at their next regular fire time.
     */
    int getRetryInterval();

    static ImmutableSchedulerConfig.Builder defaultBuilder()
    {
        return ImmutableSchedulerConfig.builder()
            .enabled(true)
            .shutdownWait(30)
            .retryInterval(60);
    }

    static SchedulerConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .enabled(config.get("scheduler.enabled", boolean.class, true))
            .shutdownWait(config.get("scheduler.shutdown-wait", int.class, 30))
            .retryInterval(config.get("scheduler.retry-interval", int.class, 60))
            .build();
    }
}
