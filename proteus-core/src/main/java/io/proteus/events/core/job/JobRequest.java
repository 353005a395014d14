package io.proteus.events.core.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.proteus.events.core.probe.Target;
import io.proteus.events.core.task.TaskTemplate;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobRequest.class)
@JsonDeserialize(as = ImmutableJobRequest.class)
public abstract class JobRequest
{
    @JsonProperty("schedule")
    public abstract String getSchedule();

    /**
     * Seconds added to the start time of the schedule before the first firing.
     */
    @JsonProperty("delay")
    @Value.Default
    public long getDelay()
    {
        return 0L;
    }

    @JsonProperty("comment")
    @Value.Default
    public String getComment()
    {
        return "";
    }

    @JsonProperty("task")
    public abstract TaskTemplate getTask();

    @JsonProperty("target")
    @Value.Default
    public Target getTarget()
    {
        return Target.everyone();
    }

    @Value.Check
    protected void check()
    {
        if (getDelay() < 0) {
            throw new IllegalStateException("delay must not be negative: " + getDelay());
        }
    }

    public static ImmutableJobRequest.Builder builder()
    {
        return ImmutableJobRequest.builder();
    }
}
