package io.proteus.events.core.job;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.proteus.events.core.probe.Target;
import io.proteus.events.core.task.TaskTemplate;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredJob.class)
@JsonDeserialize(as = ImmutableStoredJob.class)
public abstract class StoredJob
{
    @JsonProperty("id")
    public abstract String getId();

    @JsonProperty("comment")
    public abstract String getComment();

    @JsonProperty("schedule")
    public abstract String getSchedule();

    @JsonProperty("delay")
    public abstract long getDelay();

    @JsonProperty("target")
    public abstract Target getTarget();

    @JsonProperty("task")
    public abstract TaskTemplate getTask();

    @JsonProperty("times_run")
    public abstract int getTimesRun();

    @JsonProperty("next_run_at")
    public abstract Instant getNextRunAt();

    @JsonProperty("is_done")
    public abstract boolean getDone();

    @JsonProperty("creation_time")
    public abstract Instant getCreatedAt();

    @JsonProperty("updated_time")
    public abstract Instant getUpdatedAt();

    @JsonIgnore
    public JobStatus getStatus()
    {
        return JobStatus.of(getTimesRun(), getNextRunAt(), getDone());
    }

    public StoredJob withStatus(JobStatus status)
    {
        return ImmutableStoredJob.builder()
            .from(this)
            .timesRun(status.getTimesRun())
            .nextRunAt(status.getNextRunAt())
            .done(status.getDone())
            .build();
    }
}
