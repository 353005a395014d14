package io.proteus.events.core.job;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Run bookkeeping of a job. Only the job's runner changes it.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableJobStatus.class)
@JsonDeserialize(as = ImmutableJobStatus.class)
public abstract class JobStatus
{
    @JsonProperty("times_run")
    public abstract int getTimesRun();

    @JsonProperty("next_run_at")
    public abstract Instant getNextRunAt();

    @JsonProperty("is_done")
    public abstract boolean getDone();

    public static JobStatus of(int timesRun, Instant nextRunAt, boolean done)
    {
        return ImmutableJobStatus.builder()
            .timesRun(timesRun)
            .nextRunAt(nextRunAt)
            .done(done)
            .build();
    }
}
