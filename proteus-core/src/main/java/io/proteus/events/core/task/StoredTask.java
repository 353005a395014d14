package io.proteus.events.core.task;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredTask.class)
@JsonDeserialize(as = ImmutableStoredTask.class)
public abstract class StoredTask
{
    @JsonProperty("id")
    public abstract String getId();

    @JsonProperty("probe_id")
    public abstract String getProbeId();

    @JsonProperty("test_name")
    public abstract String getTestName();

    @JsonProperty("arguments")
    public abstract JsonNode getArguments();

    @JsonProperty("state")
    public abstract TaskStateCode getState();

    @JsonProperty("creation_time")
    public abstract Instant getCreatedAt();

    @JsonProperty("updated_time")
    public abstract Instant getUpdatedAt();

    @JsonProperty("notify_time")
    public abstract Optional<Instant> getNotifyTime();

    @JsonProperty("accept_time")
    public abstract Optional<Instant> getAcceptTime();

    @JsonProperty("done_time")
    public abstract Optional<Instant> getDoneTime();
}
