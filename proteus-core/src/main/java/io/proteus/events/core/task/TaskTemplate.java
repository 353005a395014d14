package io.proteus.events.core.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * What every task of a firing carries. Arguments are any JSON value, opaque and copied verbatim.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTaskTemplate.class)
@JsonDeserialize(as = ImmutableTaskTemplate.class)
public abstract class TaskTemplate
{
    @JsonProperty("test_name")
    public abstract String getTestName();

    @JsonProperty("arguments")
    public abstract JsonNode getArguments();

    @Value.Check
    protected void check()
    {
        if (getTestName().isEmpty()) {
            throw new IllegalStateException("test_name must not be empty");
        }
    }

    public static TaskTemplate of(String testName, JsonNode arguments)
    {
        return ImmutableTaskTemplate.builder()
            .testName(testName)
            .arguments(arguments)
            .build();
    }
}
