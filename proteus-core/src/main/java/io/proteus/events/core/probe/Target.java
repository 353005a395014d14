package io.proteus.events.core.probe;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Filter over the probe population. An empty list places no restriction on its axis.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTarget.class)
@JsonDeserialize(as = ImmutableTarget.class)
public abstract class Target
{
    @JsonProperty("countries")
    public abstract List<String> getCountries();

    @JsonProperty("platforms")
    public abstract List<String> getPlatforms();

    public static Target of(List<String> countries, List<String> platforms)
    {
        return ImmutableTarget.builder()
            .countries(countries)
            .platforms(platforms)
            .build();
    }

    public static Target everyone()
    {
        return ImmutableTarget.builder().build();
    }
}
