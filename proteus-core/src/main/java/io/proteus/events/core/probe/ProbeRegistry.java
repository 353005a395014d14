package io.proteus.events.core.probe;

import java.util.List;

public interface ProbeRegistry
{
    /**
     * Returns ids of the probes matching the filter, ordered by id.
     *
     * Values are OR-matched within an axis and AND-matched across axes.
     * An empty list matches every probe on that axis.
     */
    List<String> resolveTargets(List<String> countries, List<String> platforms);

    default List<String> resolveTargets(Target target)
    {
        return resolveTargets(target.getCountries(), target.getPlatforms());
    }
}
