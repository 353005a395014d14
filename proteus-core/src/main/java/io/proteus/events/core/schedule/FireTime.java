package io.proteus.events.core.schedule;

import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
public interface FireTime
{
    Instant getTime();

    /**
     * True if the schedule has further firings after the one at {@link #getTime()}.
     */
    boolean hasMore();

    static FireTime of(Instant time, boolean hasMore)
    {
        return ImmutableFireTime.builder()
            .time(time)
            .hasMore(hasMore)
            .build();
    }
}
