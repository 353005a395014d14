package io.proteus.events.core.database;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Connection settings of a PostgreSQL server. Timeouts are in seconds.
 */
@Value.Immutable
public interface RemoteDatabaseConfig
{
    String getHost();

    Optional<Integer> getPort();

    String getDatabase();

    String getUser();

    String getPassword();

    int getLoginTimeout();

    int getSocketTimeout();

    Optional<String> getSslmode();

    static ImmutableRemoteDatabaseConfig.Builder builder()
    {
        return ImmutableRemoteDatabaseConfig.builder();
    }
}
