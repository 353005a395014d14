package io.proteus.events.core.database;

import com.google.common.base.Optional;
import io.proteus.events.core.config.Config;
import org.junit.Test;

import static io.proteus.events.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

public class DatabaseConfigTest
{
    @Test
    public void defaultIsInMemoryH2()
    {
        DatabaseConfig config = DatabaseConfig.convertFrom(createConfig());
        assertThat(config.getType(), is("h2"));
        assertThat(config.getPath(), is(Optional.absent()));
        assertThat(config.getAutoMigrate(), is(true));
        assertThat(DatabaseConfig.buildJdbcUrl(config), startsWith("jdbc:h2:mem:proteus-"));
    }

    @Test
    public void postgresqlReadsRemoteSettings()
    {
        Config source = createConfig()
            .set("database.type", "postgresql")
            .set("database.host", "db.example.org")
            .set("database.port", "6543")
            .set("database.user", "proteus")
            .set("database.database", "events")
            .set("database.maximumPoolSize", "4");

        DatabaseConfig config = DatabaseConfig.convertFrom(source);
        assertThat(config.getType(), is("postgresql"));
        assertThat(config.getMaximumPoolSize(), is(4));

        RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
        assertThat(remote.getHost(), is("db.example.org"));
        assertThat(remote.getPort(), is(Optional.of(6543)));
        assertThat(remote.getPassword(), is(""));
        assertThat(DatabaseConfig.buildJdbcUrl(config), is("jdbc:postgresql://db.example.org:6543/events"));
    }
}
