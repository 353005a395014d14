package io.proteus.events.core.database;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.proteus.events.core.config.Config;
import io.proteus.events.core.config.ConfigException;
import org.immutables.value.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

import static java.util.Locale.ENGLISH;

/**
 * Where jobs and tasks are stored.
 *
 * <ul>
 * <li>{@code database.type=memory}: a private in-memory H2 database (default)</li>
 * <li>{@code database.type=h2}: an H2 database under {@code database.path}</li>
 * <li>{@code database.type=postgresql}: a remote PostgreSQL server</li>
 * </ul>
 *
 * {@code database.opts.*} keys are passed to the JDBC driver as they are.
 */
@Value.Immutable
public interface DatabaseConfig
{
    /**
     * {@code h2} or {@code postgresql}. A memory database is reported as {@code h2}.
     */
    String getType();

    /**
     * Directory of an H2 file database. Absent for a memory database.
     */
    Optional<String> getPath();

    Optional<RemoteDatabaseConfig> getRemoteDatabaseConfig();

    Map<String, String> getOptions();

    boolean getAutoMigrate();

    // connection pool of remote databases, in seconds
    int getConnectionTimeout();

    int getIdleTimeout();

    int getMinimumPoolSize();

    int getMaximumPoolSize();

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        return convertFrom(config, "database");
    }

    static DatabaseConfig convertFrom(Config config, String prefix)
    {
        Keys keys = new Keys(config, prefix);
        ImmutableDatabaseConfig.Builder builder = builder()
            .autoMigrate(keys.get("migrate", boolean.class, true))
            .connectionTimeout(keys.get("connectionTimeout", int.class, 30))
            .idleTimeout(keys.get("idleTimeout", int.class, 600))
            .minimumPoolSize(keys.get("minimumPoolSize", int.class, 1))
            .maximumPoolSize(keys.get("maximumPoolSize", int.class, 16))
            .options(keys.options());

        String type = keys.get("type", String.class, "memory");
        switch (type) {
        case "memory":
            return builder.type("h2").build();
        case "h2":
            return builder.type("h2")
                .path(keys.get("path", String.class))
                .build();
        case "postgresql":
            return builder.type("postgresql")
                .remoteDatabaseConfig(RemoteDatabaseConfig.builder()
                        .host(keys.get("host", String.class))
                        .port(keys.getOptional("port", Integer.class))
                        .database(keys.get("database", String.class))
                        .user(keys.get("user", String.class))
                        .password(keys.get("password", String.class, ""))
                        .loginTimeout(keys.get("loginTimeout", int.class, 30))
                        .socketTimeout(keys.get("socketTimeout", int.class, 1800))
                        .sslmode(keys.getOptional("sslmode", String.class))
                        .build())
                .build();
        default:
            throw new ConfigException("Unknown " + prefix + ".type: " + type);
        }
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        if (isPostgres(config.getType())) {
            RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
            String host = remote.getHost();
            if (remote.getPort().isPresent()) {
                host = host + ":" + remote.getPort().get();
            }
            return String.format(ENGLISH, "jdbc:postgresql://%s/%s", host, remote.getDatabase());
        }

        if (!config.getPath().isPresent()) {
            return "jdbc:h2:mem:proteus-" + UUID.randomUUID();
        }
        Path dir = Paths.get(config.getPath().get()).toAbsolutePath();
        try {
            Files.createDirectories(dir);
        }
        catch (IOException ex) {
            throw new ConfigException("Failed to create database directory " + dir, ex);
        }
        return "jdbc:h2:" + dir.resolve("proteus");
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        if (config.getRemoteDatabaseConfig().isPresent()) {
            RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
            props.setProperty("user", remote.getUser());
            props.setProperty("password", remote.getPassword());
            props.setProperty("loginTimeout", Integer.toString(remote.getLoginTimeout()));
            props.setProperty("socketTimeout", Integer.toString(remote.getSocketTimeout()));
            props.setProperty("tcpKeepAlive", "true");
            if (remote.getSslmode().isPresent()) {
                props.setProperty("sslmode", remote.getSslmode().get());
            }
        }
        props.putAll(config.getOptions());
        return props;
    }

    static boolean isPostgres(String databaseType)
    {
        return databaseType.equals("postgresql");
    }

    final class Keys
    {
        private final Config config;
        private final String prefix;

        private Keys(Config config, String prefix)
        {
            this.config = config;
            this.prefix = prefix + ".";
        }

        <E> E get(String name, Class<E> type)
        {
            return config.get(prefix + name, type);
        }

        <E> E get(String name, Class<E> type, E defaultValue)
        {
            return config.get(prefix + name, type, defaultValue);
        }

        <E> Optional<E> getOptional(String name, Class<E> type)
        {
            return config.getOptional(prefix + name, type);
        }

        Map<String, String> options()
        {
            String optionPrefix = prefix + "opts.";
            ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
            for (String key : config.getKeys()) {
                if (key.startsWith(optionPrefix)) {
                    options.put(key.substring(optionPrefix.length()), config.get(key, String.class));
                }
            }
            return options.build();
        }
    }
}
