package io.proteus.events.core.database;

import java.sql.Connection;
import java.sql.SQLException;

import javax.sql.DataSource;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the data source on first use. H2 is used without a pool, PostgreSQL through HikariCP.
 */
public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DataSourceProvider.class);

    private final DatabaseConfig config;
    private DataSource ds;
    private HikariDataSource pool;
    private Connection keepAlive;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            String url = DatabaseConfig.buildJdbcUrl(config);
            logger.debug("Opening database {}", url);
            if (DatabaseConfig.isPostgres(config.getType())) {
                ds = openPool(url);
            }
            else {
                ds = openH2(url);
            }
        }
        return ds;
    }

    private DataSource openH2(String url)
    {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");
        // in-memory h2 drops its data when the last connection closes; hold one until close()
        try {
            keepAlive = h2.getConnection();
        }
        catch (SQLException ex) {
            throw new IllegalStateException("Failed to open database " + url, ex);
        }
        return h2;
    }

    private DataSource openPool(String url)
    {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName(DatabaseMigrator.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));
        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setMinimumIdle(config.getMinimumPoolSize());
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setPoolName("proteus-db");
        // no connectionTestQuery: ThreadLocalTransactionManager needs isValid() to fail on aborted transactions
        pool = new HikariDataSource(hikari);
        return pool;
    }

    @Override
    public synchronized void close()
    {
        if (pool != null) {
            pool.close();
            pool = null;
        }
        if (keepAlive != null) {
            try {
                keepAlive.close();
            }
            catch (SQLException ex) {
                logger.warn("Failed to close database connection", ex);
            }
            keepAlive = null;
        }
        ds = null;
    }
}
