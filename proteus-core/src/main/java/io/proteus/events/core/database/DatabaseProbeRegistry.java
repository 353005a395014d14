package io.proteus.events.core.database;

import java.util.List;

import com.google.inject.Inject;
import io.proteus.events.core.probe.ProbeRegistry;
import io.proteus.events.core.repository.ResourceConflictException;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Probe population kept in the probes table.
 */
public class DatabaseProbeRegistry
        extends BasicDatabaseStoreManager<DatabaseProbeRegistry.Dao>
        implements ProbeRegistry
{
    @Inject
    public DatabaseProbeRegistry(TransactionManager transactionManager, JsonNodeMapper jnm, DatabaseConfig config)
    {
        super(config.getType(), Dao.class, transactionManager, jnm);
    }

    @Override
    public List<String> resolveTargets(List<String> countries, List<String> platforms)
    {
        return autoCommit((handle, dao) -> {
            StringBuilder sql = new StringBuilder("select id from probes where 1 = 1");
            if (!countries.isEmpty()) {
                sql.append(" and country in (<countries>)");
            }
            if (!platforms.isEmpty()) {
                sql.append(" and platform in (<platforms>)");
            }
            sql.append(" order by id asc");

            Query query = handle.createQuery(sql.toString());
            if (!countries.isEmpty()) {
                query.bindList("countries", countries);
            }
            if (!platforms.isEmpty()) {
                query.bindList("platforms", platforms);
            }
            return query.mapTo(String.class).list();
        });
    }

    /**
     * Registers a probe or updates its country and platform.
     * Must not run inside a transaction opened by {@code begin}.
     */
    public void putProbe(String probeId, String country, String platform)
    {
        if (autoCommit((handle, dao) -> dao.updateProbe(probeId, country, platform)) > 0) {
            return;
        }
        try {
            catchConflict(() ->
                    autoCommit((handle, dao) -> dao.insertProbe(probeId, country, platform)),
                    "probe id=%s", probeId);
        }
        catch (ResourceConflictException ex) {
            // registered concurrently
            autoCommit((handle, dao) -> dao.updateProbe(probeId, country, platform));
        }
    }

    public List<String> getProbeIds()
    {
        return autoCommit((handle, dao) -> dao.getProbeIds());
    }

    public interface Dao
    {
        @SqlQuery("select id from probes order by id asc")
        List<String> getProbeIds();

        @SqlUpdate("insert into probes (id, country, platform, created_at, updated_at)" +
                " values (:id, :country, :platform, now(), now())")
        int insertProbe(@Bind("id") String id, @Bind("country") String country, @Bind("platform") String platform);

        @SqlUpdate("update probes" +
                " set country = :country, platform = :platform, updated_at = now()" +
                " where id = :id")
        int updateProbe(@Bind("id") String id, @Bind("country") String country, @Bind("platform") String platform);
    }
}
