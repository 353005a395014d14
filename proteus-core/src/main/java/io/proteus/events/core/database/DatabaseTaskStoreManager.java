package io.proteus.events.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Inject;
import io.proteus.events.core.task.ImmutableStoredTask;
import io.proteus.events.core.task.StoredTask;
import io.proteus.events.core.task.TaskNotFoundException;
import io.proteus.events.core.task.TaskStateCode;
import io.proteus.events.core.task.TaskStore;
import io.proteus.events.core.task.TaskTemplate;
import io.proteus.events.core.task.TaskTimestamp;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import static com.google.common.base.Preconditions.checkArgument;

public class DatabaseTaskStoreManager
        extends BasicDatabaseStoreManager<DatabaseTaskStoreManager.Dao>
        implements TaskStore
{
    @Inject
    public DatabaseTaskStoreManager(TransactionManager transactionManager, JsonNodeMapper jnm, DatabaseConfig config)
    {
        super(config.getType(), Dao.class, transactionManager, jnm);
    }

    @Override
    public StoredTask getTaskById(String taskId)
        throws TaskNotFoundException
    {
        StoredTask task = autoCommit((handle, dao) -> dao.getTaskById(taskId));
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    @Override
    public List<StoredTask> getReadyTasksOfProbe(String probeId, Instant since)
    {
        return autoCommit((handle, dao) -> dao.getTasksOfProbeInState(probeId, TaskStateCode.READY.get(), since));
    }

    @Override
    public StoredTask addTask(String probeId, TaskTemplate template, Instant now)
    {
        String taskId = UUID.randomUUID().toString();
        return autoCommit((handle, dao) -> {
            dao.insertTask(taskId, probeId,
                    template.getTestName(),
                    template.getArguments(),
                    TaskStateCode.READY.get(),
                    now);
            return dao.getTaskById(taskId);
        });
    }

    @Override
    public boolean updateState(String taskId, Collection<TaskStateCode> allowedFrom, TaskStateCode to,
            TaskTimestamp timestamp, Instant now)
    {
        checkArgument(!allowedFrom.isEmpty(), "allowedFrom must not be empty");
        List<Short> codes = allowedFrom.stream()
            .map(TaskStateCode::get)
            .collect(Collectors.toList());

        // the state condition makes this a compare-and-swap; a concurrent
        // transition that committed first leaves no row to update
        int n = autoCommit((handle, dao) ->
                handle.createUpdate("update tasks" +
                        " set state = :to, " + timestamp.getColumnName() + " = :now, updated_at = :now" +
                        " where id = :id" +
                        " and state in (<allowedFrom>)")
                    .bind("id", taskId)
                    .bind("to", to.get())
                    .bind("now", now)
                    .bindList("allowedFrom", codes)
                    .execute());
        return n == 1;
    }

    public interface Dao
    {
        @SqlQuery("select * from tasks where id = :id")
        StoredTask getTaskById(@Bind("id") String id);

        @SqlQuery("select * from tasks" +
                " where state = :state" +
                " and probe_id = :probeId" +
                " and created_at >= :since" +
                " order by created_at asc, id asc")
        List<StoredTask> getTasksOfProbeInState(
                @Bind("probeId") String probeId,
                @Bind("state") short state,
                @Bind("since") Instant since);

        @SqlUpdate("insert into tasks" +
                " (id, probe_id, test_name, arguments, state, created_at, updated_at)" +
                " values (:id, :probeId, :testName, :arguments, :state, :now, :now)")
        int insertTask(
                @Bind("id") String id,
                @Bind("probeId") String probeId,
                @Bind("testName") String testName,
                @Bind("arguments") JsonNode arguments,
                @Bind("state") short state,
                @Bind("now") Instant now);
    }

    static class StoredTaskMapper
            implements RowMapper<StoredTask>
    {
        private final JsonNodeMapper jnm;

        public StoredTaskMapper(JsonNodeMapper jnm)
        {
            this.jnm = jnm;
        }

        @Override
        public StoredTask map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredTask.builder()
                .id(r.getString("id"))
                .probeId(r.getString("probe_id"))
                .testName(r.getString("test_name"))
                .arguments(jnm.fromResultSet(r, "arguments"))
                .state(TaskStateCode.of(r.getShort("state")))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .notifyTime(getOptionalTimestampInstant(r, "notify_time"))
                .acceptTime(getOptionalTimestampInstant(r, "accept_time"))
                .doneTime(getOptionalTimestampInstant(r, "done_time"))
                .build();
        }
    }
}
