package io.proteus.events.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Inject;
import io.proteus.events.core.job.ImmutableStoredJob;
import io.proteus.events.core.job.JobRequest;
import io.proteus.events.core.job.JobStatus;
import io.proteus.events.core.job.JobStore;
import io.proteus.events.core.job.StoredJob;
import io.proteus.events.core.probe.Target;
import io.proteus.events.core.repository.ResourceNotFoundException;
import io.proteus.events.core.task.TaskTemplate;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public class DatabaseJobStoreManager
        extends BasicDatabaseStoreManager<DatabaseJobStoreManager.Dao>
        implements JobStore
{
    private final StringListMapper slm = new StringListMapper();

    @Inject
    public DatabaseJobStoreManager(TransactionManager transactionManager, JsonNodeMapper jnm, DatabaseConfig config)
    {
        super(config.getType(), Dao.class, transactionManager, jnm);
    }

    @Override
    public StoredJob addJob(JobRequest request, Instant nextRunAt, Instant now)
    {
        String jobId = UUID.randomUUID().toString();
        return autoCommit((handle, dao) -> {
            dao.insertJob(jobId,
                    request.getComment(),
                    request.getSchedule(),
                    request.getDelay(),
                    slm.toBinding(request.getTarget().getCountries()),
                    slm.toBinding(request.getTarget().getPlatforms()),
                    request.getTask().getTestName(),
                    request.getTask().getArguments(),
                    nextRunAt,
                    now);
            return dao.getJobById(jobId);
        });
    }

    @Override
    public List<StoredJob> getJobs()
    {
        return autoCommit((handle, dao) -> dao.getJobs());
    }

    @Override
    public List<StoredJob> getActiveJobs()
    {
        return autoCommit((handle, dao) -> dao.getActiveJobs());
    }

    @Override
    public StoredJob getJobById(String jobId)
        throws ResourceNotFoundException
    {
        return requiredResource(
                (handle, dao) -> dao.getJobById(jobId),
                "job id=%s", jobId);
    }

    @Override
    public void updateJobStatus(String jobId, JobStatus status, Instant now)
        throws ResourceNotFoundException
    {
        transaction((handle, dao) -> {
            int n = dao.updateJobStatus(jobId,
                    status.getTimesRun(),
                    status.getNextRunAt(),
                    status.getDone(),
                    now);
            if (n <= 0) {
                throw new ResourceNotFoundException("job id=" + jobId);
            }
            return null;
        }, ResourceNotFoundException.class);
    }

    public interface Dao
    {
        @SqlUpdate("insert into jobs" +
                " (id, comment, schedule, delay, target_countries, target_platforms, task_test_name, task_arguments," +
                " times_run, next_run_at, is_done, created_at, updated_at)" +
                " values (:id, :comment, :schedule, :delay, :targetCountries, :targetPlatforms, :taskTestName, :taskArguments," +
                " 0, :nextRunAt, false, :now, :now)")
        int insertJob(
                @Bind("id") String id,
                @Bind("comment") String comment,
                @Bind("schedule") String schedule,
                @Bind("delay") long delay,
                @Bind("targetCountries") String targetCountries,
                @Bind("targetPlatforms") String targetPlatforms,
                @Bind("taskTestName") String taskTestName,
                @Bind("taskArguments") JsonNode taskArguments,
                @Bind("nextRunAt") Instant nextRunAt,
                @Bind("now") Instant now);

        @SqlQuery("select * from jobs" +
                " order by created_at asc, id asc")
        List<StoredJob> getJobs();

        @SqlQuery("select * from jobs" +
                " where is_done = false" +
                " order by next_run_at asc, id asc")
        List<StoredJob> getActiveJobs();

        @SqlQuery("select * from jobs where id = :id")
        StoredJob getJobById(@Bind("id") String id);

        @SqlUpdate("update jobs" +
                " set times_run = :timesRun, next_run_at = :nextRunAt, is_done = :done, updated_at = :now" +
                " where id = :id")
        int updateJobStatus(
                @Bind("id") String id,
                @Bind("timesRun") int timesRun,
                @Bind("nextRunAt") Instant nextRunAt,
                @Bind("done") boolean done,
                @Bind("now") Instant now);
    }

    static class StoredJobMapper
            implements RowMapper<StoredJob>
    {
        private final JsonNodeMapper jnm;
        private final StringListMapper slm;

        public StoredJobMapper(JsonNodeMapper jnm, StringListMapper slm)
        {
            this.jnm = jnm;
            this.slm = slm;
        }

        @Override
        public StoredJob map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredJob.builder()
                .id(r.getString("id"))
                .comment(getOptionalString(r, "comment").or(""))
                .schedule(r.getString("schedule"))
                .delay(r.getLong("delay"))
                .target(Target.of(
                            slm.fromResultSetOrEmpty(r, "target_countries"),
                            slm.fromResultSetOrEmpty(r, "target_platforms")))
                .task(TaskTemplate.of(
                            r.getString("task_test_name"),
                            jnm.fromResultSet(r, "task_arguments")))
                .timesRun(r.getInt("times_run"))
                .nextRunAt(getTimestampInstant(r, "next_run_at"))
                .done(r.getBoolean("is_done"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .build();
        }
    }
}
