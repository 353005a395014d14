package io.proteus.events.core.database;

import java.time.Instant;
import java.util.List;

import com.google.common.collect.ImmutableList;
import io.proteus.events.core.job.JobRequest;
import io.proteus.events.core.job.JobStatus;
import io.proteus.events.core.job.StoredJob;
import io.proteus.events.core.probe.Target;
import io.proteus.events.core.repository.ResourceNotFoundException;
import io.proteus.events.core.task.TaskTemplate;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.proteus.events.core.database.DatabaseTestingUtils.assertNotFound;
import static io.proteus.events.core.database.DatabaseTestingUtils.json;
import static io.proteus.events.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class DatabaseJobStoreManagerTest
{
    private static final Instant T0 = Instant.parse("2016-10-20T10:30:00Z");

    private DatabaseFactory factory;
    private DatabaseJobStoreManager store;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        store = factory.getJobStoreManager();
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    private static JobRequest request(String schedule)
    {
        return JobRequest.builder()
            .schedule(schedule)
            .delay(60)
            .comment("web connectivity of " + schedule)
            .task(TaskTemplate.of("web_connectivity", json("{\"urls\":[\"http://example.com\"]}")))
            .target(Target.of(ImmutableList.of("IT", "DE"), ImmutableList.of("android")))
            .build();
    }

    @Test
    public void addAndGetJob()
            throws Exception
    {
        JobRequest req = request("now/1h/3");
        StoredJob job = factory.begin(() -> store.addJob(req, T0.plusSeconds(60), T0));

        assertThat(job.getComment(), is(req.getComment()));
        assertThat(job.getSchedule(), is("now/1h/3"));
        assertThat(job.getDelay(), is(60L));
        assertThat(job.getTarget(), is(req.getTarget()));
        assertThat(job.getTask(), is(req.getTask()));
        assertThat(job.getTimesRun(), is(0));
        assertThat(job.getNextRunAt(), is(T0.plusSeconds(60)));
        assertThat(job.getDone(), is(false));
        assertThat(job.getCreatedAt(), is(T0));

        StoredJob fetched = factory.autoCommit(() -> store.getJobById(job.getId()));
        assertThat(fetched, is(job));
    }

    @Test
    public void emptyTargetAndArgumentsRoundTrip()
            throws Exception
    {
        JobRequest req = JobRequest.builder()
            .schedule("now")
            .task(TaskTemplate.of("ndt", json("{}")))
            .build();
        StoredJob job = factory.begin(() -> store.addJob(req, T0, T0));

        assertThat(job.getComment(), is(""));
        assertThat(job.getTarget().getCountries(), is(empty()));
        assertThat(job.getTarget().getPlatforms(), is(empty()));
        assertThat(job.getTask().getArguments(), is(json("{}")));
        assertThat(job.getTask().getArguments().toString(), is("{}"));
    }

    @Test
    public void arrayArgumentsRoundTrip()
            throws Exception
    {
        JobRequest req = JobRequest.builder()
            .schedule("now")
            .task(TaskTemplate.of("ndt", json("[1,\"two\",[3]]")))
            .build();
        StoredJob job = factory.begin(() -> store.addJob(req, T0, T0));

        assertThat(job.getTask().getArguments().toString(), is("[1,\"two\",[3]]"));
    }

    @Test
    public void updateStatusAndListActive()
            throws Exception
    {
        StoredJob a = factory.begin(() -> store.addJob(request("now/1h/2"), T0, T0));
        StoredJob b = factory.begin(() -> store.addJob(request("now/1h"), T0.plusSeconds(10), T0));

        factory.begin(() -> store.updateJobStatus(a.getId(), JobStatus.of(2, T0.plusSeconds(3600), true), T0.plusSeconds(3600)));
        factory.begin(() -> store.updateJobStatus(b.getId(), JobStatus.of(1, T0.plusSeconds(3610), false), T0.plusSeconds(3600)));

        List<StoredJob> all = factory.autoCommit(() -> store.getJobs());
        assertThat(all, hasSize(2));

        List<StoredJob> active = factory.autoCommit(() -> store.getActiveJobs());
        assertThat(active, hasSize(1));
        StoredJob activeJob = active.get(0);
        assertThat(activeJob.getId(), is(b.getId()));
        assertThat(activeJob.getTimesRun(), is(1));
        assertThat(activeJob.getNextRunAt(), is(T0.plusSeconds(3610)));
        assertThat(activeJob.getUpdatedAt(), is(T0.plusSeconds(3600)));

        StoredJob done = factory.autoCommit(() -> store.getJobById(a.getId()));
        assertThat(done.getStatus(), is(JobStatus.of(2, T0.plusSeconds(3600), true)));
    }

    @Test
    public void notFound()
            throws Exception
    {
        assertNotFound(() -> factory.get().autoCommit(() -> store.getJobById("nope"), ResourceNotFoundException.class));
        assertNotFound(() -> factory.get().begin(() -> {
            store.updateJobStatus("nope", JobStatus.of(1, T0, false), T0);
            return null;
        }, ResourceNotFoundException.class));
        assertThat(factory.autoCommit(() -> store.getJobs()), is(empty()));
    }

    @Test
    public void jobsAreListedInCreationOrder()
            throws Exception
    {
        StoredJob first = factory.begin(() -> store.addJob(request("now"), T0, T0));
        StoredJob second = factory.begin(() -> store.addJob(request("now"), T0, T0.plusSeconds(1)));
        List<StoredJob> all = factory.autoCommit(() -> store.getJobs());
        assertThat(all, contains(first, second));
    }
}
