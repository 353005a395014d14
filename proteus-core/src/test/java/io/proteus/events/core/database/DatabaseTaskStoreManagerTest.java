package io.proteus.events.core.database;

import java.time.Instant;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.proteus.events.core.task.StoredTask;
import io.proteus.events.core.task.TaskNotFoundException;
import io.proteus.events.core.task.TaskStateCode;
import io.proteus.events.core.task.TaskTemplate;
import io.proteus.events.core.task.TaskTimestamp;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.proteus.events.core.database.DatabaseTestingUtils.assertNotFound;
import static io.proteus.events.core.database.DatabaseTestingUtils.json;
import static io.proteus.events.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class DatabaseTaskStoreManagerTest
{
    private static final Instant T0 = Instant.parse("2016-10-20T10:30:00Z");

    private DatabaseFactory factory;
    private DatabaseTaskStoreManager store;
    private TaskTemplate template;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        store = factory.getTaskStoreManager();
        template = TaskTemplate.of("web_connectivity", json("{\"urls\":[\"http://example.com\"]}"));
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    @Test
    public void addAndGetTask()
            throws Exception
    {
        StoredTask task = factory.autoCommit(() -> store.addTask("probe-1", template, T0));

        assertThat(task.getProbeId(), is("probe-1"));
        assertThat(task.getTestName(), is("web_connectivity"));
        assertThat(task.getArguments(), is(template.getArguments()));
        assertThat(task.getState(), is(TaskStateCode.READY));
        assertThat(task.getCreatedAt(), is(T0));
        assertThat(task.getNotifyTime(), is(Optional.absent()));
        assertThat(task.getAcceptTime(), is(Optional.absent()));
        assertThat(task.getDoneTime(), is(Optional.absent()));

        assertThat(factory.autoCommit(() -> store.getTaskById(task.getId())), is(task));
    }

    @Test
    public void argumentsOfAnyJsonTypeAreStoredVerbatim()
            throws Exception
    {
        for (String arguments : ImmutableList.of("[\"a\",1,{\"b\":null}]", "{}", "[]", "\"text\"", "42", "null")) {
            TaskTemplate t = TaskTemplate.of("ndt", json(arguments));
            StoredTask task = factory.autoCommit(() -> store.addTask("probe-1", t, T0));

            StoredTask stored = factory.autoCommit(() -> store.getTaskById(task.getId()));
            assertThat(stored.getArguments().toString(), is(arguments));
        }
    }

    @Test
    public void getMissingTask()
            throws Exception
    {
        assertNotFound(() -> factory.get().autoCommit(() -> store.getTaskById("missing"), TaskNotFoundException.class));
    }

    @Test
    public void conditionalUpdate()
            throws Exception
    {
        StoredTask task = factory.autoCommit(() -> store.addTask("probe-1", template, T0));
        Instant t1 = T0.plusSeconds(5);

        boolean updated = factory.autoCommit(() -> store.updateState(task.getId(),
                    ImmutableList.of(TaskStateCode.READY, TaskStateCode.NOTIFIED),
                    TaskStateCode.ACCEPTED, TaskTimestamp.ACCEPT_TIME, t1));
        assertThat(updated, is(true));

        StoredTask accepted = factory.autoCommit(() -> store.getTaskById(task.getId()));
        assertThat(accepted.getState(), is(TaskStateCode.ACCEPTED));
        assertThat(accepted.getAcceptTime(), is(Optional.of(t1)));
        assertThat(accepted.getUpdatedAt(), is(t1));
        assertThat(accepted.getDoneTime(), is(Optional.absent()));

        // state is no longer ready or notified
        boolean again = factory.autoCommit(() -> store.updateState(task.getId(),
                    ImmutableList.of(TaskStateCode.READY, TaskStateCode.NOTIFIED),
                    TaskStateCode.ACCEPTED, TaskTimestamp.ACCEPT_TIME, T0.plusSeconds(10)));
        assertThat(again, is(false));
        assertThat(factory.autoCommit(() -> store.getTaskById(task.getId())).getAcceptTime(), is(Optional.of(t1)));

        boolean missing = factory.autoCommit(() -> store.updateState("missing",
                    ImmutableList.of(TaskStateCode.READY),
                    TaskStateCode.NOTIFIED, TaskTimestamp.NOTIFY_TIME, t1));
        assertThat(missing, is(false));
    }

    @Test
    public void readyTasksOfProbe()
            throws Exception
    {
        StoredTask old = factory.autoCommit(() -> store.addTask("probe-1", template, T0));
        StoredTask t2 = factory.autoCommit(() -> store.addTask("probe-1", template, T0.plusSeconds(60)));
        StoredTask t3 = factory.autoCommit(() -> store.addTask("probe-1", template, T0.plusSeconds(120)));
        StoredTask accepted = factory.autoCommit(() -> store.addTask("probe-1", template, T0.plusSeconds(180)));
        factory.autoCommit(() -> store.addTask("probe-2", template, T0.plusSeconds(60)));

        factory.autoCommit(() -> store.updateState(accepted.getId(), ImmutableList.of(TaskStateCode.READY),
                    TaskStateCode.ACCEPTED, TaskTimestamp.ACCEPT_TIME, T0.plusSeconds(200)));

        List<StoredTask> all = factory.autoCommit(() -> store.getReadyTasksOfProbe("probe-1", T0));
        assertThat(all, contains(old, t2, t3));

        // since is inclusive
        List<StoredTask> recent = factory.autoCommit(() -> store.getReadyTasksOfProbe("probe-1", T0.plusSeconds(60)));
        assertThat(recent, contains(t2, t3));

        assertThat(factory.autoCommit(() -> store.getReadyTasksOfProbe("probe-3", T0)), is(empty()));
    }
}
