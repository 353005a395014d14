package io.proteus.events.core.task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.proteus.events.core.database.DatabaseFactory;
import io.proteus.events.core.database.DatabaseTaskStoreManager;
import io.proteus.events.core.schedule.ManualTimeSource;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.proteus.events.core.database.DatabaseTestingUtils.json;
import static io.proteus.events.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class TaskLifecycleTest
{
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private DatabaseFactory factory;
    private DatabaseTaskStoreManager store;
    private ManualTimeSource clock;
    private TaskLifecycle lifecycle;
    private TaskTemplate template;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        store = factory.getTaskStoreManager();
        clock = new ManualTimeSource(T0);
        lifecycle = new TaskLifecycle(factory.get(), store, clock);
        template = TaskTemplate.of("web_connectivity", json("{\"urls\":[\"http://example.org\"]}"));
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    private StoredTask createTask(String probeId, Instant createdAt)
            throws Exception
    {
        return factory.autoCommit(() -> store.addTask(probeId, template, createdAt));
    }

    private interface Transition
    {
        StoredTask run() throws Exception;
    }

    private static void assertInconsistent(Transition transition)
            throws Exception
    {
        try {
            transition.run();
            fail("expected InconsistentTaskStateException");
        }
        catch (InconsistentTaskStateException ex) {
        }
    }

    private static void assertAccessDenied(Transition transition)
            throws Exception
    {
        try {
            transition.run();
            fail("expected TaskAccessDeniedException");
        }
        catch (TaskAccessDeniedException ex) {
        }
    }

    @Test
    public void acceptThenDoneThenReject()
            throws Exception
    {
        StoredTask task = createTask("probe-a", T0);

        clock.set(T0.plusSeconds(10));
        StoredTask accepted = lifecycle.accept(task.getId(), "probe-a");
        assertThat(accepted.getState(), is(TaskStateCode.ACCEPTED));
        assertThat(accepted.getAcceptTime(), is(Optional.of(T0.plusSeconds(10))));

        assertInconsistent(() -> lifecycle.accept(task.getId(), "probe-a"));

        clock.set(T0.plusSeconds(20));
        StoredTask done = lifecycle.done(task.getId(), "probe-a");
        assertThat(done.getState(), is(TaskStateCode.DONE));
        assertThat(done.getDoneTime(), is(Optional.of(T0.plusSeconds(20))));
        assertThat(done.getAcceptTime(), is(Optional.of(T0.plusSeconds(10))));

        assertInconsistent(() -> lifecycle.reject(task.getId(), "probe-a"));
        assertThat(lifecycle.getTask(task.getId(), "probe-a").getState(), is(TaskStateCode.DONE));
    }

    @Test
    public void notifyThenReject()
            throws Exception
    {
        StoredTask task = createTask("probe-a", T0);

        StoredTask notified = lifecycle.notify(task.getId(), "probe-a");
        assertThat(notified.getState(), is(TaskStateCode.NOTIFIED));
        assertThat(notified.getNotifyTime(), is(Optional.of(T0)));

        assertInconsistent(() -> lifecycle.notify(task.getId(), "probe-a"));
        assertInconsistent(() -> lifecycle.done(task.getId(), "probe-a"));

        StoredTask rejected = lifecycle.reject(task.getId(), "probe-a");
        assertThat(rejected.getState(), is(TaskStateCode.REJECTED));
        assertInconsistent(() -> lifecycle.accept(task.getId(), "probe-a"));
    }

    @Test
    public void otherProbeIsDeniedInEveryState()
            throws Exception
    {
        StoredTask task = createTask("probe-a", T0);

        for (TaskTransition step : ImmutableList.of(TaskTransition.NOTIFY, TaskTransition.ACCEPT, TaskTransition.DONE)) {
            assertAccessDenied(() -> lifecycle.getTask(task.getId(), "probe-b"));
            for (TaskTransition transition : TaskTransition.values()) {
                assertAccessDenied(() -> lifecycle.apply(transition, task.getId(), "probe-b"));
            }
            lifecycle.apply(step, task.getId(), "probe-a");
        }
        assertAccessDenied(() -> lifecycle.getTask(task.getId(), "probe-b"));
        assertThat(lifecycle.getTask(task.getId(), "probe-a").getState(), is(TaskStateCode.DONE));
    }

    @Test
    public void missingTaskIsNotFound()
            throws Exception
    {
        try {
            lifecycle.accept("no-such-task", "probe-a");
            fail();
        }
        catch (TaskNotFoundException ex) {
            assertThat(ex.getTaskId(), is("no-such-task"));
        }
        try {
            lifecycle.getTask("no-such-task", "probe-a");
            fail();
        }
        catch (TaskNotFoundException ex) {
        }
    }

    @Test
    public void illegalTransitionIsRejectedBeforeLookup()
            throws Exception
    {
        StoredTask task = createTask("probe-a", T0);
        List<Runnable> illegal = ImmutableList.of(
                () -> advanceUnchecked(task.getId(), TaskStateCode.DONE, ImmutableList.of(TaskStateCode.READY), TaskTimestamp.DONE_TIME),
                () -> advanceUnchecked(task.getId(), TaskStateCode.ACCEPTED, ImmutableList.of(TaskStateCode.READY), TaskTimestamp.DONE_TIME),
                () -> advanceUnchecked(task.getId(), TaskStateCode.READY, ImmutableList.of(TaskStateCode.NOTIFIED), TaskTimestamp.NOTIFY_TIME),
                () -> advanceUnchecked(task.getId(), TaskStateCode.ACCEPTED, ImmutableList.of(), TaskTimestamp.ACCEPT_TIME),
                () -> advanceUnchecked("no-such-task", TaskStateCode.REJECTED, ImmutableList.of(TaskStateCode.DONE), TaskTimestamp.DONE_TIME));
        for (Runnable r : illegal) {
            try {
                r.run();
                fail();
            }
            catch (IllegalArgumentException ex) {
            }
        }
        assertThat(lifecycle.getTask(task.getId(), "probe-a").getState(), is(TaskStateCode.READY));
    }

    private void advanceUnchecked(String taskId, TaskStateCode target, List<TaskStateCode> from, TaskTimestamp timestamp)
    {
        try {
            lifecycle.advance(taskId, "probe-a", target, from, timestamp);
        }
        catch (TaskNotFoundException | TaskAccessDeniedException | InconsistentTaskStateException ex) {
            throw new AssertionError(ex);
        }
    }

    @Test
    public void subsetOfAllowedStatesIsLegal()
            throws Exception
    {
        StoredTask task = createTask("probe-a", T0);
        lifecycle.notify(task.getId(), "probe-a");

        // reject only from ready: the task is notified
        try {
            lifecycle.advance(task.getId(), "probe-a", TaskStateCode.REJECTED,
                    ImmutableList.of(TaskStateCode.READY), TaskTimestamp.DONE_TIME);
            fail();
        }
        catch (InconsistentTaskStateException ex) {
        }

        StoredTask rejected = lifecycle.advance(task.getId(), "probe-a", TaskStateCode.REJECTED,
                ImmutableList.of(TaskStateCode.NOTIFIED), TaskTimestamp.DONE_TIME);
        assertThat(rejected.getState(), is(TaskStateCode.REJECTED));
    }

    @Test
    public void concurrentTransitionsHaveOneWinner()
            throws Exception
    {
        int n = 8;
        for (TaskTransition transition : ImmutableList.of(TaskTransition.ACCEPT, TaskTransition.REJECT)) {
            StoredTask task = createTask("probe-a", T0);
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(n);
            try {
                List<Future<StoredTask>> futures = new ArrayList<>();
                for (int i = 0; i < n; i++) {
                    Callable<StoredTask> call = () -> {
                        start.await();
                        return lifecycle.apply(transition, task.getId(), "probe-a");
                    };
                    futures.add(executor.submit(call));
                }
                start.countDown();

                int succeeded = 0;
                int conflicted = 0;
                for (Future<StoredTask> future : futures) {
                    try {
                        future.get(30, TimeUnit.SECONDS);
                        succeeded++;
                    }
                    catch (ExecutionException ex) {
                        assertThat(ex.getCause(), instanceOf(InconsistentTaskStateException.class));
                        conflicted++;
                    }
                }
                assertThat(succeeded, is(1));
                assertThat(conflicted, is(n - 1));
                assertThat(lifecycle.getTask(task.getId(), "probe-a").getState(), is(transition.getTargetState()));
            }
            finally {
                executor.shutdownNow();
            }
        }
    }

    @Test
    public void tasksForProbe()
            throws Exception
    {
        StoredTask t1 = createTask("probe-a", T0);
        StoredTask t2 = createTask("probe-a", T0.plusSeconds(3600));
        StoredTask t3 = createTask("probe-a", T0.plusSeconds(7200));
        createTask("probe-b", T0.plusSeconds(3600));
        StoredTask old = createTask("probe-a", Instant.parse("2015-01-01T00:00:00Z"));

        lifecycle.accept(t2.getId(), "probe-a");

        assertThat(lifecycle.getTasksForProbe("probe-a", Optional.absent()), contains(t1, t3));
        assertThat(lifecycle.getTasksForProbe("probe-a", Optional.of(T0.plusSeconds(1))), contains(t3));
        assertThat(lifecycle.getTasksForProbe("probe-a", Optional.of(Instant.EPOCH)), contains(old, t1, t3));
        assertThat(lifecycle.getTasksForProbe("probe-c", Optional.absent()), is(empty()));
    }
}
