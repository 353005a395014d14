package io.proteus.events.core.job;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.proteus.events.core.database.TransactionManager;
import io.proteus.events.core.repository.StorageException;
import io.proteus.events.core.schedule.MalformedScheduleException;
import io.proteus.events.core.schedule.ScheduleSpec;
import io.proteus.events.core.schedule.TimeSource;
import io.proteus.events.core.task.TaskMaterializer;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of job runners. Each active job gets its own runner thread.
 */
public class JobScheduler
{
    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final TransactionManager tm;
    private final JobStore jobStore;
    private final TaskMaterializer materializer;
    private final TimeSource clock;
    private final SchedulerConfig config;

    private final ConcurrentMap<String, JobControl> controls = new ConcurrentHashMap<>();
    // jobs that got a runner since start(), including runners that already finished
    private final Set<String> launched = ConcurrentHashMap.newKeySet();
    private ExecutorService executor;
    private CountDownLatch cancel;

    @Inject
    public JobScheduler(
            TransactionManager tm,
            JobStore jobStore,
            TaskMaterializer materializer,
            TimeSource clock,
            SchedulerConfig config)
    {
        this.tm = tm;
        this.jobStore = jobStore;
        this.materializer = materializer;
        this.clock = clock;
        this.config = config;
    }

    @VisibleForTesting
    synchronized boolean isStarted()
    {
        return executor != null;
    }

    /**
     * Starts runners of every job that is not done yet.
     */
    public synchronized void start()
    {
        if (!config.getEnabled()) {
            logger.debug("Scheduler is disabled.");
            return;
        }
        if (executor != null) {
            return;
        }
        cancel = new CountDownLatch(1);
        launched.clear();
        executor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("job-runner-%d")
                .build()
                );

        List<StoredJob> active = tm.begin(() -> jobStore.getActiveJobs());
        int started = 0;
        for (StoredJob job : active) {
            ScheduleSpec schedule;
            try {
                // only interval and count matter here; the next fire time is persisted
                schedule = ScheduleSpec.parse(job.getSchedule(), job.getCreatedAt());
            }
            catch (MalformedScheduleException ex) {
                logger.error("Skipping job {} with invalid schedule '{}'", job.getId(), job.getSchedule(), ex);
                continue;
            }
            startRunner(job, schedule);
            started++;
        }
        logger.info("Scheduler started with {} active jobs", started);
    }

    /**
     * Validates and stores a job, then starts its runner.
     *
     * @return id of the new job
     * @throws MalformedScheduleException if the schedule can't be parsed; nothing is stored
     * @throws StorageException if the job could not be stored
     */
    public String addJob(JobRequest request)
        throws MalformedScheduleException
    {
        Instant now = clock.now();
        ScheduleSpec schedule = ScheduleSpec.parse(request.getSchedule(), now);
        Instant nextRunAt = schedule.getStartTime().plusSeconds(request.getDelay());

        StoredJob job;
        try {
            job = tm.begin(() -> jobStore.addJob(request, nextRunAt, now));
        }
        catch (JdbiException ex) {
            // commit failure; statement failures are already StorageException
            logger.error("Failed to commit job", ex);
            throw new StorageException("Failed to commit job: " + ex.getMessage(), ex);
        }
        logger.info("Added job {} ({}) with schedule '{}', first firing at {}",
                job.getId(), job.getComment(), job.getSchedule(), job.getNextRunAt());

        synchronized (this) {
            if (executor != null) {
                startRunner(job, schedule);
            }
        }
        return job.getId();
    }

    /**
     * Stored jobs with the live bookkeeping of running jobs applied.
     */
    public List<StoredJob> listJobs()
    {
        List<StoredJob> stored = tm.autoCommit(() -> jobStore.getJobs());
        return stored.stream()
            .map(job -> {
                JobControl control = controls.get(job.getId());
                if (control == null) {
                    return job;
                }
                return job.withStatus(control.getStatus());
            })
            .collect(Collectors.toList());
    }

    @VisibleForTesting
    ImmutableSet<String> getRunningJobIds()
    {
        return ImmutableSet.copyOf(controls.keySet());
    }

    /**
     * Stops waiting runners and waits for in-flight firings to finish.
     */
    public synchronized void shutdown()
    {
        if (executor == null) {
            return;
        }
        cancel.countDown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getShutdownWait(), TimeUnit.SECONDS)) {
                logger.warn("Job runners didn't finish within {} seconds", config.getShutdownWait());
            }
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        logger.info("Scheduler stopped");
    }

    // caller holds the monitor
    private void startRunner(StoredJob job, ScheduleSpec schedule)
    {
        if (!launched.add(job.getId())) {
            logger.debug("Job {} already has a runner", job.getId());
            return;
        }
        JobControl control = new JobControl(job, schedule, Duration.ofSeconds(config.getRetryInterval()));
        JobRunner runner = new JobRunner(control, materializer, jobStore, tm, clock, cancel);
        controls.put(job.getId(), control);
        executor.submit(() -> {
            try {
                runner.run();
            }
            catch (RuntimeException ex) {
                logger.error("Runner of job {} crashed", job.getId(), ex);
            }
            finally {
                controls.remove(job.getId(), control);
            }
        });
    }
}
