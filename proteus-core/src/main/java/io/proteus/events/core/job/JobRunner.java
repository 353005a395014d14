package io.proteus.events.core.job;

import java.util.concurrent.CountDownLatch;

import io.proteus.events.core.database.TransactionManager;
import io.proteus.events.core.repository.ResourceNotFoundException;
import io.proteus.events.core.schedule.TimeSource;
import io.proteus.events.core.task.TaskMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timer loop of one job.
 *
 * Sleeps until the next fire time, materializes tasks, records the firing and
 * repeats until the schedule is exhausted or the scheduler shuts down.
 * A firing that fails is not counted and never finishes the job.
 * Fire times are computed from the previous scheduled time, not from the time
 * the runner woke up.
 */
public class JobRunner
        implements Runnable
{
    private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private final JobControl control;
    private final TaskMaterializer materializer;
    private final JobStore jobStore;
    private final TransactionManager tm;
    private final TimeSource clock;
    private final CountDownLatch cancel;

    public JobRunner(
            JobControl control,
            TaskMaterializer materializer,
            JobStore jobStore,
            TransactionManager tm,
            TimeSource clock,
            CountDownLatch cancel)
    {
        this.control = control;
        this.materializer = materializer;
        this.jobStore = jobStore;
        this.tm = tm;
        this.clock = clock;
        this.cancel = cancel;
    }

    @Override
    public void run()
    {
        String jobId = control.getJobId();
        if (control.getStatus().getDone()) {
            logger.info("Job {} is already done", jobId);
            return;
        }

        try {
            while (true) {
                JobStatus current = control.getStatus();
                logger.debug("Job {} sleeps until {}", jobId, current.getNextRunAt());
                if (!clock.sleepUntil(current.getNextRunAt(), cancel)) {
                    logger.debug("Job {} cancelled while waiting", jobId);
                    return;
                }

                JobStatus updated;
                if (fire(current)) {
                    updated = control.recordFiring(this::persist);
                }
                else {
                    updated = control.recordFailedFiring(this::persist);
                    logger.info("Job {} will attempt the failed firing again at {}", jobId, updated.getNextRunAt());
                }
                if (updated.getDone()) {
                    logger.info("Job {} is done after {} firings", jobId, updated.getTimesRun());
                    return;
                }
                if (cancel.getCount() == 0) {
                    logger.debug("Job {} cancelled after firing {}", jobId, updated.getTimesRun());
                    return;
                }
            }
        }
        catch (InterruptedException ex) {
            logger.debug("Job {} interrupted", jobId);
            Thread.currentThread().interrupt();
        }
    }

    // false if no task could be materialized
    private boolean fire(JobStatus current)
    {
        StoredJob job = control.getJob();
        logger.info("Firing job {} ({}) scheduled at {}, firing #{}",
                job.getId(), job.getComment(), current.getNextRunAt(), current.getTimesRun() + 1);
        try {
            materializer.materialize(job.getTarget(), job.getTask());
            return true;
        }
        catch (RuntimeException ex) {
            logger.error("Firing of job {} at {} failed", job.getId(), current.getNextRunAt(), ex);
            return false;
        }
    }

    private void persist(JobStatus status)
    {
        String jobId = control.getJobId();
        try {
            tm.begin(() -> {
                jobStore.updateJobStatus(jobId, status, clock.now());
                return null;
            }, ResourceNotFoundException.class);
        }
        catch (ResourceNotFoundException | RuntimeException ex) {
            logger.error("Failed to store status of job {}: times_run={} next_run_at={} done={}",
                    jobId, status.getTimesRun(), status.getNextRunAt(), status.getDone(), ex);
        }
    }
}
