package io.proteus.events.core.job;

import java.time.Duration;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import io.proteus.events.core.schedule.FireTime;
import io.proteus.events.core.schedule.ScheduleSpec;

/**
 * Holds the live bookkeeping of one job.
 *
 * The runner of the job is the only writer. Readers such as job listings take the
 * shared lock and never observe a half-applied firing.
 */
public class JobControl
{
    static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofMinutes(1);

    private final StoredJob job;
    private final ScheduleSpec schedule;
    private final Duration retryInterval;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private JobStatus status;

    public JobControl(StoredJob job, ScheduleSpec schedule)
    {
        this(job, schedule, DEFAULT_RETRY_INTERVAL);
    }

    public JobControl(StoredJob job, ScheduleSpec schedule, Duration retryInterval)
    {
        this.job = job;
        this.schedule = schedule;
        this.retryInterval = retryInterval;
        this.status = job.getStatus();
    }

    public String getJobId()
    {
        return job.getId();
    }

    public StoredJob getJob()
    {
        return job;
    }

    public ScheduleSpec getSchedule()
    {
        return schedule;
    }

    public JobStatus getStatus()
    {
        lock.readLock().lock();
        try {
            return status;
        }
        finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Counts one completed firing and moves to the next fire time.
     *
     * {@code persist} is called with the new status while the exclusive lock is held.
     * The in-memory status is updated before persist runs, so the slot is never
     * fired again in this process even if persist fails.
     */
    public JobStatus recordFiring(Consumer<JobStatus> persist)
    {
        lock.writeLock().lock();
        try {
            int timesRun = status.getTimesRun() + 1;
            FireTime next = schedule.nextFireTime(status.getNextRunAt(), timesRun);
            if (next.hasMore()) {
                status = JobStatus.of(timesRun, next.getTime(), false);
            }
            else {
                // a finished job keeps its last fire time
                status = JobStatus.of(timesRun, status.getNextRunAt(), true);
            }
            persist.accept(status);
            return status;
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves past a slot whose tasks could not be materialized.
     *
     * The firing is not counted and the job never becomes done here, so a bounded
     * job still gets its full number of completed firings. The next attempt is the
     * next regular slot, or {@code retryInterval} later for a job without interval.
     */
    public JobStatus recordFailedFiring(Consumer<JobStatus> persist)
    {
        lock.writeLock().lock();
        try {
            Duration step = schedule.getInterval().isZero() ? retryInterval : schedule.getInterval();
            status = JobStatus.of(status.getTimesRun(), status.getNextRunAt().plus(step), false);
            persist.accept(status);
            return status;
        }
        finally {
            lock.writeLock().unlock();
        }
    }
}
