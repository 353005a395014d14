package io.proteus.events.core.job;

import java.time.Instant;
import java.util.List;

import io.proteus.events.core.repository.ResourceNotFoundException;

public interface JobStore
{
    /**
     * Inserts a job that has not fired yet.
     */
    StoredJob addJob(JobRequest request, Instant nextRunAt, Instant now);

    List<StoredJob> getJobs();

    /**
     * Jobs that still have firings left.
     */
    List<StoredJob> getActiveJobs();

    StoredJob getJobById(String jobId)
        throws ResourceNotFoundException;

    void updateJobStatus(String jobId, JobStatus status, Instant now)
        throws ResourceNotFoundException;
}
