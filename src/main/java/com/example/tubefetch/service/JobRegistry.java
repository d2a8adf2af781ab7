package com.example.tubefetch.service;

import com.example.tubefetch.domain.JobOutput;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.JobSnapshot;
import com.example.tubefetch.exceptions.JobNotFoundException;
import com.example.tubefetch.exceptions.JobNotReadyException;

import java.util.Optional;

/**
 * Owns every download job of this process: creation, status reads, cancellation and artifact lookup.
 */
public interface JobRegistry {

    /**
     * Stores a new job in the queued state, dispatches it and returns its id. The job is visible to
     * {@link #getStatus(String)} before this method returns.
     */
    String create(JobRequest request);

    /**
     * @return a consistent snapshot, or empty for unknown or evicted ids.
     */
    Optional<JobSnapshot> getStatus(String jobId);

    /**
     * Requests cooperative cancellation. Canceling a finished job is a no-op that still succeeds.
     *
     * @return false only when the id is unknown.
     */
    boolean cancel(String jobId);

    /**
     * @throws JobNotFoundException for unknown or evicted ids.
     * @throws JobNotReadyException when the job has not completed.
     */
    JobOutput resolveOutput(String jobId) throws JobNotFoundException, JobNotReadyException;
}
