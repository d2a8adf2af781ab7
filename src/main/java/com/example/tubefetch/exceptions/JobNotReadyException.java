package com.example.tubefetch.exceptions;

import com.example.tubefetch.domain.JobState;

/**
 * The job exists but has no artifact to hand out yet (or never will).
 */
public class JobNotReadyException extends RuntimeException {

    private final String jobId;
    private final JobState state;

    public JobNotReadyException(String jobId, JobState state) {
        super("Download is not ready (status: " + state.wireName() + ")");
        this.jobId = jobId;
        this.state = state;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getState() {
        return state;
    }
}
