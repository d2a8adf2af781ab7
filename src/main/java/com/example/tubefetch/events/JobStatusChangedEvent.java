package com.example.tubefetch.events;

import com.example.tubefetch.domain.JobState;
import org.springframework.context.ApplicationEvent;

/**
 * Event published after a download job moved to a new state.
 */
public class JobStatusChangedEvent extends ApplicationEvent {

    private final String jobId;
    private final JobState previousStatus;
    private final JobState newStatus;
    private final String message;

    /**
     * @param source         The component that published the event (usually 'this').
     * @param jobId          The id of the job.
     * @param previousStatus The state the job left.
     * @param newStatus      The state the job entered.
     * @param message        An optional message, e.g. the failure summary.
     */
    public JobStatusChangedEvent(Object source, String jobId, JobState previousStatus, JobState newStatus, String message) {
        super(source);
        if (jobId == null || previousStatus == null || newStatus == null) {
            throw new IllegalArgumentException("Event details (jobId, previousStatus, newStatus) cannot be null");
        }
        this.jobId = jobId;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.message = message;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getPreviousStatus() {
        return previousStatus;
    }

    public JobState getNewStatus() {
        return newStatus;
    }

    public String getMessage() {
        return message;
    }
}
