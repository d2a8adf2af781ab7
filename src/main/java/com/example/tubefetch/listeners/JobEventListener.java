package com.example.tubefetch.listeners;

import com.example.tubefetch.domain.JobState;
import com.example.tubefetch.events.JobStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Writes the audit trail of job state changes. Failures are warnings; cancellation is a normal ending.
 */
@Component
public class JobEventListener {

    private static final Logger log = LoggerFactory.getLogger(JobEventListener.class);

    @Async
    @EventListener
    public void handleJobStatusChange(JobStatusChangedEvent event) {
        if (event.getNewStatus() == JobState.FAILED) {
            log.warn("[Job:{}] {} -> {}: {}", event.getJobId(), event.getPreviousStatus(),
                    event.getNewStatus(), event.getMessage());
        } else {
            log.info("[Job:{}] {} -> {}", event.getJobId(), event.getPreviousStatus(), event.getNewStatus());
        }
    }
}
