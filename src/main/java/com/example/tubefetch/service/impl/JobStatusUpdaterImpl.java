package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.DownloadJob;
import com.example.tubefetch.domain.JobState;
import com.example.tubefetch.events.JobStatusChangedEvent;
import com.example.tubefetch.service.JobStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.function.Predicate;

@Service
public class JobStatusUpdaterImpl implements JobStatusUpdater {

    private static final Logger log = LoggerFactory.getLogger(JobStatusUpdaterImpl.class);

    private final ApplicationEventPublisher eventPublisher;

    public JobStatusUpdaterImpl(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public boolean markDownloading(DownloadJob job) {
        return apply(job, JobState.DOWNLOADING, null,
                j -> j.transitionTo(JobState.DOWNLOADING, "Starting download"));
    }

    @Override
    public boolean markProcessing(DownloadJob job, String stage) {
        if (job.getState() == JobState.PROCESSING) {
            log.debug("[Job:{}] Already PROCESSING, refreshing stage to '{}'", job.getId(), stage);
            return job.updateProgress(job.snapshot().progressPercent(), null, null, stage);
        }
        return apply(job, JobState.PROCESSING, null, j -> j.transitionTo(JobState.PROCESSING, stage));
    }

    @Override
    public boolean markCompleted(DownloadJob job, Path outputPath) {
        if (outputPath == null) {
            log.error("[Job:{}] Output path cannot be null when completing a job", job.getId());
            throw new IllegalArgumentException("Output path is required to complete a job.");
        }
        return apply(job, JobState.COMPLETED, null, j -> j.complete(outputPath));
    }

    @Override
    public boolean markFailed(DownloadJob job, String message) {
        return apply(job, JobState.FAILED, message, j -> j.fail(message));
    }

    @Override
    public boolean markCanceled(DownloadJob job) {
        return apply(job, JobState.CANCELED, null, DownloadJob::markCanceled);
    }

    @Override
    public boolean cancelIfQueued(DownloadJob job) {
        return apply(job, JobState.CANCELED, null, DownloadJob::cancelIfQueued);
    }

    // Helper methods

    private boolean apply(DownloadJob job, JobState target, String message, Predicate<DownloadJob> transition) {
        JobState previous = job.getState();
        log.debug("[Job:{}] Attempting transition {} -> {}", job.getId(), previous, target);
        if (!transition.test(job)) {
            log.debug("[Job:{}] Transition to {} rejected (current state: {})", job.getId(), target, job.getState());
            return false;
        }
        publishEvent(job.getId(), previous, target, message);
        return true;
    }

    /**
     * Publishes a JobStatusChangedEvent. A failing listener must not break the job itself.
     */
    private void publishEvent(String jobId, JobState previous, JobState status, String message) {
        JobStatusChangedEvent event = new JobStatusChangedEvent(this, jobId, previous, status, message);
        try {
            eventPublisher.publishEvent(event);
        } catch (Exception e) {
            log.error("Failed to publish JobStatusChangedEvent [Job: {}, Status: {}]: {}",
                    jobId, status, e.getMessage(), e);
        }
    }
}
