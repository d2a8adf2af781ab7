package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.DownloadJob;
import com.example.tubefetch.domain.JobOutput;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.JobSnapshot;
import com.example.tubefetch.domain.JobState;
import com.example.tubefetch.exceptions.JobNotFoundException;
import com.example.tubefetch.exceptions.JobNotReadyException;
import com.example.tubefetch.exceptions.WorkspaceStorageException;
import com.example.tubefetch.service.JobRegistry;
import com.example.tubefetch.service.JobRunner;
import com.example.tubefetch.service.JobStatusUpdater;
import com.example.tubefetch.service.JobWorkspaceStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local job store. Jobs live until they have been terminal for the retention period.
 */
@Service
public class InMemoryJobRegistry implements JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobRegistry.class);

    static final String BUSY_MESSAGE = "Server is busy, please retry shortly";

    private final Map<String, DownloadJob> jobs = new ConcurrentHashMap<>();

    private final JobRunner jobRunner;
    private final TaskExecutor jobTaskExecutor;
    private final JobStatusUpdater statusUpdater;
    private final JobWorkspaceStorage workspaceStorage;
    private final Clock clock;
    private final Duration retention;

    public InMemoryJobRegistry(
            JobRunner jobRunner,
            @Qualifier("jobTaskExecutor") TaskExecutor jobTaskExecutor,
            JobStatusUpdater statusUpdater,
            JobWorkspaceStorage workspaceStorage,
            Clock clock,
            @Value("${jobs.retention-minutes:60}") long retentionMinutes
    ) {
        this.jobRunner = jobRunner;
        this.jobTaskExecutor = jobTaskExecutor;
        this.statusUpdater = statusUpdater;
        this.workspaceStorage = workspaceStorage;
        this.clock = clock;
        this.retention = Duration.ofMinutes(retentionMinutes);
    }

    @Override
    public String create(JobRequest request) {
        DownloadJob job;
        String jobId;
        do {
            jobId = UUID.randomUUID().toString();
            job = new DownloadJob(jobId, request, clock);
        } while (jobs.putIfAbsent(jobId, job) != null);

        log.info("[Job:{}] Queued {} download of {}", jobId, request.kind().wireName(), request.videoId());
        DownloadJob queued = job;
        try {
            jobTaskExecutor.execute(() -> jobRunner.run(queued));
        } catch (TaskRejectedException e) {
            log.warn("[Job:{}] Rejected by the job executor: {}", jobId, e.getMessage());
            statusUpdater.markFailed(job, BUSY_MESSAGE);
        }
        return jobId;
    }

    @Override
    public Optional<JobSnapshot> getStatus(String jobId) {
        return Optional.ofNullable(jobId).map(jobs::get).map(DownloadJob::snapshot);
    }

    @Override
    public boolean cancel(String jobId) {
        DownloadJob job = jobId != null ? jobs.get(jobId) : null;
        if (job == null) {
            return false;
        }
        if (job.getState().isTerminal()) {
            log.debug("[Job:{}] Cancel ignored, job already {}", jobId, job.getState());
            return true;
        }
        log.info("[Job:{}] Cancellation requested", jobId);
        job.requestCancel();
        if (statusUpdater.cancelIfQueued(job)) {
            log.info("[Job:{}] Canceled while still queued", jobId);
        }
        return true;
    }

    @Override
    public JobOutput resolveOutput(String jobId) throws JobNotFoundException, JobNotReadyException {
        DownloadJob job = jobId != null ? jobs.get(jobId) : null;
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        JobSnapshot snapshot = job.snapshot();
        if (snapshot.state() != JobState.COMPLETED) {
            throw new JobNotReadyException(jobId, snapshot.state());
        }
        Path path = snapshot.outputPath();
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("[Job:{}] Completed but its file is gone: {}", jobId, path);
            throw new JobNotFoundException(jobId);
        }
        Long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            log.debug("[Job:{}] Could not read size of {}: {}", jobId, path, e.getMessage());
            size = null;
        }
        return new JobOutput(path, path.getFileName().toString(), snapshot.request().kind().mimeType(), size);
    }

    /**
     * Drops jobs that have been terminal for longer than the retention period, together with their files.
     *
     * @return number of jobs evicted.
     */
    @Scheduled(fixedDelayString = "${jobs.eviction-interval-ms:60000}",
            initialDelayString = "${jobs.eviction-interval-ms:60000}")
    public int evictExpired() {
        Instant threshold = clock.instant().minus(retention);
        int evicted = 0;
        for (Map.Entry<String, DownloadJob> entry : jobs.entrySet()) {
            JobSnapshot snapshot = entry.getValue().snapshot();
            if (!snapshot.state().isTerminal() || !snapshot.updatedAt().isBefore(threshold)) {
                continue;
            }
            if (jobs.remove(entry.getKey(), entry.getValue())) {
                evicted++;
                try {
                    workspaceStorage.deleteWorkspace(entry.getKey());
                } catch (WorkspaceStorageException e) {
                    log.warn("[Job:{}] Evicted, but its workspace could not be deleted: {}",
                            entry.getKey(), e.getMessage());
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} finished jobs older than {} minutes", evicted, retention.toMinutes());
        }
        return evicted;
    }

    int size() {
        return jobs.size();
    }
}
