package com.example.tubefetch.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server-side record of one download job.
 * <p>
 * Every mutable field is guarded by this object's monitor, so a {@link #snapshot()} never observes a
 * half-written progress update. Progress only moves up, and nothing changes once the job is terminal.
 * Cancellation is a separate volatile flag so workers can poll it without taking the lock.
 */
public class DownloadJob {

    private static final Logger log = LoggerFactory.getLogger(DownloadJob.class);

    private final String id;
    private final JobRequest request;
    private final Clock clock;
    private final Instant createdAt;
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    private volatile boolean cancelRequested;

    private JobState state = JobState.QUEUED;
    private double progressPercent;
    private String transferRate;
    private Duration eta;
    private String stage;
    private String error;
    private Path outputPath;
    private Instant updatedAt;
    private Instant startedAt;

    public DownloadJob(String id, JobRequest request, Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.request = Objects.requireNonNull(request, "request");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.stage = "Queued";
    }

    public String getId() {
        return id;
    }

    public JobRequest getRequest() {
        return request;
    }

    public synchronized JobState getState() {
        return state;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * Moves the job forward. Returns false, leaving the job untouched, when the transition is not allowed.
     */
    public synchronized boolean transitionTo(JobState next, String newStage) {
        if (!state.canTransitionTo(next)) {
            return false;
        }
        if (next == JobState.DOWNLOADING) {
            startedAt = clock.instant();
        }
        if (next == JobState.PROCESSING) {
            transferRate = null;
            eta = null;
        }
        state = next;
        if (newStage != null) {
            stage = newStage;
        }
        touch();
        return true;
    }

    /**
     * Records new telemetry. A lower percentage than the current one is ignored; rate, ETA and stage
     * are still refreshed. Ignored entirely once the job is terminal.
     */
    public synchronized boolean updateProgress(double percent, String rate, Duration remaining, String newStage) {
        if (state.isTerminal()) {
            return false;
        }
        double bounded = Math.max(0.0, Math.min(100.0, percent));
        progressPercent = Math.max(progressPercent, bounded);
        transferRate = rate;
        eta = remaining;
        if (newStage != null) {
            stage = newStage;
        }
        touch();
        return true;
    }

    public synchronized boolean complete(Path output) {
        if (!transitionTo(JobState.COMPLETED, "Done")) {
            return false;
        }
        progressPercent = 100.0;
        outputPath = output;
        transferRate = null;
        eta = Duration.ZERO;
        return true;
    }

    public synchronized boolean fail(String message) {
        if (!transitionTo(JobState.FAILED, "Failed")) {
            return false;
        }
        error = message;
        transferRate = null;
        eta = null;
        return true;
    }

    public synchronized boolean markCanceled() {
        if (!transitionTo(JobState.CANCELED, "Canceled")) {
            return false;
        }
        transferRate = null;
        eta = null;
        return true;
    }

    /**
     * Cancels a job that no worker has picked up yet.
     */
    public synchronized boolean cancelIfQueued() {
        return state == JobState.QUEUED && markCanceled();
    }

    /**
     * Raises the cancellation flag and fires the registered hooks (process termination and the like).
     */
    public void requestCancel() {
        cancelRequested = true;
        for (Runnable hook : cancelHooks) {
            runHook(hook);
        }
    }

    /**
     * Registers an action to run when cancellation is requested. If cancellation was already requested
     * the hook runs immediately. Closing the returned registration removes the hook.
     */
    public CancelRegistration onCancel(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        cancelHooks.add(hook);
        if (cancelRequested) {
            runHook(hook);
        }
        return () -> cancelHooks.remove(hook);
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, request, state, progressPercent, transferRate, eta, stage, error,
                outputPath, createdAt, updatedAt, startedAt);
    }

    private void touch() {
        updatedAt = clock.instant();
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("[Job:{}] Cancel hook failed: {}", id, e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface CancelRegistration extends AutoCloseable {
        @Override
        void close();
    }
}
