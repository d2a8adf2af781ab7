package com.example.tubefetch.service;

import com.example.tubefetch.domain.DownloadJob;

import java.nio.file.Path;

/**
 * Single place where download jobs change state. Every successful transition publishes a
 * {@link com.example.tubefetch.events.JobStatusChangedEvent}.
 * <p>
 * Methods return false instead of throwing when the transition is not allowed (for example a
 * job that was canceled while a worker was still finishing up).
 */
public interface JobStatusUpdater {

    boolean markDownloading(DownloadJob job);

    /**
     * Idempotent: a job already in PROCESSING only gets its stage label refreshed.
     */
    boolean markProcessing(DownloadJob job, String stage);

    boolean markCompleted(DownloadJob job, Path outputPath);

    /**
     * @param message user-facing summary, must not contain paths or tool output.
     */
    boolean markFailed(DownloadJob job, String message);

    boolean markCanceled(DownloadJob job);

    /**
     * Cancels the job only if no worker has started it yet.
     */
    boolean cancelIfQueued(DownloadJob job);
}
