package com.example.tubefetch.service;

import com.example.tubefetch.progress.TransferProgress;

/**
 * Callbacks from a running engine download. Implementations may throw to abort the download.
 */
public interface DownloadObserver {

    /**
     * Called once with the live engine process, so it can be terminated on cancellation.
     */
    void onProcessStarted(Process process);

    void onStreamStarted(String destination);

    void onTransfer(TransferProgress progress);

    /**
     * The engine moved from transferring to post-processing (merging, audio extraction, ...).
     */
    void onPostProcessing(String stage);

    /**
     * Every raw output line, before any interpretation.
     */
    default void onOutputLine(String line) {
    }
}
