package com.example.tubefetch.service;

import com.example.tubefetch.domain.DownloadKind;
import com.example.tubefetch.exceptions.PipelineException;

import java.nio.file.Path;

/**
 * Converts a downloaded file into the artifact handed to the user.
 */
public interface MediaProcessor {

    @FunctionalInterface
    interface ProcessingListener {
        /**
         * @param fraction conversion progress between 0 and 1.
         */
        void onProgress(double fraction);
    }

    /**
     * Converts {@code source} into {@code output} according to {@code kind}. Blocks until done.
     *
     * @throws PipelineException    if the tool fails or times out.
     * @throws InterruptedException if interrupted while waiting.
     */
    void process(Path source, Path output, DownloadKind kind, ProcessingListener listener)
            throws PipelineException, InterruptedException;

    /**
     * Kills the conversion writing {@code output}, if one is running.
     *
     * @return true if a live process was terminated.
     */
    boolean abort(Path output);
}
