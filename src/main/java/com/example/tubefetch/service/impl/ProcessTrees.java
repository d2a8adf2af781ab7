package com.example.tubefetch.service.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Stops an external tool together with everything it spawned.
 * <p>
 * yt-dlp hands merging and segmented downloads to ffmpeg child processes which inherit its stdout.
 * Killing only yt-dlp leaves those children running and holding the pipe open, so a reader waiting
 * for end of output never sees it.
 */
final class ProcessTrees {

    private static final Logger log = LoggerFactory.getLogger(ProcessTrees.class);

    private ProcessTrees() {
    }

    /**
     * Asks the process and all its descendants to stop, force-killing any that are still alive
     * after {@code grace}. Our end of the process output is closed as well.
     *
     * @return completes once every process in the tree has exited or been force-killed.
     */
    static CompletableFuture<Void> terminate(Process process, Duration grace) {
        // Children are collected first: once the parent dies they are re-parented and out of reach
        List<ProcessHandle> tree = new ArrayList<>(process.descendants().toList());
        if (process.isAlive()) {
            tree.add(process.toHandle());
        }
        closeOutput(process);
        if (tree.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        log.debug("Stopping process {} and {} descendant(s)", process.pid(), tree.size() - 1);
        tree.forEach(ProcessHandle::destroy);
        CompletableFuture<?>[] exits = tree.stream()
                .map(handle -> handle.onExit()
                        .orTimeout(grace.toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(timeout -> {
                            log.warn("Process {} ignored termination for {}s, killing it",
                                    handle.pid(), grace.toSeconds());
                            handle.destroyForcibly();
                            return handle;
                        }))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(exits);
    }

    /**
     * Blocking form of {@link #terminate(Process, Duration)}.
     */
    static void terminateAndWait(Process process, Duration grace) throws InterruptedException {
        try {
            terminate(process, grace).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected failure while stopping process " + process.pid(), e.getCause());
        }
    }

    private static void closeOutput(Process process) {
        try {
            process.getInputStream().close();
        } catch (IOException e) {
            log.debug("Could not close output of process {}: {}", process.pid(), e.getMessage());
        }
    }
}
