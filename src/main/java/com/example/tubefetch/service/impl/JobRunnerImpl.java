package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.DownloadJob;
import com.example.tubefetch.domain.DownloadKind;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.exceptions.JobCanceledException;
import com.example.tubefetch.exceptions.WorkspaceStorageException;
import com.example.tubefetch.progress.ProgressTracker;
import com.example.tubefetch.progress.TransferProgress;
import com.example.tubefetch.service.DownloadObserver;
import com.example.tubefetch.service.ExtractionEngine;
import com.example.tubefetch.service.JobRunner;
import com.example.tubefetch.service.JobStatusUpdater;
import com.example.tubefetch.service.JobWorkspaceStorage;
import com.example.tubefetch.service.MediaProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Drives one job through download, conversion and completion.
 * <p>
 * Cancellation is cooperative: the job's flag is checked on every engine output line and conversion
 * callback and at each stage boundary, and cancel hooks kill whichever process is live. A canceled or
 * failed job has its workspace removed before the terminal state is recorded.
 */
@Service
public class JobRunnerImpl implements JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunnerImpl.class);

    static final String SOURCE_DIR = "source";
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final ExtractionEngine extractionEngine;
    private final MediaProcessor mediaProcessor;
    private final JobWorkspaceStorage workspaceStorage;
    private final JobStatusUpdater statusUpdater;
    private final Clock clock;
    private final Duration publishInterval;

    public JobRunnerImpl(
            ExtractionEngine extractionEngine,
            MediaProcessor mediaProcessor,
            JobWorkspaceStorage workspaceStorage,
            JobStatusUpdater statusUpdater,
            Clock clock,
            @Value("${jobs.progress-publish-interval-ms:250}") long publishIntervalMs
    ) {
        this.extractionEngine = extractionEngine;
        this.mediaProcessor = mediaProcessor;
        this.workspaceStorage = workspaceStorage;
        this.statusUpdater = statusUpdater;
        this.clock = clock;
        this.publishInterval = Duration.ofMillis(publishIntervalMs);
    }

    @Override
    public void run(DownloadJob job) {
        String jobId = job.getId();
        if (job.isCancelRequested() || !statusUpdater.markDownloading(job)) {
            log.info("[Job:{}] Canceled before a worker picked it up", jobId);
            handleCancellation(job);
            return;
        }

        JobRequest request = job.getRequest();
        log.info("[Job:{}] Starting {} download of {} (format: {})",
                jobId, request.kind().wireName(), request.videoId(), request.selectedFormatId());
        ProgressTracker tracker = new ProgressTracker(job, clock, publishInterval, request.kind().expectedStreams());
        AtomicReference<Process> engineProcess = new AtomicReference<>();

        try (DownloadJob.CancelRegistration ignored = job.onCancel(() -> terminate(engineProcess.get(), jobId))) {
            Path workspace = workspaceStorage.createWorkspace(jobId);
            checkCanceled(job);

            Path downloaded = extractionEngine.download(request, workspace.resolve(SOURCE_DIR),
                    new JobDownloadObserver(job, tracker, engineProcess));
            checkCanceled(job);
            log.debug("[Job:{}] Engine produced {}", jobId, downloaded.getFileName());

            Path output = convert(job, tracker, downloaded, workspace);
            checkCanceled(job);

            deleteSourceFiles(workspace.resolve(SOURCE_DIR), jobId);
            if (statusUpdater.markCompleted(job, output)) {
                log.info("[Job:{}] Completed: {}", jobId, output.getFileName());
            } else {
                handleCancellation(job);
            }

        } catch (JobCanceledException e) {
            log.info("[Job:{}] {}", jobId, e.getMessage());
            handleCancellation(job);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (job.isCancelRequested()) {
                handleCancellation(job);
            } else {
                handleFailure(job, e);
            }

        } catch (Exception e) {
            if (job.isCancelRequested()) {
                // Killing the live process makes the tools fail; that is the cancellation itself
                log.debug("[Job:{}] Failure after cancel request: {}", jobId, e.getMessage());
                handleCancellation(job);
            } else {
                handleFailure(job, e);
            }
        }
    }

    private Path convert(DownloadJob job, ProgressTracker tracker, Path downloaded, Path workspace)
            throws InterruptedException {
        DownloadKind kind = job.getRequest().kind();
        String stage = conversionStage(kind);
        statusUpdater.markProcessing(job, stage);

        Path output = workspace.resolve(outputFilename(downloaded, kind));
        try (DownloadJob.CancelRegistration ignored = job.onCancel(() -> mediaProcessor.abort(output))) {
            mediaProcessor.process(downloaded, output, kind, fraction -> {
                checkCanceled(job);
                tracker.onProcessing(stage, fraction);
            });
        }
        return output;
    }

    static String outputFilename(Path downloaded, DownloadKind kind) {
        String name = downloaded.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        if (stem.isBlank()) {
            stem = "download";
        }
        return stem + "." + kind.extension();
    }

    static String conversionStage(DownloadKind kind) {
        return switch (kind) {
            case VIDEO -> "Converting to MP4";
            case AUDIO -> "Converting to MP3";
            case THUMBNAIL -> "Converting thumbnail to PNG";
        };
    }

    private void handleCancellation(DownloadJob job) {
        deleteWorkspaceQuietly(job);
        if (statusUpdater.markCanceled(job)) {
            log.info("[Job:{}] Canceled, workspace removed", job.getId());
        }
    }

    private void handleFailure(DownloadJob job, Throwable failure) {
        log.error("[Job:{}] Download failed: {}", job.getId(), failure.getMessage(), failure);
        deleteWorkspaceQuietly(job);
        statusUpdater.markFailed(job, ErrorSummaries.summarize(failure));
    }

    private void deleteWorkspaceQuietly(DownloadJob job) {
        try {
            workspaceStorage.deleteWorkspace(job.getId());
        } catch (WorkspaceStorageException e) {
            log.error("[Job:{}] Could not delete workspace: {}", job.getId(), e.getMessage(), e);
        }
    }

    private void deleteSourceFiles(Path sourceDir, String jobId) {
        if (!Files.exists(sourceDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            // The whole workspace goes at eviction anyway
            log.warn("[Job:{}] Could not remove intermediate files: {}", jobId, e.getMessage());
        }
    }

    private static void checkCanceled(DownloadJob job) {
        if (job.isCancelRequested()) {
            throw new JobCanceledException(job.getId());
        }
    }

    private static void terminate(Process process, String jobId) {
        if (process == null || !process.isAlive()) {
            return;
        }
        log.info("[Job:{}] Stopping engine process {} and its children", jobId, process.pid());
        ProcessTrees.terminate(process, KILL_GRACE);
    }

    /**
     * Feeds engine callbacks into the job's progress and state, aborting the transfer once
     * cancellation is requested.
     */
    private final class JobDownloadObserver implements DownloadObserver {

        private final DownloadJob job;
        private final ProgressTracker tracker;
        private final AtomicReference<Process> engineProcess;

        private JobDownloadObserver(DownloadJob job, ProgressTracker tracker, AtomicReference<Process> engineProcess) {
            this.job = job;
            this.tracker = tracker;
            this.engineProcess = engineProcess;
        }

        @Override
        public void onProcessStarted(Process process) {
            engineProcess.set(process);
            if (job.isCancelRequested()) {
                terminate(process, job.getId());
            }
        }

        @Override
        public void onStreamStarted(String destination) {
            checkCanceled(job);
            tracker.onStreamStarted();
            log.debug("[Job:{}] Stream {} started", job.getId(), tracker.currentStreamIndex() + 1);
        }

        @Override
        public void onTransfer(TransferProgress progress) {
            checkCanceled(job);
            tracker.onTransfer(progress);
        }

        @Override
        public void onPostProcessing(String stage) {
            checkCanceled(job);
            statusUpdater.markProcessing(job, stage);
        }

        @Override
        public void onOutputLine(String line) {
            checkCanceled(job);
        }
    }
}
