package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.DownloadKind;
import com.example.tubefetch.domain.ExtractedVideo;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.exceptions.ExtractionException;
import com.example.tubefetch.exceptions.PipelineException;
import com.example.tubefetch.progress.YtDlpOutputParser;
import com.example.tubefetch.service.DownloadObserver;
import com.example.tubefetch.service.ExtractionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * {@link ExtractionEngine} backed by the yt-dlp command line tool.
 */
@Service
public class YtDlpExtractionEngine implements ExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(YtDlpExtractionEngine.class);

    static final String OUTPUT_TEMPLATE = "%(title).150B.%(ext)s";
    private static final long TERMINATION_GRACE_SECONDS = 5;
    private static final Duration TERMINATION_GRACE = Duration.ofSeconds(TERMINATION_GRACE_SECONDS);

    private final String ytDlpPath;
    private final String proxyUrl;
    private final String cookiesFile;
    private final String ffmpegPath;
    private final long metadataTimeoutSeconds;
    private final long downloadTimeoutSeconds;
    private final String bestVideoSelector;
    private final YtDlpInfoParser infoParser;
    private final YtDlpOutputParser outputParser;
    private final AsyncTaskExecutor asyncTaskExecutor;
    private final TaskScheduler taskScheduler;

    public YtDlpExtractionEngine(
            @Value("${ytdlp.path:yt-dlp}") String ytDlpPath,
            @Value("${ytdlp.proxy-url:}") String proxyUrl,
            @Value("${ytdlp.cookies-file:}") String cookiesFile,
            @Value("${ffmpeg.path}") String ffmpegPath,
            @Value("${ytdlp.metadata-timeout-seconds:25}") long metadataTimeoutSeconds,
            @Value("${ytdlp.download-timeout-seconds:3600}") long downloadTimeoutSeconds,
            @Value("${ytdlp.best-video-selector:bestvideo*+bestaudio/best}") String bestVideoSelector,
            YtDlpInfoParser infoParser,
            YtDlpOutputParser outputParser,
            @Qualifier("asyncTaskExecutor") AsyncTaskExecutor asyncTaskExecutor,
            TaskScheduler taskScheduler
    ) {
        this.ytDlpPath = ytDlpPath;
        this.proxyUrl = proxyUrl;
        this.cookiesFile = cookiesFile;
        this.ffmpegPath = ffmpegPath;
        this.metadataTimeoutSeconds = metadataTimeoutSeconds;
        this.downloadTimeoutSeconds = downloadTimeoutSeconds;
        this.bestVideoSelector = bestVideoSelector;
        this.infoParser = infoParser;
        this.outputParser = outputParser;
        this.asyncTaskExecutor = asyncTaskExecutor;
        this.taskScheduler = taskScheduler;
    }

    @Override
    public ExtractedVideo extract(VideoIdentifier videoId) throws ExtractionException {
        List<String> cmd = buildMetadataCommand(videoId);
        log.debug("[yt-dlp][{}] Running: {}", videoId, String.join(" ", cmd));

        Process process;
        try {
            process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ExtractionException("The extraction engine could not be started.", e);
        }

        Future<List<String>> reader = asyncTaskExecutor.submit(() -> readAllLines(process));
        try {
            boolean finished = process.waitFor(metadataTimeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                log.warn("[yt-dlp][{}] Metadata lookup exceeded {}s, killing process", videoId, metadataTimeoutSeconds);
                ProcessTrees.terminate(process, TERMINATION_GRACE);
                throw new ExtractionException("Fetching video information timed out.");
            }
            List<String> lines = reader.get(TERMINATION_GRACE_SECONDS, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            Optional<String> json = lines.stream().filter(line -> line.startsWith("{")).findFirst();
            if (exitCode != 0 || json.isEmpty()) {
                String output = String.join("\n", lines);
                log.warn("[yt-dlp][{}] Metadata lookup failed with exit code {}:\n{}", videoId, exitCode, output);
                throw new ExtractionException(ErrorSummaries.engineMessage(output));
            }
            return infoParser.parse(json.get());

        } catch (InterruptedException e) {
            ProcessTrees.terminate(process, TERMINATION_GRACE);
            Thread.currentThread().interrupt();
            throw new ExtractionException("Fetching video information was interrupted.", e);
        } catch (ExecutionException | TimeoutException e) {
            ProcessTrees.terminate(process, TERMINATION_GRACE);
            throw new ExtractionException("Could not read the extraction engine output.", e);
        } finally {
            reader.cancel(true);
        }
    }

    @Override
    public Path download(JobRequest request, Path targetDirectory, DownloadObserver observer)
            throws PipelineException, InterruptedException {
        List<String> cmd = buildDownloadCommand(request, targetDirectory);
        log.debug("[yt-dlp][{}] Running: {}", request.videoId(), String.join(" ", cmd));

        Process process;
        try {
            Files.createDirectories(targetDirectory);
            process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new PipelineException("yt-dlp could not be started", e);
        }

        AtomicBoolean timedOut = new AtomicBoolean(false);
        ScheduledFuture<?> watchdog = taskScheduler.schedule(() -> {
            timedOut.set(true);
            log.warn("[yt-dlp][{}] Download exceeded {}s, killing process", request.videoId(), downloadTimeoutSeconds);
            ProcessTrees.terminate(process, TERMINATION_GRACE);
        }, Instant.now().plusSeconds(downloadTimeoutSeconds));

        StringBuilder output = new StringBuilder();
        boolean postProcessing = false;
        try {
            observer.onProcessStarted(process);
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                    log.trace("[yt-dlp][{}] {}", request.videoId(), line);
                    observer.onOutputLine(line);
                    postProcessing = dispatchLine(line, observer, postProcessing);
                }
            } catch (IOException e) {
                // Stream closed under us, normally because the process was killed
                log.debug("[yt-dlp][{}] Output stream closed: {}", request.videoId(), e.getMessage());
            }

            int exitCode = process.waitFor();
            if (timedOut.get()) {
                throw new PipelineException("yt-dlp timed out after " + downloadTimeoutSeconds + " seconds",
                        exitCode, output.toString());
            }
            if (exitCode != 0) {
                throw new PipelineException("yt-dlp exited with code " + exitCode, exitCode, output.toString());
            }
            if (!postProcessing) {
                observer.onPostProcessing("Preparing file");
            }
            return findDownloadedFile(targetDirectory)
                    .orElseThrow(() -> new PipelineException("yt-dlp finished without producing a file",
                            exitCode, output.toString()));
        } finally {
            watchdog.cancel(false);
            terminate(process);
        }
    }

    List<String> buildMetadataCommand(VideoIdentifier videoId) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ytDlpPath);
        cmd.add("--dump-json");
        cmd.add("--no-playlist");
        cmd.add("--no-warnings");
        addNetworkOptions(cmd);
        cmd.add(videoId.watchUrl());
        return cmd;
    }

    List<String> buildDownloadCommand(JobRequest request, Path targetDirectory) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ytDlpPath);
        cmd.add("--no-playlist");
        cmd.add("--no-warnings");
        cmd.add("--newline");
        addNetworkOptions(cmd);
        if (ffmpegPath != null && !ffmpegPath.isBlank()) {
            cmd.add("--ffmpeg-location");
            cmd.add(ffmpegPath);
        }
        cmd.add("-o");
        cmd.add(targetDirectory.resolve(OUTPUT_TEMPLATE).toString());

        DownloadKind kind = request.kind();
        switch (kind) {
            case VIDEO -> {
                cmd.add("-f");
                cmd.add(request.wantsBest()
                        ? bestVideoSelector
                        : request.selectedFormatId() + "+bestaudio/" + request.selectedFormatId());
                cmd.add("--merge-output-format");
                cmd.add("mkv");
            }
            case AUDIO -> {
                cmd.add("-f");
                cmd.add(request.wantsBest() ? "bestaudio/best" : request.selectedFormatId());
            }
            case THUMBNAIL -> {
                cmd.add("--skip-download");
                cmd.add("--write-thumbnail");
            }
        }
        cmd.add(request.videoId().watchUrl());
        return cmd;
    }

    private void addNetworkOptions(List<String> cmd) {
        if (proxyUrl != null && !proxyUrl.isBlank()) {
            cmd.add("--proxy");
            cmd.add(proxyUrl);
        }
        if (cookiesFile != null && !cookiesFile.isBlank()) {
            cmd.add("--cookies");
            cmd.add(cookiesFile);
        }
    }

    private boolean dispatchLine(String line, DownloadObserver observer, boolean postProcessing) {
        Optional<String> destination = outputParser.parseDestination(line);
        if (destination.isPresent() && !postProcessing) {
            observer.onStreamStarted(destination.get());
            return false;
        }
        Optional<String> stage = outputParser.parsePostProcessingStage(line);
        if (stage.isPresent()) {
            observer.onPostProcessing(stage.get());
            return true;
        }
        if (!postProcessing) {
            outputParser.parseProgress(line).ifPresent(observer::onTransfer);
        }
        return postProcessing;
    }

    private Optional<Path> findDownloadedFile(Path targetDirectory) throws PipelineException {
        try (Stream<Path> files = Files.list(targetDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> {
                        String name = file.getFileName().toString();
                        return !name.endsWith(".part") && !name.endsWith(".ytdl") && !name.endsWith(".temp");
                    })
                    .max(Comparator.comparingLong(this::sizeOf));
        } catch (IOException e) {
            throw new PipelineException("Could not list downloaded files", e);
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return -1L;
        }
    }

    private static List<String> readAllLines(Process process) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static void terminate(Process process) throws InterruptedException {
        ProcessTrees.terminateAndWait(process, TERMINATION_GRACE);
    }
}
