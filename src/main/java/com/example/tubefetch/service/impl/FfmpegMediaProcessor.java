package com.example.tubefetch.service.impl;

import com.example.tubefetch.config.TrackingProcessFunction;
import com.example.tubefetch.domain.DownloadKind;
import com.example.tubefetch.exceptions.PipelineException;
import com.example.tubefetch.service.MediaProcessor;
import net.bramp.ffmpeg.FFmpegExecutor;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import net.bramp.ffmpeg.builder.FFmpegOutputBuilder;
import net.bramp.ffmpeg.job.FFmpegJob;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Converts downloads with ffmpeg: video to H.264/AAC MP4, audio to MP3, thumbnails to PNG.
 */
@Service
public class FfmpegMediaProcessor implements MediaProcessor {

    private static final Logger log = LoggerFactory.getLogger(FfmpegMediaProcessor.class);

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final FFmpegExecutor ffmpegExecutor;
    private final ObjectProvider<FFprobe> ffprobeProvider;
    private final TrackingProcessFunction processFunction;
    private final AsyncTaskExecutor asyncTaskExecutor;
    private final long ffmpegTimeoutSeconds;

    public FfmpegMediaProcessor(
            FFmpegExecutor ffmpegExecutor,
            ObjectProvider<FFprobe> ffprobeProvider,
            TrackingProcessFunction processFunction,
            @Qualifier("asyncTaskExecutor") AsyncTaskExecutor asyncTaskExecutor,
            @Value("${ffmpeg.timeout.seconds:1800}") long ffmpegTimeoutSeconds
    ) {
        this.ffmpegExecutor = ffmpegExecutor;
        this.ffprobeProvider = ffprobeProvider;
        this.processFunction = processFunction;
        this.asyncTaskExecutor = asyncTaskExecutor;
        this.ffmpegTimeoutSeconds = ffmpegTimeoutSeconds;
    }

    @Override
    public void process(Path source, Path output, DownloadKind kind, ProcessingListener listener)
            throws PipelineException, InterruptedException {
        String logPrefix = "[Ffmpeg][" + output.getFileName() + "]";
        FFmpegBuilder builder = buildCommand(source, output, kind);
        if (log.isDebugEnabled()) {
            log.debug("{} FFmpeg command (bramp): {}", logPrefix, String.join(" ", builder.build()));
        }

        FFmpegJob job = ffmpegExecutor.createJob(builder, progressListener(source, kind, listener));
        Future<?> execution = asyncTaskExecutor.submit(job);
        try {
            execution.get(ffmpegTimeoutSeconds, TimeUnit.SECONDS);
            processFunction.release(output.toString());
            listener.onProgress(1.0);
            log.info("{} Conversion to {} finished", logPrefix, kind.extension());

        } catch (TimeoutException e) {
            execution.cancel(true);
            abort(output);
            throw new PipelineException("ffmpeg timed out after " + ffmpegTimeoutSeconds + " seconds", e);

        } catch (InterruptedException e) {
            execution.cancel(true);
            abort(output);
            Thread.currentThread().interrupt();
            throw e;

        } catch (ExecutionException e) {
            processFunction.release(output.toString());
            Throwable cause = e.getCause();
            log.error("{} Exception during FFmpeg execution", logPrefix, cause);
            throw new PipelineException(errorMessage(cause), cause);
        }
    }

    /**
     * Kills the ffmpeg process writing {@code output}. An abort that arrives before that process has
     * been started is remembered, and the process is killed as soon as it starts.
     */
    @Override
    public boolean abort(Path output) {
        return processFunction.terminate(output.toString());
    }

    FFmpegBuilder buildCommand(Path source, Path output, DownloadKind kind) {
        FFmpegBuilder builder = new FFmpegBuilder()
                .setVerbosity(FFmpegBuilder.Verbosity.ERROR)
                .overrideOutputFiles(true)
                .addInput(source.toString());

        FFmpegOutputBuilder outputBuilder = builder.addOutput(output.toString());
        switch (kind) {
            case VIDEO -> outputBuilder
                    .setFormat("mp4")
                    .setVideoCodec("libx264")
                    .setPreset("veryfast")
                    .setConstantRateFactor(23)
                    .setAudioCodec("aac")
                    .addExtraArgs("-movflags", "+faststart");
            case AUDIO -> outputBuilder
                    .setFormat("mp3")
                    .disableVideo()
                    .setAudioCodec("libmp3lame")
                    // LAME VBR preset V0; the builder's setAudioQuality rejects 0
                    .addExtraArgs("-q:a", "0");
            case THUMBNAIL -> outputBuilder
                    .setFormat("image2")
                    .setFrames(1);
        }
        outputBuilder.done();
        return builder;
    }

    private ProgressListener progressListener(Path source, DownloadKind kind, ProcessingListener listener) {
        if (kind == DownloadKind.THUMBNAIL) {
            return progress -> { };
        }
        double durationSeconds = probeDuration(source);
        if (durationSeconds <= 0) {
            return progress -> { };
        }
        return progress -> {
            if (progress.out_time_ns > 0) {
                double fraction = progress.out_time_ns / NANOS_PER_SECOND / durationSeconds;
                listener.onProgress(Math.min(1.0, fraction));
            }
        };
    }

    private double probeDuration(Path source) {
        FFprobe ffprobe = ffprobeProvider.getIfAvailable();
        if (ffprobe == null) {
            return 0;
        }
        try {
            FFmpegProbeResult result = ffprobe.probe(source.toString());
            return result.getFormat() != null ? result.getFormat().duration : 0;
        } catch (IOException | RuntimeException e) {
            log.warn("Could not probe duration of {}, conversion progress will not be reported: {}",
                    source.getFileName(), e.getMessage());
            return 0;
        }
    }

    private static String errorMessage(Throwable cause) {
        if (cause instanceof IOException && cause.getMessage() != null
                && cause.getMessage().contains("ffmpeg returned non-zero exit status")) {
            return "ffmpeg conversion failed: " + cause.getMessage();
        } else if (cause != null) {
            return "Unexpected error during ffmpeg execution: " + cause.getMessage();
        }
        return "Unknown error during ffmpeg execution";
    }
}
