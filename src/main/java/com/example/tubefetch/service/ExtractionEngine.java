package com.example.tubefetch.service;

import com.example.tubefetch.domain.ExtractedVideo;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.exceptions.ExtractionException;
import com.example.tubefetch.exceptions.PipelineException;

import java.nio.file.Path;

/**
 * The external engine that lists formats and fetches raw streams.
 */
public interface ExtractionEngine {

    /**
     * Lists descriptive metadata and usable formats of a video.
     *
     * @throws ExtractionException if the engine fails, times out or returns nothing parseable.
     */
    ExtractedVideo extract(VideoIdentifier videoId) throws ExtractionException;

    /**
     * Downloads the streams selected by the request into {@code targetDirectory}, reporting through
     * {@code observer}. Exceptions thrown by the observer abort the transfer and propagate; the
     * engine process is always terminated before this method returns.
     *
     * @return the downloaded file, ready for conversion.
     * @throws PipelineException    if the engine exits abnormally or produces no file.
     * @throws InterruptedException if the calling thread is interrupted while waiting on the engine.
     */
    Path download(JobRequest request, Path targetDirectory, DownloadObserver observer)
            throws PipelineException, InterruptedException;
}
