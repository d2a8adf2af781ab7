package com.example.tubefetch.web.controller;

import com.example.tubefetch.domain.JobOutput;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.domain.VideoIdentifiers;
import com.example.tubefetch.exceptions.InvalidVideoUrlException;
import com.example.tubefetch.exceptions.JobNotFoundException;
import com.example.tubefetch.service.JobRegistry;
import com.example.tubefetch.service.JobWorkspaceStorage;
import com.example.tubefetch.web.dto.CancelResponse;
import com.example.tubefetch.web.dto.DownloadRequest;
import com.example.tubefetch.web.dto.DownloadResponse;
import com.example.tubefetch.web.dto.ProgressResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

@RestController
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobRegistry jobRegistry;
    private final JobWorkspaceStorage workspaceStorage;
    private final Clock clock;

    public JobController(JobRegistry jobRegistry, JobWorkspaceStorage workspaceStorage, Clock clock) {
        this.jobRegistry = jobRegistry;
        this.workspaceStorage = workspaceStorage;
        this.clock = clock;
    }

    @PostMapping(value = "/download", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DownloadResponse> startDownload(@RequestBody @Valid DownloadRequest request) {
        VideoIdentifier videoId = VideoIdentifiers.extract(request.url())
                .orElseThrow(InvalidVideoUrlException::new);
        JobRequest jobRequest = new JobRequest(request.url(), videoId, request.mediaKind(), request.selectedFormatId());
        String jobId = jobRegistry.create(jobRequest);
        log.info("Controller returning ACCEPTED for job {} ({} of {})", jobId, request.mediaKind().wireName(), videoId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new DownloadResponse(jobId));
    }

    @GetMapping("/progress/{jobId}")
    public ResponseEntity<ProgressResponse> getProgress(@PathVariable String jobId) {
        return jobRegistry.getStatus(jobId)
                .map(snapshot -> ProgressResponse.fromSnapshot(snapshot, clock.instant()))
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @PostMapping("/cancel/{jobId}")
    public ResponseEntity<CancelResponse> cancel(@PathVariable String jobId) {
        if (!jobRegistry.cancel(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return ResponseEntity.ok(CancelResponse.acknowledged());
    }

    @GetMapping("/file/{jobId}")
    public ResponseEntity<Resource> downloadFile(@PathVariable String jobId) {
        JobOutput output = jobRegistry.resolveOutput(jobId);
        Resource resource = workspaceStorage.load(output.path());

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(output.filename(), StandardCharsets.UTF_8)
                .build();
        ResponseEntity.BodyBuilder responseBuilder = ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(output.mimeType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString());
        if (output.contentLength() != null) {
            responseBuilder.contentLength(output.contentLength());
        } else {
            log.warn("Content length unknown for job {}. Proceeding without.", jobId);
        }
        log.info("Serving file {} for job {}", output.filename(), jobId);
        return responseBuilder.body(resource);
    }
}
