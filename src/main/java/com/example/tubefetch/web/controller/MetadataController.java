package com.example.tubefetch.web.controller;

import com.example.tubefetch.domain.ResolvedMetadata;
import com.example.tubefetch.service.MetadataService;
import com.example.tubefetch.web.dto.MetadataRequest;
import com.example.tubefetch.web.dto.MetadataResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MetadataController {

    private static final Logger log = LoggerFactory.getLogger(MetadataController.class);

    private final MetadataService metadataService;

    public MetadataController(MetadataService metadataService) {
        this.metadataService = metadataService;
    }

    @PostMapping(value = "/metadata", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MetadataResponse> fetchMetadata(@RequestBody @Valid MetadataRequest request) {
        log.debug("Metadata request received for URL: {}", request.url());
        ResolvedMetadata resolved = metadataService.fetch(request.url(), request.playerQuality());
        MetadataResponse response = MetadataResponse.from(resolved);
        log.info("Returning metadata for video {} ({} video options, degraded: {})",
                response.videoId(), response.videoOptions().size(), response.degraded());
        return ResponseEntity.ok(response);
    }
}
