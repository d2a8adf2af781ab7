package com.example.tubefetch.domain;

import java.util.Objects;

/**
 * An accepted download request. A missing format id means "best available".
 */
public record JobRequest(String url, VideoIdentifier videoId, DownloadKind kind, String selectedFormatId) {

    public static final String BEST_FORMAT = "best";

    public JobRequest {
        Objects.requireNonNull(videoId, "videoId");
        Objects.requireNonNull(kind, "kind");
        if (selectedFormatId == null || selectedFormatId.isBlank()) {
            selectedFormatId = BEST_FORMAT;
        }
    }

    public boolean wantsBest() {
        return BEST_FORMAT.equalsIgnoreCase(selectedFormatId);
    }
}
