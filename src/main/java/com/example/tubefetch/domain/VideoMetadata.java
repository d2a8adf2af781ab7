package com.example.tubefetch.domain;

import java.util.List;

/**
 * Descriptive metadata plus the downloadable formats of one video, built fresh for every request.
 *
 * @param degraded        true when part of the lookup failed but a partial result is still returned
 * @param extractionError summarized engine message when formats could not be listed
 */
public record VideoMetadata(
        VideoIdentifier videoId,
        String title,
        String uploader,
        String channelLogoUrl,
        String thumbnailUrl,
        Long viewCount,
        Long likeCount,
        Long subscriberCount,
        Long durationSeconds,
        List<FormatDescriptor> formats,
        InfoSource infoSource,
        boolean degraded,
        String extractionError
) {

    public VideoMetadata {
        formats = formats == null ? List.of() : List.copyOf(formats);
    }
}
