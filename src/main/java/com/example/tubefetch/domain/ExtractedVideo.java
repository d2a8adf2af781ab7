package com.example.tubefetch.domain;

import java.util.List;

/**
 * What the extraction engine reports for a single video: descriptive fields and usable formats.
 */
public record ExtractedVideo(
        String title,
        String uploader,
        String thumbnailUrl,
        Long viewCount,
        Long likeCount,
        Long subscriberCount,
        Long durationSeconds,
        List<FormatDescriptor> formats
) {

    public ExtractedVideo {
        formats = formats == null ? List.of() : List.copyOf(formats);
    }
}
