package com.example.tubefetch.domain;

/**
 * Descriptive fields returned by the structured metadata API. Any field may be null.
 */
public record PrimaryMetadata(
        String title,
        String uploader,
        String channelLogoUrl,
        String thumbnailUrl,
        Long viewCount,
        Long likeCount,
        Long subscriberCount,
        Long durationSeconds
) {
}
