package com.example.tubefetch.web.dto;

import com.example.tubefetch.domain.InfoSource;
import com.example.tubefetch.domain.QualityEstimate;
import com.example.tubefetch.domain.QualityResolution;
import com.example.tubefetch.domain.QualitySource;
import com.example.tubefetch.domain.ResolvedMetadata;
import com.example.tubefetch.domain.VideoMetadata;

import java.util.List;

/**
 * Everything the client needs to show a video and offer download choices.
 */
public record MetadataResponse(
        String videoId,
        String title,
        String uploader,
        String channelLogoUrl,
        String thumbnailUrl,
        Long viewCount,
        Long likeCount,
        Long subscriberCount,
        Long durationSeconds,
        List<FormatDetails> formats,
        InfoSource infoSource,
        boolean degraded,
        String extractionError,
        String bestQualityLabel,
        QualitySource qualitySource,
        Integer qualityHeight,
        boolean highResolution,
        List<FormatOption> videoOptions,
        FormatOption audioOption
) {

    public static MetadataResponse from(ResolvedMetadata resolved) {
        if (resolved == null) {
            throw new NullPointerException("Cannot create MetadataResponse from null metadata");
        }
        VideoMetadata metadata = resolved.metadata();
        QualityResolution quality = resolved.quality();
        QualityEstimate best = quality.bestQuality();
        return new MetadataResponse(
                metadata.videoId().value(),
                metadata.title(),
                metadata.uploader(),
                metadata.channelLogoUrl(),
                metadata.thumbnailUrl(),
                metadata.viewCount(),
                metadata.likeCount(),
                metadata.subscriberCount(),
                metadata.durationSeconds(),
                metadata.formats().stream().map(FormatDetails::from).toList(),
                metadata.infoSource(),
                metadata.degraded(),
                metadata.extractionError(),
                best.label(),
                best.source(),
                best.numericHeight(),
                quality.highResolution(),
                quality.videoOptions().stream().map(FormatOption::from).toList(),
                FormatOption.from(quality.audioOption())
        );
    }
}
