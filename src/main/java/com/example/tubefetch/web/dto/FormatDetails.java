package com.example.tubefetch.web.dto;

import com.example.tubefetch.domain.FormatDescriptor;
import com.example.tubefetch.domain.MediaKind;

/**
 * A raw format as reported by the extraction engine.
 */
public record FormatDetails(
        String formatId,
        MediaKind mediaKind,
        Integer width,
        Integer height,
        Double fps,
        String ext,
        String note,
        Long filesize,
        Double abr
) {

    public static FormatDetails from(FormatDescriptor format) {
        return new FormatDetails(
                format.formatId(),
                format.mediaKind(),
                format.resolution() != null ? format.resolution().width() : null,
                format.height(),
                format.frameRate(),
                format.container(),
                format.note(),
                format.filesizeBytes(),
                format.audioBitrate()
        );
    }
}
