package com.example.tubefetch.web.dto;

import com.example.tubefetch.domain.SelectableFormat;

/**
 * One entry of a download menu. {@code synthetic} marks the pinned "best" choice.
 */
public record FormatOption(
        String formatId,
        String label,
        Integer height,
        Double fps,
        String ext,
        boolean synthetic
) {

    public static FormatOption from(SelectableFormat format) {
        if (format == null) {
            return null;
        }
        return new FormatOption(
                format.formatId(),
                format.label(),
                format.height(),
                format.frameRate(),
                format.container(),
                format.synthetic()
        );
    }
}
