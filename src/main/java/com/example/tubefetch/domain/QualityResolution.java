package com.example.tubefetch.domain;

import java.util.List;

/**
 * Outcome of merging both quality signals: the label to display and the options offered.
 */
public record QualityResolution(
        QualityEstimate bestQuality,
        boolean highResolution,
        List<SelectableFormat> videoOptions,
        SelectableFormat audioOption
) {

    public QualityResolution {
        videoOptions = List.copyOf(videoOptions);
    }
}
