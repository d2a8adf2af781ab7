package com.example.tubefetch.domain;

import java.util.Objects;
import java.util.Set;

/**
 * A best-effort guess at a video's maximum quality, tagged with where the guess came from.
 */
public record QualityEstimate(String label, QualitySource source, Integer numericHeight) {

    public static final String UNAVAILABLE_LABEL = "Unavailable";

    private static final Set<String> HIGH_RESOLUTION_LABELS = Set.of("2K", "4K", "5K", "8K");
    private static final int HIGH_RESOLUTION_MIN_HEIGHT = 1440;

    public QualityEstimate {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(source, "source");
    }

    public static QualityEstimate unavailable() {
        return new QualityEstimate(UNAVAILABLE_LABEL, QualitySource.UNAVAILABLE, null);
    }

    public boolean isHighResolution() {
        return HIGH_RESOLUTION_LABELS.contains(label)
                || (numericHeight != null && numericHeight >= HIGH_RESOLUTION_MIN_HEIGHT);
    }
}
