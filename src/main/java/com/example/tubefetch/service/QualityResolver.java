package com.example.tubefetch.service;

import com.example.tubefetch.domain.FormatDescriptor;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.QualityEstimate;
import com.example.tubefetch.domain.QualityResolution;
import com.example.tubefetch.domain.QualitySource;
import com.example.tubefetch.domain.QualityTiers;
import com.example.tubefetch.domain.SelectableFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the player signal and the extraction engine's format list into the label shown to the user
 * and the options offered for download.
 * <p>
 * The player's tier takes precedence over the height derived from formats; with neither signal the
 * label is "Unavailable". Selectable video formats always come from the engine, and a synthetic
 * "best" entry is always pinned first so the user can start a download even when nothing is known.
 */
@Component
public class QualityResolver {

    private static final Comparator<FormatDescriptor> BY_HEIGHT_THEN_FPS = Comparator
            .comparing((FormatDescriptor f) -> f.height() != null ? f.height() : 0, Comparator.reverseOrder())
            .thenComparing(f -> f.frameRate() != null ? f.frameRate() : 0.0, Comparator.reverseOrder());

    private static final int FPS_LABEL_THRESHOLD = 30;

    public Optional<QualityEstimate> fromPlayerLevel(String level) {
        return QualityTiers.forPlayerLevel(level)
                .map(tier -> new QualityEstimate(tier.label(), QualitySource.PLAYER_PROBE, tier.height()));
    }

    public Optional<QualityEstimate> fromFormats(List<FormatDescriptor> formats) {
        return formats.stream()
                .filter(f -> f.mediaKind().hasVideo())
                .map(FormatDescriptor::height)
                .filter(Objects::nonNull)
                .max(Integer::compare)
                .map(height -> new QualityEstimate(QualityTiers.forHeight(height), QualitySource.EXTRACTION_PROBE, height));
    }

    public QualityResolution resolve(String playerLevel, List<FormatDescriptor> formats) {
        List<FormatDescriptor> safeFormats = formats != null ? formats : List.of();
        QualityEstimate best = fromPlayerLevel(playerLevel)
                .or(() -> fromFormats(safeFormats))
                .orElseGet(QualityEstimate::unavailable);

        return new QualityResolution(
                best,
                best.isHighResolution(),
                videoOptions(safeFormats, best),
                audioOption(safeFormats)
        );
    }

    private List<SelectableFormat> videoOptions(List<FormatDescriptor> formats, QualityEstimate best) {
        List<SelectableFormat> options = new ArrayList<>();
        options.add(new SelectableFormat(JobRequest.BEST_FORMAT,
                "Best Quality Available (" + best.label() + ")",
                best.numericHeight(), null, null, true));

        Set<String> seen = new HashSet<>();
        formats.stream()
                .filter(f -> f.mediaKind().hasVideo() && f.height() != null)
                .sorted(BY_HEIGHT_THEN_FPS)
                .filter(f -> seen.add(f.height() + "|" + roundedFps(f) + "|" + f.container()))
                .map(f -> new SelectableFormat(f.formatId(), videoLabel(f), f.height(), f.frameRate(), f.container(), false))
                .forEach(options::add);
        return options;
    }

    private SelectableFormat audioOption(List<FormatDescriptor> formats) {
        return formats.stream()
                .filter(FormatDescriptor::isAudioOnly)
                .max(Comparator.comparing(f -> f.audioBitrate() != null ? f.audioBitrate() : 0.0))
                .map(f -> new SelectableFormat(f.formatId(), audioLabel(f), null, null, f.container(), false))
                .orElseGet(() -> new SelectableFormat(JobRequest.BEST_FORMAT, "Best Audio Available", null, null, null, true));
    }

    private String videoLabel(FormatDescriptor format) {
        int height = format.height();
        StringBuilder label = new StringBuilder()
                .append(QualityTiers.forHeight(height))
                .append(" (").append(height).append("p)");
        long fps = roundedFps(format);
        if (fps > FPS_LABEL_THRESHOLD) {
            label.append(' ').append(fps).append("fps");
        }
        if (format.container() != null) {
            label.append(" - ").append(format.container());
        }
        return label.toString();
    }

    private String audioLabel(FormatDescriptor format) {
        StringBuilder label = new StringBuilder("Best Audio");
        if (format.audioBitrate() != null && format.audioBitrate() > 0) {
            label.append(" (").append(Math.round(format.audioBitrate())).append("kbps)");
        }
        if (format.container() != null) {
            label.append(" - ").append(format.container());
        }
        return label.toString();
    }

    private long roundedFps(FormatDescriptor format) {
        return format.frameRate() != null ? Math.round(format.frameRate()) : 0;
    }
}
