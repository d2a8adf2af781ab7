package com.example.tubefetch.progress;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the line-oriented output yt-dlp prints with {@code --newline}.
 * Recognises transfer progress, the start of a new stream and the post-processing steps.
 */
@Component
public class YtDlpOutputParser {

    private static final Pattern PERCENT = Pattern.compile("^\\[download]\\s+(\\d{1,3}(?:\\.\\d+)?)%");
    private static final Pattern TOTAL_SIZE = Pattern.compile("\\bof\\s+~?\\s*(\\d+(?:\\.\\d+)?)\\s*([KMGT]?i?B)\\b");
    private static final Pattern SPEED = Pattern.compile("\\bat\\s+((\\d+(?:\\.\\d+)?)\\s*([KMGT]?i?B)/s)");
    private static final Pattern ETA = Pattern.compile("\\bETA\\s+((?:\\d+:)?\\d{1,2}:\\d{2})\\b");
    private static final Pattern DESTINATION = Pattern.compile("^\\[download]\\s+Destination:\\s+(.+)$");
    private static final Pattern ALREADY_DOWNLOADED = Pattern.compile("^\\[download]\\s+(.+) has already been downloaded");
    private static final Pattern POST_PROCESSOR = Pattern.compile("^\\[(\\w+)]");

    private static final Map<String, String> POST_PROCESSOR_STAGES = Map.ofEntries(
            Map.entry("Merger", "Merging streams"),
            Map.entry("ExtractAudio", "Extracting audio"),
            Map.entry("VideoConvertor", "Converting video"),
            Map.entry("VideoRemuxer", "Converting video"),
            Map.entry("FixupM3u8", "Post-processing"),
            Map.entry("FixupM4a", "Post-processing"),
            Map.entry("FixupStretched", "Post-processing"),
            Map.entry("FixupDuplicateMoov", "Post-processing"),
            Map.entry("FixupTimestamp", "Post-processing"),
            Map.entry("ThumbnailsConvertor", "Converting thumbnail"),
            Map.entry("EmbedThumbnail", "Post-processing"),
            Map.entry("Metadata", "Post-processing")
    );

    public Optional<TransferProgress> parseProgress(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher percentMatcher = PERCENT.matcher(line);
        if (!percentMatcher.find()) {
            return Optional.empty();
        }
        double percent = Double.parseDouble(percentMatcher.group(1));

        Long totalBytes = null;
        Matcher sizeMatcher = TOTAL_SIZE.matcher(line);
        if (sizeMatcher.find()) {
            totalBytes = toBytes(sizeMatcher.group(1), sizeMatcher.group(2));
        }

        String speed = null;
        Long speedBytes = null;
        Matcher speedMatcher = SPEED.matcher(line);
        if (speedMatcher.find()) {
            speed = speedMatcher.group(1).replace(" ", "");
            speedBytes = toBytes(speedMatcher.group(2), speedMatcher.group(3));
        }

        Duration eta = null;
        Matcher etaMatcher = ETA.matcher(line);
        if (etaMatcher.find()) {
            eta = parseClock(etaMatcher.group(1));
        }
        return Optional.of(new TransferProgress(percent, totalBytes, speed, speedBytes, eta));
    }

    /**
     * Returns the target file when the line announces a new stream transfer.
     */
    public Optional<String> parseDestination(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher destination = DESTINATION.matcher(line);
        if (destination.find()) {
            return Optional.of(destination.group(1).trim());
        }
        Matcher already = ALREADY_DOWNLOADED.matcher(line);
        if (already.find()) {
            return Optional.of(already.group(1).trim());
        }
        return Optional.empty();
    }

    /**
     * Returns a human-readable stage name when the line comes from a post-processor.
     */
    public Optional<String> parsePostProcessingStage(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = POST_PROCESSOR.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.ofNullable(POST_PROCESSOR_STAGES.get(matcher.group(1)));
    }

    static Long toBytes(String value, String unit) {
        double amount = Double.parseDouble(value);
        double multiplier = switch (unit.toUpperCase(Locale.ROOT)) {
            case "KIB" -> 1024d;
            case "MIB" -> 1024d * 1024;
            case "GIB" -> 1024d * 1024 * 1024;
            case "TIB" -> 1024d * 1024 * 1024 * 1024;
            case "KB" -> 1_000d;
            case "MB" -> 1_000_000d;
            case "GB" -> 1_000_000_000d;
            case "TB" -> 1_000_000_000_000d;
            default -> 1d;
        };
        return Math.round(amount * multiplier);
    }

    static Duration parseClock(String value) {
        String[] parts = value.split(":");
        long seconds = 0;
        for (String part : parts) {
            seconds = seconds * 60 + Long.parseLong(part);
        }
        return Duration.ofSeconds(seconds);
    }
}
