package com.example.tubefetch.progress;

import java.time.Duration;
import java.util.Optional;

public final class EtaCalculator {

    private EtaCalculator() {
    }

    /**
     * Linear estimate {@code elapsed * (100 - progress) / progress}. Empty while progress is zero,
     * so callers report the ETA as indeterminate.
     */
    public static Optional<Duration> estimate(Duration elapsed, double progressPercent) {
        if (elapsed == null || elapsed.isNegative() || progressPercent <= 0.0) {
            return Optional.empty();
        }
        if (progressPercent >= 100.0) {
            return Optional.of(Duration.ZERO);
        }
        double remainingMillis = elapsed.toMillis() * (100.0 - progressPercent) / progressPercent;
        return Optional.of(Duration.ofMillis(Math.round(remainingMillis)));
    }

    /**
     * Renders a duration as {@code mm:ss}, or {@code h:mm:ss} from one hour up.
     */
    public static String format(Duration duration) {
        if (duration == null) {
            return null;
        }
        long totalSeconds = Math.max(0, duration.toSeconds());
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, seconds);
        }
        return String.format("%02d:%02d", minutes, seconds);
    }
}
