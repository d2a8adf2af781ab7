package com.example.tubefetch.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed tables that turn raw quality signals into the labels shown to users.
 */
public final class QualityTiers {

    public record Tier(String label, Integer height) {
    }

    private static final Map<String, Tier> PLAYER_LEVELS = Map.of(
            "tiny", new Tier("144p", 144),
            "small", new Tier("240p", 240),
            "medium", new Tier("360p", 360),
            "large", new Tier("480p", 480),
            "hd720", new Tier("HD", 720),
            "hd1080", new Tier("Full HD", 1080),
            "hd1440", new Tier("2K", 1440),
            "hd2160", new Tier("4K", 2160),
            "hd2880", new Tier("5K", 2880),
            "highres", new Tier("8K", 4320)
    );

    private static final Pattern UNKNOWN_HD_LEVEL = Pattern.compile("hd(\\d{3,4})");

    private QualityTiers() {
    }

    /**
     * Maps a player-reported level such as {@code hd1080}. Unknown {@code hdNNNN} levels become
     * {@code NNNNp}; any other unknown level is capitalized and carries no height.
     */
    public static Optional<Tier> forPlayerLevel(String level) {
        if (level == null || level.isBlank()) {
            return Optional.empty();
        }
        String normalized = level.trim().toLowerCase(Locale.ROOT);
        Tier known = PLAYER_LEVELS.get(normalized);
        if (known != null) {
            return Optional.of(known);
        }
        Matcher hd = UNKNOWN_HD_LEVEL.matcher(normalized);
        if (hd.matches()) {
            int height = Integer.parseInt(hd.group(1));
            return Optional.of(new Tier(height + "p", height));
        }
        String capitalized = Character.toUpperCase(normalized.charAt(0)) + normalized.substring(1);
        return Optional.of(new Tier(capitalized, null));
    }

    public static String forHeight(int height) {
        if (height >= 2160) {
            return "4K";
        }
        if (height >= 1440) {
            return "2K";
        }
        if (height >= 1080) {
            return "Full HD";
        }
        if (height >= 720) {
            return "HD";
        }
        return "SD";
    }
}
