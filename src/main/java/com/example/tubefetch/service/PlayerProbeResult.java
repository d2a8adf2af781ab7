package com.example.tubefetch.service;

import java.util.Optional;

/**
 * Outcome of one player probe.
 *
 * @param level     highest tier reported by the player, only for {@link Outcome#LEVEL}
 * @param errorCode player error code, only for {@link Outcome#PLAYER_ERROR}
 */
public record PlayerProbeResult(Outcome outcome, String level, Integer errorCode) {

    public enum Outcome {
        LEVEL,
        NO_LEVELS,
        TIMEOUT,
        PLAYER_ERROR
    }

    public static PlayerProbeResult level(String level) {
        return new PlayerProbeResult(Outcome.LEVEL, level, null);
    }

    public static PlayerProbeResult noLevels() {
        return new PlayerProbeResult(Outcome.NO_LEVELS, null, null);
    }

    public static PlayerProbeResult timeout() {
        return new PlayerProbeResult(Outcome.TIMEOUT, null, null);
    }

    public static PlayerProbeResult playerError(int code) {
        return new PlayerProbeResult(Outcome.PLAYER_ERROR, null, code);
    }

    public Optional<String> levelIfPresent() {
        return outcome == Outcome.LEVEL ? Optional.ofNullable(level) : Optional.empty();
    }
}
