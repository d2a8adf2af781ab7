package com.example.tubefetch.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable, consistent read of a {@link DownloadJob}.
 */
public record JobSnapshot(
        String jobId,
        JobRequest request,
        JobState state,
        double progressPercent,
        String transferRate,
        Duration eta,
        String stage,
        String error,
        Path outputPath,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt
) {

    public Duration elapsed(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = state.isTerminal() ? updatedAt : now;
        Duration elapsed = Duration.between(startedAt, end);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
