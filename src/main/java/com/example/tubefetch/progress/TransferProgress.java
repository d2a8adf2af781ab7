package com.example.tubefetch.progress;

import java.time.Duration;

/**
 * One progress report for a single stream transfer. Everything except the percentage is optional.
 */
public record TransferProgress(
        double percent,
        Long totalBytes,
        String speed,
        Long speedBytesPerSecond,
        Duration eta
) {
}
