package com.example.tubefetch.progress;

import com.example.tubefetch.domain.DownloadJob;
import com.example.tubefetch.domain.JobSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Normalizes a job's native progress callbacks into a single 0-100 scale and writes them to the job
 * at a bounded cadence.
 * <p>
 * Transfers cover 0-90: stream {@code i} of {@code n} at {@code p}% maps to {@code 90 * (i + p/100) / n}.
 * Processing covers 90-99, and only completion reports 100. Updates closer together than the publish
 * interval are coalesced, except when the stage changes.
 */
public class ProgressTracker {

    static final double TRANSFER_SHARE = 90.0;
    static final double PROCESSING_END = 99.0;

    private final DownloadJob job;
    private final Clock clock;
    private final Duration publishInterval;
    private final int expectedStreams;

    private int streamIndex = -1;
    private Instant lastPublishedAt;
    private String lastStage;

    public ProgressTracker(DownloadJob job, Clock clock, Duration publishInterval, int expectedStreams) {
        this.job = job;
        this.clock = clock;
        this.publishInterval = publishInterval;
        this.expectedStreams = Math.max(1, expectedStreams);
    }

    /**
     * A new stream transfer began. Extra streams beyond the expected count reuse the last slot.
     */
    public void onStreamStarted() {
        streamIndex = Math.min(streamIndex + 1, expectedStreams - 1);
    }

    public void onTransfer(TransferProgress progress) {
        int index = Math.max(streamIndex, 0);
        double streamFraction = Math.max(0.0, Math.min(100.0, progress.percent())) / 100.0;
        double overall = TRANSFER_SHARE * (index + streamFraction) / expectedStreams;

        Duration eta = progress.eta();
        if (eta == null) {
            JobSnapshot snapshot = job.snapshot();
            eta = EtaCalculator.estimate(snapshot.elapsed(clock.instant()), overall).orElse(null);
        }
        String stage = expectedStreams > 1
                ? "Downloading stream " + (index + 1) + " of " + expectedStreams
                : "Downloading";
        publish(overall, progress.speed(), eta, stage, progress.percent() >= 100.0);
    }

    /**
     * Conversion progress, with {@code fraction} between 0 and 1.
     */
    public void onProcessing(String stage, double fraction) {
        double bounded = Math.max(0.0, Math.min(1.0, fraction));
        double overall = TRANSFER_SHARE + (PROCESSING_END - TRANSFER_SHARE) * bounded;
        publish(overall, null, null, stage, false);
    }

    public int currentStreamIndex() {
        return streamIndex;
    }

    private void publish(double overall, String rate, Duration eta, String stage, boolean force) {
        Instant now = clock.instant();
        boolean stageChanged = stage != null && !stage.equals(lastStage);
        boolean due = lastPublishedAt == null
                || !now.isBefore(lastPublishedAt.plus(publishInterval));
        if (!force && !stageChanged && !due) {
            return;
        }
        if (job.updateProgress(overall, rate, eta, stage)) {
            lastPublishedAt = now;
            lastStage = stage;
        }
    }
}
