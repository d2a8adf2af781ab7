package com.example.tubefetch.web.dto;

import com.example.tubefetch.domain.DownloadKind;
import com.example.tubefetch.domain.JobSnapshot;
import com.example.tubefetch.domain.JobState;
import com.example.tubefetch.progress.EtaCalculator;

import java.time.Duration;
import java.time.Instant;

/**
 * Poll view of a job. Failed and canceled jobs are reported here too, with {@code error} set for failures.
 *
 * @param progress percent with one decimal
 * @param eta      "mm:ss" or "h:mm:ss", null while unknown
 */
public record ProgressResponse(
        String jobId,
        JobState status,
        double progress,
        String speed,
        String eta,
        Long etaSeconds,
        String stage,
        String error,
        DownloadKind mediaKind,
        long elapsedSeconds
) {

    public static ProgressResponse fromSnapshot(JobSnapshot snapshot, Instant now) {
        Duration eta = snapshot.eta();
        return new ProgressResponse(
                snapshot.jobId(),
                snapshot.state(),
                Math.round(snapshot.progressPercent() * 10.0) / 10.0,
                snapshot.transferRate(),
                eta != null ? EtaCalculator.format(eta) : null,
                eta != null ? eta.getSeconds() : null,
                snapshot.stage(),
                snapshot.error(),
                snapshot.request().kind(),
                snapshot.elapsed(now).getSeconds()
        );
    }
}
