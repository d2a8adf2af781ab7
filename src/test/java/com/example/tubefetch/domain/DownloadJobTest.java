package com.example.tubefetch.domain;

import com.example.tubefetch.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DownloadJob Tests")
class DownloadJobTest {

    private MutableClock clock;
    private DownloadJob job;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        JobRequest request = new JobRequest("https://youtu.be/dQw4w9WgXcQ",
                new VideoIdentifier("dQw4w9WgXcQ"), DownloadKind.VIDEO, null);
        job = new DownloadJob("job-1", request, clock);
    }

    @Test
    @DisplayName("✅ New job starts queued with zero progress and a 'best' format")
    void newJob_IsQueued() {
        JobSnapshot snapshot = job.snapshot();
        assertThat(snapshot.state()).isEqualTo(JobState.QUEUED);
        assertThat(snapshot.progressPercent()).isZero();
        assertThat(snapshot.stage()).isEqualTo("Queued");
        assertThat(snapshot.request().wantsBest()).isTrue();
        assertThat(snapshot.elapsed(clock.instant())).isEqualTo(Duration.ZERO);
    }

    @Nested
    @DisplayName("Progress updates")
    class ProgressTests {

        @Test
        @DisplayName("✅ updateProgress: Progress never moves backwards")
        void updateProgress_IsMonotonic() {
            job.transitionTo(JobState.DOWNLOADING, "Downloading");
            job.updateProgress(40.0, "1.0MiB/s", Duration.ofSeconds(30), null);
            job.updateProgress(25.0, "2.0MiB/s", Duration.ofSeconds(10), "Downloading stream 2 of 2");

            JobSnapshot snapshot = job.snapshot();
            assertThat(snapshot.progressPercent()).isEqualTo(40.0);
            assertThat(snapshot.transferRate()).isEqualTo("2.0MiB/s");
            assertThat(snapshot.eta()).isEqualTo(Duration.ofSeconds(10));
            assertThat(snapshot.stage()).isEqualTo("Downloading stream 2 of 2");
        }

        @Test
        @DisplayName("✅ updateProgress: Values are clamped to 0..100")
        void updateProgress_Clamps() {
            job.updateProgress(250.0, null, null, null);
            assertThat(job.snapshot().progressPercent()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("⚠️ updateProgress: Ignored once the job is terminal, progress freezes")
        void updateProgress_FrozenAfterFailure() {
            job.transitionTo(JobState.DOWNLOADING, null);
            job.updateProgress(55.0, null, null, null);
            job.fail("Download failed. Please try again later.");

            assertThat(job.updateProgress(80.0, null, null, null)).isFalse();
            JobSnapshot snapshot = job.snapshot();
            assertThat(snapshot.progressPercent()).isEqualTo(55.0);
            assertThat(snapshot.state()).isEqualTo(JobState.FAILED);
            assertThat(snapshot.error()).isEqualTo("Download failed. Please try again later.");
        }
    }

    @Nested
    @DisplayName("State transitions")
    class TransitionTests {

        @Test
        @DisplayName("✅ complete: Sets 100%, zero ETA and the output path")
        void complete_SetsFinalValues() {
            job.transitionTo(JobState.DOWNLOADING, null);
            job.transitionTo(JobState.PROCESSING, "Converting to MP4");
            Path output = Path.of("/tmp/out.mp4");

            assertThat(job.complete(output)).isTrue();

            JobSnapshot snapshot = job.snapshot();
            assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
            assertThat(snapshot.progressPercent()).isEqualTo(100.0);
            assertThat(snapshot.eta()).isEqualTo(Duration.ZERO);
            assertThat(snapshot.outputPath()).isEqualTo(output);
            assertThat(snapshot.stage()).isEqualTo("Done");
        }

        @Test
        @DisplayName("✅ transitionTo PROCESSING: Clears transfer rate and ETA")
        void processing_ClearsRateAndEta() {
            job.transitionTo(JobState.DOWNLOADING, null);
            job.updateProgress(90.0, "3MiB/s", Duration.ofSeconds(3), null);
            job.transitionTo(JobState.PROCESSING, "Merging streams");

            JobSnapshot snapshot = job.snapshot();
            assertThat(snapshot.transferRate()).isNull();
            assertThat(snapshot.eta()).isNull();
            assertThat(snapshot.progressPercent()).isEqualTo(90.0);
        }

        @Test
        @DisplayName("❌ complete: Rejected straight from the queue")
        void complete_FromQueued_Rejected() {
            assertThat(job.complete(Path.of("/tmp/out.mp4"))).isFalse();
            assertThat(job.getState()).isEqualTo(JobState.QUEUED);
        }

        @Test
        @DisplayName("✅ cancelIfQueued: Only cancels jobs no worker has started")
        void cancelIfQueued_OnlyWhileQueued() {
            assertThat(job.cancelIfQueued()).isTrue();
            assertThat(job.getState()).isEqualTo(JobState.CANCELED);

            DownloadJob running = new DownloadJob("job-2", job.getRequest(), clock);
            running.transitionTo(JobState.DOWNLOADING, null);
            assertThat(running.cancelIfQueued()).isFalse();
            assertThat(running.getState()).isEqualTo(JobState.DOWNLOADING);
        }

        @Test
        @DisplayName("✅ elapsed: Measured from download start and frozen at the terminal update")
        void elapsed_FrozenAtTerminal() {
            clock.advance(Duration.ofSeconds(5));
            job.transitionTo(JobState.DOWNLOADING, null);
            clock.advance(Duration.ofSeconds(30));
            job.markCanceled();
            clock.advance(Duration.ofMinutes(10));

            assertThat(job.snapshot().elapsed(clock.instant())).isEqualTo(Duration.ofSeconds(30));
        }
    }

    @Nested
    @DisplayName("Cancellation hooks")
    class CancelHookTests {

        @Test
        @DisplayName("✅ requestCancel: Raises the flag and runs registered hooks")
        void requestCancel_RunsHooks() {
            AtomicInteger calls = new AtomicInteger();
            job.onCancel(calls::incrementAndGet);

            job.requestCancel();

            assertThat(job.isCancelRequested()).isTrue();
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("✅ onCancel: Hook registered after the request runs immediately")
        void onCancel_AfterRequest_RunsImmediately() {
            job.requestCancel();
            AtomicInteger calls = new AtomicInteger();

            job.onCancel(calls::incrementAndGet);

            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("✅ close: A closed registration is not run")
        void closedRegistration_NotRun() {
            AtomicInteger calls = new AtomicInteger();
            DownloadJob.CancelRegistration registration = job.onCancel(calls::incrementAndGet);
            registration.close();

            job.requestCancel();

            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("⚠️ requestCancel: A failing hook does not stop the others")
        void failingHook_DoesNotBlockOthers() {
            AtomicInteger calls = new AtomicInteger();
            job.onCancel(() -> {
                throw new IllegalStateException("boom");
            });
            job.onCancel(calls::incrementAndGet);

            job.requestCancel();

            assertThat(calls).hasValue(1);
        }
    }
}
