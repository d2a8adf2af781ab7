package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.DownloadKind;
import com.example.tubefetch.domain.ExtractedVideo;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.exceptions.ExtractionException;
import com.example.tubefetch.exceptions.PipelineException;
import com.example.tubefetch.progress.TransferProgress;
import com.example.tubefetch.progress.YtDlpOutputParser;
import com.example.tubefetch.service.DownloadObserver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("YtDlpExtractionEngine Tests")
class YtDlpExtractionEngineTest {

    private static final VideoIdentifier VIDEO_ID = new VideoIdentifier("dQw4w9WgXcQ");

    @TempDir
    Path tempDir;

    private ThreadPoolTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix("engine-test-");
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private YtDlpExtractionEngine engine(String executable, String proxy, String cookies, long metadataTimeout) {
        return engine(executable, proxy, cookies, metadataTimeout, 60);
    }

    private YtDlpExtractionEngine engine(String executable, String proxy, String cookies, long metadataTimeout,
                                         long downloadTimeout) {
        return new YtDlpExtractionEngine(executable, proxy, cookies, "/usr/bin/ffmpeg", metadataTimeout, downloadTimeout,
                "bestvideo*+bestaudio/best", new YtDlpInfoParser(new ObjectMapper()), new YtDlpOutputParser(),
                new SimpleAsyncTaskExecutor("engine-test-io-"), scheduler);
    }

    private static JobRequest request(DownloadKind kind, String formatId) {
        return new JobRequest("https://youtu.be/dQw4w9WgXcQ", VIDEO_ID, kind, formatId);
    }

    @Nested
    @DisplayName("Command building")
    class CommandTests {

        private final YtDlpExtractionEngine engine =
                engine("yt-dlp", "socks5://127.0.0.1:9050", "/etc/tubefetch/cookies.txt", 25);

        @Test
        @DisplayName("✅ Metadata command dumps JSON for the canonical watch URL")
        void metadataCommand() {
            assertThat(engine.buildMetadataCommand(VIDEO_ID)).containsExactly(
                    "yt-dlp", "--dump-json", "--no-playlist", "--no-warnings",
                    "--proxy", "socks5://127.0.0.1:9050",
                    "--cookies", "/etc/tubefetch/cookies.txt",
                    "https://www.youtube.com/watch?v=dQw4w9WgXcQ");
        }

        @Test
        @DisplayName("✅ Video with a chosen format adds the best audio and merges to MKV")
        void videoCommand_SelectedFormat() {
            List<String> cmd = engine.buildDownloadCommand(request(DownloadKind.VIDEO, "137"), tempDir);

            assertThat(cmd).containsSubsequence("-f", "137+bestaudio/137", "--merge-output-format", "mkv");
            assertThat(cmd).containsSubsequence("--ffmpeg-location", "/usr/bin/ffmpeg");
            assertThat(cmd).containsSubsequence("-o", tempDir.resolve(YtDlpExtractionEngine.OUTPUT_TEMPLATE).toString());
            assertThat(cmd).contains("--newline");
            assertThat(cmd.get(cmd.size() - 1)).isEqualTo("https://www.youtube.com/watch?v=dQw4w9WgXcQ");
        }

        @Test
        @DisplayName("✅ Best video uses the configured selector")
        void videoCommand_Best() {
            assertThat(engine.buildDownloadCommand(request(DownloadKind.VIDEO, null), tempDir))
                    .containsSubsequence("-f", "bestvideo*+bestaudio/best");
        }

        @Test
        @DisplayName("✅ Audio and thumbnail commands")
        void audioAndThumbnailCommands() {
            assertThat(engine.buildDownloadCommand(request(DownloadKind.AUDIO, "best"), tempDir))
                    .containsSubsequence("-f", "bestaudio/best");
            assertThat(engine.buildDownloadCommand(request(DownloadKind.AUDIO, "251"), tempDir))
                    .containsSubsequence("-f", "251");

            List<String> thumbnail = engine.buildDownloadCommand(request(DownloadKind.THUMBNAIL, null), tempDir);
            assertThat(thumbnail).contains("--skip-download", "--write-thumbnail").doesNotContain("-f");
        }

        @Test
        @DisplayName("⚠️ Blank proxy and cookies settings are left out")
        void blankNetworkOptions() {
            List<String> cmd = engine("yt-dlp", "", " ", 25).buildMetadataCommand(VIDEO_ID);

            assertThat(cmd).doesNotContain("--proxy", "--cookies");
        }
    }

    @Nested
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("Running a stand-in engine")
    class ProcessTests {

        private Path script(String body) throws IOException {
            Path script = tempDir.resolve("fake-yt-dlp-" + System.nanoTime() + ".sh");
            Files.writeString(script, "#!/bin/sh\n" + body + "\n");
            assertThat(script.toFile().setExecutable(true)).isTrue();
            return script;
        }

        @Test
        @DisplayName("✅ extract: Parses the JSON line among other output")
        void extract_Success() throws IOException {
            Path fake = script("""
                    echo '[youtube] dQw4w9WgXcQ: Downloading webpage'
                    echo '{"id":"dQw4w9WgXcQ","title":"Never Gonna","duration":213,"formats":[]}'
                    """);

            ExtractedVideo video = engine(fake.toString(), "", "", 10).extract(VIDEO_ID);

            assertThat(video.title()).isEqualTo("Never Gonna");
            assertThat(video.durationSeconds()).isEqualTo(213L);
        }

        @Test
        @DisplayName("❌ extract: Engine error line becomes the exception message")
        void extract_EngineError() throws IOException {
            Path fake = script("""
                    echo 'ERROR: [youtube] dQw4w9WgXcQ: Video unavailable'
                    exit 1
                    """);

            assertThatThrownBy(() -> engine(fake.toString(), "", "", 10).extract(VIDEO_ID))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessage("Video unavailable");
        }

        @Test
        @DisplayName("❌ extract: Hanging engine is killed at the timeout")
        void extract_Timeout() throws IOException {
            Path fake = script("exec sleep 10");

            assertThatThrownBy(() -> engine(fake.toString(), "", "", 1).extract(VIDEO_ID))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessageContaining("timed out");
        }

        @Test
        @DisplayName("✅ download: Reports streams and progress and returns the produced file")
        void download_Success() throws Exception {
            Path fake = script("""
                    out=""
                    while [ $# -gt 0 ]; do
                      if [ "$1" = "-o" ]; then out="$2"; fi
                      shift
                    done
                    dir=$(dirname "$out")
                    echo "[download] Destination: $dir/Song.webm"
                    echo "[download]  50.0% of 1.00MiB at 1.00MiB/s ETA 00:01"
                    echo "[download] 100% of 1.00MiB in 00:00:01 at 1.00MiB/s"
                    printf 'audio-bytes' > "$dir/Song.webm"
                    printf 'x' > "$dir/Song.webm.part"
                    """);
            RecordingObserver observer = new RecordingObserver();
            Path target = tempDir.resolve("job/source");

            Path downloaded = engine(fake.toString(), "", "", 10)
                    .download(request(DownloadKind.AUDIO, null), target, observer);

            assertThat(downloaded).isEqualTo(target.resolve("Song.webm"));
            assertThat(observer.destinations).containsExactly(target.resolve("Song.webm").toString());
            assertThat(observer.transfers).extracting(TransferProgress::percent).containsExactly(50.0, 100.0);
            assertThat(observer.stages).containsExactly("Preparing file");
            assertThat(observer.process).isNotNull();
        }

        @Test
        @DisplayName("❌ download: Non-zero exit carries the code and output")
        void download_Failure() throws IOException {
            Path fake = script("""
                    echo 'ERROR: [youtube] dQw4w9WgXcQ: Requested format is not available'
                    exit 2
                    """);

            assertThatThrownBy(() -> engine(fake.toString(), "", "", 10)
                    .download(request(DownloadKind.VIDEO, "999"), tempDir.resolve("job"), new RecordingObserver()))
                    .isInstanceOfSatisfying(PipelineException.class, e -> {
                        assertThat(e.getExitCode()).isEqualTo(2);
                        assertThat(e.getToolOutput()).contains("Requested format is not available");
                    });
        }

        /**
         * Engine that leaves a child behind, sharing its stdout and appending to {@code heartbeat}
         * until killed, then reports progress forever.
         */
        private Path engineWithChild(Path heartbeat) throws IOException {
            return script("""
                    : > "%1$s"
                    (while true; do echo beat >> "%1$s"; sleep 0.1; done) &
                    while true; do
                      echo "[download]  10.0%% of 1.00MiB at 1.00MiB/s ETA 00:09"
                      sleep 0.1
                    done
                    """.formatted(heartbeat));
        }

        private void assertStoppedWriting(Path heartbeat) throws Exception {
            long size = Files.size(heartbeat);
            Thread.sleep(500);
            assertThat(Files.size(heartbeat)).isEqualTo(size);
        }

        @Test
        @DisplayName("✅ download: Stopping the engine from another thread also stops its children")
        void download_StoppedWithChildren() throws Exception {
            Path heartbeat = tempDir.resolve("heartbeat");
            Path fake = engineWithChild(heartbeat);
            CountDownLatch transferring = new CountDownLatch(1);
            RecordingObserver observer = new RecordingObserver() {
                @Override
                public void onTransfer(TransferProgress progress) {
                    super.onTransfer(progress);
                    transferring.countDown();
                }
            };
            SimpleAsyncTaskExecutor downloads = new SimpleAsyncTaskExecutor("engine-test-download-");

            Future<Path> download = downloads.submit(() -> engine(fake.toString(), "", "", 10)
                    .download(request(DownloadKind.VIDEO, null), tempDir.resolve("job"), observer));
            assertThat(transferring.await(10, TimeUnit.SECONDS)).isTrue();

            ProcessTrees.terminate(observer.process, Duration.ofSeconds(2));

            assertThatThrownBy(() -> download.get(15, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(PipelineException.class);
            assertThat(observer.process.isAlive()).isFalse();
            assertStoppedWriting(heartbeat);
        }

        @Test
        @DisplayName("❌ download: The timeout kills the engine and its children")
        void download_TimeoutStopsChildren() throws Exception {
            Path heartbeat = tempDir.resolve("heartbeat");
            Path fake = engineWithChild(heartbeat);
            YtDlpExtractionEngine engine = engine(fake.toString(), "", "", 10, 1);

            long started = System.nanoTime();
            assertThatThrownBy(() -> engine.download(request(DownloadKind.AUDIO, null), tempDir.resolve("job"),
                    new RecordingObserver()))
                    .isInstanceOf(PipelineException.class)
                    .hasMessageContaining("timed out");

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(15));
            assertStoppedWriting(heartbeat);
        }

        @Test
        @DisplayName("❌ download: Clean exit without a file is a failure")
        void download_NoFile() throws IOException {
            Path fake = script("echo '[youtube] nothing to do'");

            assertThatThrownBy(() -> engine(fake.toString(), "", "", 10)
                    .download(request(DownloadKind.THUMBNAIL, null), tempDir.resolve("empty"), new RecordingObserver()))
                    .isInstanceOf(PipelineException.class)
                    .hasMessageContaining("without producing a file");
        }
    }

    private static class RecordingObserver implements DownloadObserver {

        private final List<String> destinations = new CopyOnWriteArrayList<>();
        private final List<TransferProgress> transfers = new CopyOnWriteArrayList<>();
        private final List<String> stages = new CopyOnWriteArrayList<>();
        private volatile Process process;

        @Override
        public void onProcessStarted(Process process) {
            this.process = process;
        }

        @Override
        public void onStreamStarted(String destination) {
            destinations.add(destination);
        }

        @Override
        public void onTransfer(TransferProgress progress) {
            transfers.add(progress);
        }

        @Override
        public void onPostProcessing(String stage) {
            stages.add(stage);
        }
    }
}
