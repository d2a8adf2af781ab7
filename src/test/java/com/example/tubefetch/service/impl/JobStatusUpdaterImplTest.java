package com.example.tubefetch.service.impl;

import com.example.tubefetch.MutableClock;
import com.example.tubefetch.domain.DownloadJob;
import com.example.tubefetch.domain.DownloadKind;
import com.example.tubefetch.domain.JobRequest;
import com.example.tubefetch.domain.JobState;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.events.JobStatusChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobStatusUpdaterImpl Tests")
class JobStatusUpdaterImplTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private JobStatusUpdaterImpl statusUpdater;

    private DownloadJob job;

    @BeforeEach
    void setUp() {
        JobRequest request = new JobRequest("https://youtu.be/dQw4w9WgXcQ",
                new VideoIdentifier("dQw4w9WgXcQ"), DownloadKind.AUDIO, null);
        job = new DownloadJob("job-42", request, MutableClock.startingAt("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("✅ markDownloading: Moves a queued job and publishes the change")
    void markDownloading_FromQueued() {
        assertThat(statusUpdater.markDownloading(job)).isTrue();

        assertThat(job.getState()).isEqualTo(JobState.DOWNLOADING);
        verifyEventPublished(JobState.QUEUED, JobState.DOWNLOADING, null);
    }

    @Test
    @DisplayName("✅ markProcessing: Second call only refreshes the stage")
    void markProcessing_AlreadyProcessing() {
        statusUpdater.markDownloading(job);
        statusUpdater.markProcessing(job, "Merging streams");
        reset(eventPublisher);

        assertThat(statusUpdater.markProcessing(job, "Converting to MP3")).isTrue();

        assertThat(job.snapshot().stage()).isEqualTo("Converting to MP3");
        then(eventPublisher).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("✅ markCompleted: Records the output and reaches 100%")
    void markCompleted_Success() {
        statusUpdater.markDownloading(job);
        Path output = Path.of("/downloads/job-42/song.mp3");

        assertThat(statusUpdater.markCompleted(job, output)).isTrue();

        assertThat(job.snapshot().outputPath()).isEqualTo(output);
        assertThat(job.snapshot().progressPercent()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("❌ markCompleted: Null output path is rejected")
    void markCompleted_NullPath() {
        statusUpdater.markDownloading(job);

        assertThatThrownBy(() -> statusUpdater.markCompleted(job, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output path is required");
        assertThat(job.getState()).isEqualTo(JobState.DOWNLOADING);
    }

    @Test
    @DisplayName("✅ markFailed: Message travels with the event")
    void markFailed_PublishesMessage() {
        statusUpdater.markDownloading(job);
        reset(eventPublisher);

        assertThat(statusUpdater.markFailed(job, "This video is private.")).isTrue();

        assertThat(job.snapshot().error()).isEqualTo("This video is private.");
        verifyEventPublished(JobState.DOWNLOADING, JobState.FAILED, "This video is private.");
    }

    @Test
    @DisplayName("⚠️ Terminal jobs reject further transitions without publishing")
    void terminalJob_RejectsTransitions() {
        statusUpdater.markCanceled(job);
        reset(eventPublisher);

        assertThat(statusUpdater.markDownloading(job)).isFalse();
        assertThat(statusUpdater.markFailed(job, "late failure")).isFalse();
        assertThat(statusUpdater.cancelIfQueued(job)).isFalse();

        assertThat(job.getState()).isEqualTo(JobState.CANCELED);
        then(eventPublisher).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("✅ cancelIfQueued: Only applies before a worker started")
    void cancelIfQueued_OnlyWhenQueued() {
        assertThat(statusUpdater.cancelIfQueued(job)).isTrue();
        assertThat(job.getState()).isEqualTo(JobState.CANCELED);
    }

    @Test
    @DisplayName("⚠️ A failing publisher does not break the transition")
    void publisherFailure_IsContained() {
        willThrow(new IllegalStateException("listener exploded")).given(eventPublisher).publishEvent(any(JobStatusChangedEvent.class));

        assertThat(statusUpdater.markDownloading(job)).isTrue();
        assertThat(job.getState()).isEqualTo(JobState.DOWNLOADING);
    }

    private void verifyEventPublished(JobState previous, JobState status, String message) {
        ArgumentCaptor<JobStatusChangedEvent> captor = ArgumentCaptor.forClass(JobStatusChangedEvent.class);
        then(eventPublisher).should().publishEvent(captor.capture());
        JobStatusChangedEvent event = captor.getValue();
        assertThat(event.getJobId()).isEqualTo("job-42");
        assertThat(event.getPreviousStatus()).isEqualTo(previous);
        assertThat(event.getNewStatus()).isEqualTo(status);
        assertThat(event.getMessage()).isEqualTo(message);
        assertThat(event.getSource()).isEqualTo(statusUpdater);
    }
}
