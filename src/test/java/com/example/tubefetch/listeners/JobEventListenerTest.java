package com.example.tubefetch.listeners;

import com.example.tubefetch.domain.JobState;
import com.example.tubefetch.events.JobStatusChangedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("JobEventListener Unit Tests")
class JobEventListenerTest {

    private final JobEventListener jobEventListener = new JobEventListener();

    @Test
    @DisplayName("✅ handleJobStatusChange: Logs a normal transition")
    void handleJobStatusChange_Completed() {
        JobStatusChangedEvent event = new JobStatusChangedEvent(this, "job-1",
                JobState.PROCESSING, JobState.COMPLETED, null);

        assertThatCode(() -> jobEventListener.handleJobStatusChange(event)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("⚠️ handleJobStatusChange: Logs a failure with its message")
    void handleJobStatusChange_Failed() {
        JobStatusChangedEvent event = new JobStatusChangedEvent(this, "job-1",
                JobState.DOWNLOADING, JobState.FAILED, "This video is private.");

        assertThatCode(() -> jobEventListener.handleJobStatusChange(event)).doesNotThrowAnyException();
    }
}
