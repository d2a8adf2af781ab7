package com.example.tubefetch.events;

import com.example.tubefetch.domain.JobState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobStatusChangedEvent Tests")
class JobStatusChangedEventTest {

    @Test
    @DisplayName("✅ Carries the transition details")
    void constructor_Success() {
        JobStatusChangedEvent event = new JobStatusChangedEvent(this, "job-1",
                JobState.QUEUED, JobState.FAILED, "Server is busy, please retry shortly");

        assertThat(event.getSource()).isSameAs(this);
        assertThat(event.getJobId()).isEqualTo("job-1");
        assertThat(event.getPreviousStatus()).isEqualTo(JobState.QUEUED);
        assertThat(event.getNewStatus()).isEqualTo(JobState.FAILED);
        assertThat(event.getMessage()).isEqualTo("Server is busy, please retry shortly");
    }

    @Test
    @DisplayName("❌ Rejects missing details")
    void constructor_NullDetails() {
        assertThatThrownBy(() -> new JobStatusChangedEvent(this, null, JobState.QUEUED, JobState.DOWNLOADING, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobStatusChangedEvent(this, "job-1", null, JobState.DOWNLOADING, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobStatusChangedEvent(this, "job-1", JobState.QUEUED, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
