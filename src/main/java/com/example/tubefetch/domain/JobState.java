package com.example.tubefetch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a download job. Transitions only move forward; terminal states accept nothing.
 */
public enum JobState {
    QUEUED,
    DOWNLOADING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELED;

    private static final Set<JobState> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(JobState next) {
        return switch (this) {
            case QUEUED -> next == DOWNLOADING || next == FAILED || next == CANCELED;
            case DOWNLOADING -> next == PROCESSING || next == COMPLETED || next == FAILED || next == CANCELED;
            case PROCESSING -> next == COMPLETED || next == FAILED || next == CANCELED;
            case COMPLETED, FAILED, CANCELED -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
