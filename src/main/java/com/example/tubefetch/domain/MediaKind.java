package com.example.tubefetch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which streams a single downloadable format carries.
 */
public enum MediaKind {
    VIDEO("video"),
    AUDIO("audio"),
    VIDEO_AUDIO("video+audio");

    private final String wireName;

    MediaKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean hasVideo() {
        return this != AUDIO;
    }

    public boolean hasAudio() {
        return this != VIDEO;
    }
}
