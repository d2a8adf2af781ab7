package com.example.tubefetch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QualitySource {
    PLAYER_PROBE,
    EXTRACTION_PROBE,
    UNAVAILABLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
