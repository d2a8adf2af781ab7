package com.example.tubefetch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which upstream produced the descriptive metadata of a {@link VideoMetadata}.
 */
public enum InfoSource {
    PRIMARY_API,
    EXTRACTION_ENGINE,
    EXTRACTION_ENGINE_DEGRADED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
