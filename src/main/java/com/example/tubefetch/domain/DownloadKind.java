package com.example.tubefetch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the user asked to download, and the artifact each kind is converted to.
 */
public enum DownloadKind {
    VIDEO("mp4", "video/mp4", 2),
    AUDIO("mp3", "audio/mpeg", 1),
    THUMBNAIL("png", "image/png", 1);

    private final String extension;
    private final String mimeType;
    private final int expectedStreams;

    DownloadKind(String extension, String mimeType, int expectedStreams) {
        this.extension = extension;
        this.mimeType = mimeType;
        this.expectedStreams = expectedStreams;
    }

    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * Number of separate transfers the engine usually performs (video and audio are fetched apart).
     */
    public int expectedStreams() {
        return expectedStreams;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DownloadKind fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (DownloadKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported media kind: " + value);
    }
}
