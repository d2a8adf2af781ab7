package com.example.tubefetch.domain;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validated 11-character YouTube video token.
 */
public record VideoIdentifier(String value) {

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_-]{11}");
    private static final String WATCH_URL_PREFIX = "https://www.youtube.com/watch?v=";

    public VideoIdentifier {
        Objects.requireNonNull(value, "Video identifier cannot be null");
        if (!TOKEN.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a valid video identifier: " + value);
        }
    }

    /**
     * Canonical watch URL used for every upstream call, whatever shape the user submitted.
     */
    public String watchUrl() {
        return WATCH_URL_PREFIX + value;
    }

    @Override
    public String toString() {
        return value;
    }
}
