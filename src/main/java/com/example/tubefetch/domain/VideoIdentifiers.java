package com.example.tubefetch.domain;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the video token from the URL shapes users paste: watch pages, youtu.be short links,
 * embeds, shorts and live streams. Patterns are tried in order and the first capture wins.
 */
public final class VideoIdentifiers {

    private static final String TOKEN = "([A-Za-z0-9_-]{11})(?![A-Za-z0-9_-])";
    private static final String SCHEME = "^(?:https?://)?";
    private static final String YOUTUBE_HOST = "(?:(?:www|m|music)\\.)?(?:youtube\\.com|youtube-nocookie\\.com)";

    private static final List<Pattern> URL_SHAPES = List.of(
            // watch?v=ID, v may appear after other query parameters
            Pattern.compile(SCHEME + YOUTUBE_HOST + "/watch/?\\?(?:[^#\\s]*&)?v=" + TOKEN, Pattern.CASE_INSENSITIVE),
            Pattern.compile(SCHEME + "(?:www\\.)?youtu\\.be/" + TOKEN, Pattern.CASE_INSENSITIVE),
            Pattern.compile(SCHEME + YOUTUBE_HOST + "/(?:embed|v)/" + TOKEN, Pattern.CASE_INSENSITIVE),
            Pattern.compile(SCHEME + YOUTUBE_HOST + "/shorts/" + TOKEN, Pattern.CASE_INSENSITIVE),
            Pattern.compile(SCHEME + YOUTUBE_HOST + "/live/" + TOKEN, Pattern.CASE_INSENSITIVE)
    );

    private VideoIdentifiers() {
    }

    public static Optional<VideoIdentifier> extract(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String candidate = url.trim();
        for (Pattern shape : URL_SHAPES) {
            Matcher matcher = shape.matcher(candidate);
            if (matcher.find()) {
                return Optional.of(new VideoIdentifier(matcher.group(1)));
            }
        }
        return Optional.empty();
    }
}
