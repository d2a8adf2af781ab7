package com.example.tubefetch.service.impl;

import com.example.tubefetch.exceptions.PipelineException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw tool failures into short messages that are safe to show users: known failure causes get
 * a friendly sentence, anything else keeps the engine's own error line with URLs and file paths
 * masked.
 */
public final class ErrorSummaries {

    static final String GENERIC_MESSAGE = "Download failed. Please try again later.";
    static final String NO_ENGINE_OUTPUT = "The extraction engine returned no information for this video.";

    private static final int MAX_LENGTH = 200;
    private static final Pattern URL = Pattern.compile("\\b[a-zA-Z][a-zA-Z0-9+.-]*://\\S+");
    private static final Pattern PATH = Pattern.compile("(?:[A-Za-z]:)?[\\\\/][^\\s'\"]*[\\\\/][^\\s'\"]*");
    private static final Pattern ERROR_PREFIX = Pattern.compile("^ERROR:\\s*(?:\\[[^\\]]+]\\s*)?(?:[A-Za-z0-9_-]{11}:\\s*)?");

    private static final Map<String, String> KNOWN_CAUSES = new LinkedHashMap<>();

    static {
        KNOWN_CAUSES.put("private video", "This video is private.");
        KNOWN_CAUSES.put("confirm your age", "This video is age-restricted and cannot be downloaded.");
        KNOWN_CAUSES.put("not a bot", "YouTube asked for a sign-in check. Please try again later.");
        KNOWN_CAUSES.put("members-only", "This video is available to channel members only.");
        KNOWN_CAUSES.put("video unavailable", "This video is not available.");
        KNOWN_CAUSES.put("not available in your country", "This video is not available in the server's region.");
        KNOWN_CAUSES.put("requested format is not available", "The selected format is no longer available. Please choose another one.");
        KNOWN_CAUSES.put("http error 403", "YouTube refused access to the video stream. Please try again.");
        KNOWN_CAUSES.put("http error 429", "Too many requests to YouTube. Please wait a moment and try again.");
        KNOWN_CAUSES.put("no space left", "The server ran out of disk space.");
        KNOWN_CAUSES.put("timed out", "The operation took too long. Please try again.");
        KNOWN_CAUSES.put("ffmpeg", "Converting the downloaded file failed.");
    }

    private ErrorSummaries() {
    }

    public static String summarize(Throwable failure) {
        StringBuilder text = new StringBuilder();
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current.getMessage() != null) {
                text.append(current.getMessage()).append('\n');
            }
            if (current instanceof PipelineException pipeline && pipeline.getToolOutput() != null) {
                text.append(pipeline.getToolOutput()).append('\n');
            }
        }
        return summarize(text.toString());
    }

    public static String summarize(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return GENERIC_MESSAGE;
        }
        String lower = rawText.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> cause : KNOWN_CAUSES.entrySet()) {
            if (lower.contains(cause.getKey())) {
                return cause.getValue();
            }
        }
        String engineLine = lastEngineError(rawText);
        return engineLine != null ? engineLine : GENERIC_MESSAGE;
    }

    /**
     * The engine's last {@code ERROR:} line without its prefix, masked, or a fixed message if there is none.
     */
    public static String engineMessage(String output) {
        String engineLine = lastEngineError(output);
        if (engineLine != null) {
            return engineLine;
        }
        return NO_ENGINE_OUTPUT;
    }

    static String mask(String text) {
        String masked = URL.matcher(text).replaceAll("<url>");
        masked = PATH.matcher(masked).replaceAll("<file>");
        if (masked.length() > MAX_LENGTH) {
            masked = masked.substring(0, MAX_LENGTH - 3) + "...";
        }
        return masked.trim();
    }

    private static String lastEngineError(String output) {
        if (output == null) {
            return null;
        }
        String found = null;
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("ERROR:")) {
                found = trimmed;
            }
        }
        if (found == null) {
            return null;
        }
        String message = mask(ERROR_PREFIX.matcher(found).replaceFirst(""));
        return message.isEmpty() ? null : message;
    }
}
