package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.ExtractedVideo;
import com.example.tubefetch.domain.FormatDescriptor;
import com.example.tubefetch.domain.MediaKind;
import com.example.tubefetch.domain.Resolution;
import com.example.tubefetch.exceptions.ExtractionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the JSON document printed by {@code yt-dlp --dump-json} into an {@link ExtractedVideo}.
 * Formats without a URL or container, formats with neither audio nor video, and storyboard
 * images are dropped.
 */
@Component
public class YtDlpInfoParser {

    private static final Logger log = LoggerFactory.getLogger(YtDlpInfoParser.class);
    private static final String NO_CODEC = "none";
    private static final String STORYBOARD_EXTENSION = "mhtml";

    private final ObjectMapper objectMapper;

    public YtDlpInfoParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractedVideo parse(String json) throws ExtractionException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Could not read video information", e);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionException("Could not read video information");
        }

        List<FormatDescriptor> formats = new ArrayList<>();
        JsonNode formatNodes = root.path("formats");
        if (formatNodes.isArray()) {
            for (JsonNode node : formatNodes) {
                FormatDescriptor format = toFormat(node);
                if (format != null) {
                    formats.add(format);
                }
            }
        }
        log.debug("Parsed {} usable formats out of {} reported for '{}'",
                formats.size(), formatNodes.size(), text(root, "id"));

        String uploader = text(root, "uploader");
        if (uploader == null) {
            uploader = text(root, "channel");
        }
        return new ExtractedVideo(
                text(root, "title"),
                uploader,
                text(root, "thumbnail"),
                longValue(root, "view_count"),
                longValue(root, "like_count"),
                longValue(root, "channel_follower_count"),
                longValue(root, "duration"),
                formats
        );
    }

    private FormatDescriptor toFormat(JsonNode node) {
        String formatId = text(node, "format_id");
        String url = text(node, "url");
        String ext = text(node, "ext");
        if (formatId == null || url == null || ext == null || STORYBOARD_EXTENSION.equals(ext)) {
            return null;
        }
        String vcodec = text(node, "vcodec");
        String acodec = text(node, "acodec");
        Integer width = intValue(node, "width");
        Integer height = intValue(node, "height");

        boolean hasVideo = vcodec != null ? !NO_CODEC.equals(vcodec) : (height != null && height > 0);
        boolean hasAudio = acodec != null && !NO_CODEC.equals(acodec);
        if (!hasVideo && !hasAudio) {
            return null;
        }
        MediaKind kind = hasVideo && hasAudio ? MediaKind.VIDEO_AUDIO : hasVideo ? MediaKind.VIDEO : MediaKind.AUDIO;

        Resolution resolution = null;
        if (hasVideo && height != null && height > 0) {
            resolution = new Resolution(width != null ? width : 0, height);
        }
        Long size = longValue(node, "filesize");
        if (size == null) {
            size = longValue(node, "filesize_approx");
        }
        return new FormatDescriptor(
                formatId,
                kind,
                resolution,
                doubleValue(node, "fps"),
                ext,
                text(node, "format_note"),
                size,
                doubleValue(node, "abr")
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Long longValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }

    private static Integer intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    private static Double doubleValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}
