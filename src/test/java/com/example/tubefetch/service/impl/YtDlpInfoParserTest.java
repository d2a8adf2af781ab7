package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.ExtractedVideo;
import com.example.tubefetch.domain.FormatDescriptor;
import com.example.tubefetch.domain.MediaKind;
import com.example.tubefetch.domain.Resolution;
import com.example.tubefetch.exceptions.ExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("YtDlpInfoParser Tests")
class YtDlpInfoParserTest {

    private final YtDlpInfoParser parser = new YtDlpInfoParser(new ObjectMapper());

    private static String fixture() throws IOException {
        try (InputStream in = YtDlpInfoParserTest.class.getResourceAsStream("/fixtures/ytdlp-info.json")) {
            assertThat(in).as("fixture on classpath").isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("✅ parse: Descriptive fields, with channel as uploader fallback")
    void parse_DescriptiveFields() throws IOException {
        ExtractedVideo video = parser.parse(fixture());

        assertThat(video.title()).isEqualTo("Never Gonna Give You Up");
        assertThat(video.uploader()).isEqualTo("Rick Astley");
        assertThat(video.thumbnailUrl()).endsWith("maxresdefault.jpg");
        assertThat(video.viewCount()).isEqualTo(1_600_000_000L);
        assertThat(video.likeCount()).isEqualTo(18_000_000L);
        assertThat(video.subscriberCount()).isEqualTo(4_100_000L);
        assertThat(video.durationSeconds()).isEqualTo(213L);
    }

    @Test
    @DisplayName("✅ parse: Storyboards, URL-less and stream-less formats are dropped")
    void parse_FiltersFormats() throws IOException {
        ExtractedVideo video = parser.parse(fixture());

        assertThat(video.formats())
                .extracting(FormatDescriptor::formatId)
                .containsExactly("140", "251", "18", "137");
    }

    @Test
    @DisplayName("✅ parse: Media kinds, resolution and sizes per format")
    void parse_FormatDetails() throws IOException {
        ExtractedVideo video = parser.parse(fixture());

        FormatDescriptor audio = video.formats().get(0);
        assertThat(audio.mediaKind()).isEqualTo(MediaKind.AUDIO);
        assertThat(audio.resolution()).isNull();
        assertThat(audio.audioBitrate()).isEqualTo(129.5);
        assertThat(audio.filesizeBytes()).isEqualTo(3_449_447L);

        assertThat(video.formats().get(1).filesizeBytes()).isEqualTo(3_500_000L);

        FormatDescriptor muxed = video.formats().get(2);
        assertThat(muxed.mediaKind()).isEqualTo(MediaKind.VIDEO_AUDIO);
        assertThat(muxed.resolution()).isEqualTo(new Resolution(640, 360));

        FormatDescriptor videoOnly = video.formats().get(3);
        assertThat(videoOnly.mediaKind()).isEqualTo(MediaKind.VIDEO);
        assertThat(videoOnly.height()).isEqualTo(1080);
        assertThat(videoOnly.frameRate()).isEqualTo(25.0);
        assertThat(videoOnly.note()).isEqualTo("1080p");
    }

    @Test
    @DisplayName("⚠️ parse: A document without formats yields an empty list")
    void parse_NoFormats() {
        ExtractedVideo video = parser.parse("{\"id\":\"abc\",\"title\":\"Live\",\"uploader\":\"Someone\"}");

        assertThat(video.formats()).isEmpty();
        assertThat(video.uploader()).isEqualTo("Someone");
        assertThat(video.durationSeconds()).isNull();
    }

    @Test
    @DisplayName("❌ parse: Malformed or non-object JSON is an extraction failure")
    void parse_Malformed() {
        assertThatThrownBy(() -> parser.parse("{not json"))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Could not read video information");
        assertThatThrownBy(() -> parser.parse("[1,2]"))
                .isInstanceOf(ExtractionException.class);
    }
}
