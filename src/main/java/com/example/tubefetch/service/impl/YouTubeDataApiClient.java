package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.PrimaryMetadata;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.exceptions.UpstreamUnavailableException;
import com.example.tubefetch.service.PrimaryMetadataSource;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * {@link PrimaryMetadataSource} backed by the YouTube Data API v3. Disabled when no API key is configured.
 */
@Service
public class YouTubeDataApiClient implements PrimaryMetadataSource {

    private static final Logger log = LoggerFactory.getLogger(YouTubeDataApiClient.class);

    private static final List<String> THUMBNAIL_PREFERENCE = List.of("maxres", "standard", "high", "medium", "default");

    private final RestClient restClient;
    private final String apiKey;

    public YouTubeDataApiClient(
            RestClient.Builder restClientBuilder,
            @Value("${youtube.api.base-url:https://www.googleapis.com/youtube/v3}") String baseUrl,
            @Value("${youtube.api.key:}") String apiKey) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
        this.apiKey = apiKey;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Optional<PrimaryMetadata> fetch(VideoIdentifier videoId) throws UpstreamUnavailableException {
        if (!isConfigured()) {
            log.debug("[DataApi][{}] No API key configured, skipping", videoId);
            return Optional.empty();
        }

        JsonNode video = firstItem(get("/videos", "snippet,statistics,contentDetails", videoId.value()));
        if (video == null) {
            log.info("[DataApi][{}] Video not known to the API", videoId);
            return Optional.empty();
        }

        JsonNode snippet = video.path("snippet");
        JsonNode statistics = video.path("statistics");
        String channelId = text(snippet, "channelId");

        String channelLogo = null;
        Long subscribers = null;
        if (channelId != null) {
            try {
                JsonNode channel = firstItem(get("/channels", "snippet,statistics", channelId));
                if (channel != null) {
                    channelLogo = bestThumbnail(channel.path("snippet").path("thumbnails"));
                    if (!channel.path("statistics").path("hiddenSubscriberCount").asBoolean(false)) {
                        subscribers = number(channel.path("statistics"), "subscriberCount");
                    }
                }
            } catch (UpstreamUnavailableException e) {
                log.warn("[DataApi][{}] Channel lookup failed, continuing without it: {}", videoId, e.getMessage());
            }
        }

        return Optional.of(new PrimaryMetadata(
                text(snippet, "title"),
                text(snippet, "channelTitle"),
                channelLogo,
                bestThumbnail(snippet.path("thumbnails")),
                number(statistics, "viewCount"),
                number(statistics, "likeCount"),
                subscribers,
                durationSeconds(text(video.path("contentDetails"), "duration"))
        ));
    }

    private JsonNode get(String path, String parts, String id) {
        try {
            return restClient.get()
                    .uri(uriBuilder -> uriBuilder.path(path)
                            .queryParam("part", parts)
                            .queryParam("id", id)
                            .queryParam("key", apiKey)
                            .build())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new UpstreamUnavailableException(
                    "Data API returned " + e.getStatusCode().value() + " for " + path, e);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("Data API call to " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static JsonNode firstItem(JsonNode response) {
        if (response == null) {
            return null;
        }
        JsonNode items = response.path("items");
        return items.isArray() && !items.isEmpty() ? items.get(0) : null;
    }

    private static String bestThumbnail(JsonNode thumbnails) {
        for (String key : THUMBNAIL_PREFERENCE) {
            String url = text(thumbnails.path(key), "url");
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    static Long durationSeconds(String isoDuration) {
        if (isoDuration == null) {
            return null;
        }
        try {
            // The API uses forms like P1DT2H3M4S and P0D, which Duration parses directly
            return Duration.parse(isoDuration).getSeconds();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable ISO-8601 duration '{}'", isoDuration);
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Statistics are returned as decimal strings.
     */
    private static Long number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        try {
            return Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
