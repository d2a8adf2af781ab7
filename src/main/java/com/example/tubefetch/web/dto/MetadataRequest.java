package com.example.tubefetch.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param playerQuality quality tier reported by the caller's own embedded player, if it ran one
 */
public record MetadataRequest(
        @NotBlank(message = "URL is required")
        @Size(max = 2048, message = "URL is too long")
        String url,

        @Size(max = 32, message = "player_quality is too long")
        String playerQuality
) {}
