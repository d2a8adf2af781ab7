package com.example.tubefetch.web.dto;

import com.example.tubefetch.domain.DownloadKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record DownloadRequest(
        @NotBlank(message = "URL is required")
        @Size(max = 2048, message = "URL is too long")
        String url,

        @NotNull(message = "media_kind is required (video, audio or thumbnail)")
        DownloadKind mediaKind,

        @Pattern(regexp = "^(best|[A-Za-z0-9_-]{1,32})$", message = "selected_format_id is not a valid format id")
        String selectedFormatId
) {}
