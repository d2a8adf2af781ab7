package com.example.tubefetch.domain;

public record ResolvedMetadata(VideoMetadata metadata, QualityResolution quality) {
}
