package com.example.tubefetch.domain;

import java.nio.file.Path;

/**
 * Location and presentation details of a completed job's artifact.
 */
public record JobOutput(Path path, String filename, String mimeType, Long contentLength) {
}
