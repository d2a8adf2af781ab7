package com.example.tubefetch.domain;

/**
 * One downloadable variant as reported by the extraction engine.
 *
 * @param formatId      engine-assigned opaque id, passed back verbatim when downloading
 * @param resolution    null for audio-only formats
 * @param frameRate     null when the engine did not report it
 * @param audioBitrate  average audio bitrate in kbit/s, null when unknown
 */
public record FormatDescriptor(
        String formatId,
        MediaKind mediaKind,
        Resolution resolution,
        Double frameRate,
        String container,
        String note,
        Long filesizeBytes,
        Double audioBitrate
) {

    public Integer height() {
        return resolution != null ? resolution.height() : null;
    }

    public boolean isAudioOnly() {
        return mediaKind == MediaKind.AUDIO;
    }
}
