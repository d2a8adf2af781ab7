package com.example.tubefetch.domain;

/**
 * An entry the user can pick before starting a download.
 *
 * @param synthetic true for the pinned "best" entry that lets the engine choose
 */
public record SelectableFormat(
        String formatId,
        String label,
        Integer height,
        Double frameRate,
        String container,
        boolean synthetic
) {
}
