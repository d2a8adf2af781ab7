package com.example.tubefetch.exceptions;

/**
 * The structured metadata API is down, unauthorized or over quota.
 * Callers fall back to the extraction engine instead of surfacing this.
 */
public class UpstreamUnavailableException extends RuntimeException {
    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
