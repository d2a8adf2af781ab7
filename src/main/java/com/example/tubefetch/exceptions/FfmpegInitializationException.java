package com.example.tubefetch.exceptions;

/**
 * Thrown at startup when the ffmpeg binaries cannot be located or executed.
 */
public class FfmpegInitializationException extends RuntimeException {
    public FfmpegInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
