package com.example.tubefetch.exceptions;

/**
 * The extraction engine could not describe the video. The message is already summarized for users.
 */
public class ExtractionException extends RuntimeException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
