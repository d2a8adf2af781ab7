package com.example.tubefetch.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * The submitted URL does not match any accepted video URL shape.
 */
public class InvalidVideoUrlException extends ResponseStatusException {

    public static final String MESSAGE = "Invalid YouTube URL";

    public InvalidVideoUrlException() {
        super(HttpStatus.BAD_REQUEST, MESSAGE);
    }
}
