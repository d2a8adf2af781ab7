package com.example.tubefetch.exceptions;

public class MetadataTimeoutException extends RuntimeException {
    public MetadataTimeoutException(String message) {
        super(message);
    }
}
