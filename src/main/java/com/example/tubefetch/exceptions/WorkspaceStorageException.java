package com.example.tubefetch.exceptions;

public class WorkspaceStorageException extends RuntimeException {
    public WorkspaceStorageException(String message) {
        super(message);
    }

    public WorkspaceStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
