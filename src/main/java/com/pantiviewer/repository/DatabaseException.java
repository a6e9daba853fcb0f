package com.pantiviewer.repository;

/**
 * Unchecked wrapper for catalog store failures that callers cannot recover from locally.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
