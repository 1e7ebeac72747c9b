package com.bbthechange.rehearsalsync.exception;

/**
 * Exception thrown when the mapping store cannot be read or written.
 * Wraps lower-level storage and serialization exceptions.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
