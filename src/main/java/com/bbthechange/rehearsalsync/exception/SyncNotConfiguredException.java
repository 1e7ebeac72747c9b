package com.bbthechange.rehearsalsync.exception;

/**
 * Exception thrown when a sync operation is requested before the user has configured it,
 * e.g. no export calendar selected or import not enabled.
 */
public class SyncNotConfiguredException extends RuntimeException {

    public SyncNotConfiguredException(String message) {
        super(message);
    }
}
