package com.bbthechange.rehearsalsync.exception;

/**
 * Exception thrown when a manual import or clear is requested while another one is running.
 */
public class SyncInProgressException extends RuntimeException {

    public SyncInProgressException() {
        super("A calendar import is already in progress");
    }
}
