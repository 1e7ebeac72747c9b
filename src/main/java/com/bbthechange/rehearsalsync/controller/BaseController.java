package com.bbthechange.rehearsalsync.controller;

import com.bbthechange.rehearsalsync.exception.AvailabilityApiException;
import com.bbthechange.rehearsalsync.exception.CalendarAccessException;
import com.bbthechange.rehearsalsync.exception.CalendarEventNotFoundException;
import com.bbthechange.rehearsalsync.exception.CalendarPermissionException;
import com.bbthechange.rehearsalsync.exception.RepositoryException;
import com.bbthechange.rehearsalsync.exception.SyncInProgressException;
import com.bbthechange.rehearsalsync.exception.SyncNotConfiguredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;

/**
 * Base controller with shared error handling.
 * Maps sync failures to consistent JSON error bodies.
 */
@RestController
public abstract class BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BaseController.class);

    /**
     * Error response DTO for consistent error formatting.
     */
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final long timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = System.currentTimeMillis();
        }

        public String getError() { return error; }
        public String getMessage() { return message; }
        public long getTimestamp() { return timestamp; }
    }

    @ExceptionHandler(CalendarPermissionException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(CalendarPermissionException e) {
        logger.warn("Calendar permission denied: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(new ErrorResponse("PERMISSION_DENIED", e.getMessage()));
    }

    @ExceptionHandler(CalendarEventNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEventNotFound(CalendarEventNotFoundException e) {
        logger.debug("Calendar event not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("EVENT_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(CalendarAccessException.class)
    public ResponseEntity<ErrorResponse> handleCalendarAccess(CalendarAccessException e) {
        logger.error("Calendar access failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ErrorResponse("CALENDAR_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(AvailabilityApiException.class)
    public ResponseEntity<ErrorResponse> handleAvailabilityApi(AvailabilityApiException e) {
        logger.error("Availability API error: {}", e.getMessage(), e);
        return ResponseEntity.status(e.getHttpStatus())
            .body(new ErrorResponse(e.getErrorType().name(), e.getMessage()));
    }

    @ExceptionHandler(SyncNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleNotConfigured(SyncNotConfiguredException e) {
        logger.info("Sync not configured: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("SYNC_NOT_CONFIGURED", e.getMessage()));
    }

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(SyncInProgressException e) {
        logger.info("Sync rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("SYNC_IN_PROGRESS", e.getMessage()));
    }

    @ExceptionHandler(RepositoryException.class)
    public ResponseEntity<ErrorResponse> handleRepository(RepositoryException e) {
        logger.error("Repository error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("REPOSITORY_ERROR", "Internal server error"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        logger.warn("Method argument validation error: {}", e.getMessage());
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid input");
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }
}
