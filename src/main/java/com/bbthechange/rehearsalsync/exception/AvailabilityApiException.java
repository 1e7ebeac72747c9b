package com.bbthechange.rehearsalsync.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the availability backend rejects a request or cannot be reached.
 */
public class AvailabilityApiException extends RuntimeException {

    private final ErrorType errorType;

    public enum ErrorType {
        /**
         * Backend answered with a 4xx status.
         */
        REJECTED(HttpStatus.BAD_GATEWAY),

        /**
         * Backend answered with a 5xx status or could not be reached.
         */
        SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

        private final HttpStatus httpStatus;

        ErrorType(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus getHttpStatus() {
            return httpStatus;
        }
    }

    public AvailabilityApiException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public AvailabilityApiException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public HttpStatus getHttpStatus() {
        return errorType.getHttpStatus();
    }

    /**
     * Factory method for a non-2xx response.
     */
    public static AvailabilityApiException forStatus(String operation, int statusCode) {
        ErrorType type = statusCode >= 500 ? ErrorType.SERVICE_UNAVAILABLE : ErrorType.REJECTED;
        return new AvailabilityApiException(type,
                "Availability API " + operation + " failed with status " + statusCode);
    }

    /**
     * Factory method for transport or parsing failures.
     */
    public static AvailabilityApiException unavailable(String operation, Throwable cause) {
        return new AvailabilityApiException(ErrorType.SERVICE_UNAVAILABLE,
                "Availability API " + operation + " is unavailable", cause);
    }
}
