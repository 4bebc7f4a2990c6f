package com.segs.alert.exception;

/**
 * Base exception for all alert service exceptions.
 * Carries a stable error code that ends up in the HTTP error body.
 */
public class AlertServiceException extends RuntimeException {

    private final String errorCode;

    public AlertServiceException(String message) {
        super(message);
        this.errorCode = "ALERT_SERVICE_ERROR";
    }

    public AlertServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AlertServiceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
