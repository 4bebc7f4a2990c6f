package com.segs.alert.exception;

/**
 * A lifecycle call is missing a required field.
 * Results in HTTP 400 Bad Request
 */
public class AlertValidationException extends AlertServiceException {

    public AlertValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }

    public static AlertValidationException missing(String field) {
        return new AlertValidationException(field + " is required");
    }
}
