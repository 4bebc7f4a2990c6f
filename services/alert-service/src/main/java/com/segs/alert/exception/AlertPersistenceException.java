package com.segs.alert.exception;

/**
 * The alert store could not read or write a record.
 * Results in HTTP 500 Internal Server Error
 */
public class AlertPersistenceException extends AlertServiceException {

    public AlertPersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", message, cause);
    }
}
