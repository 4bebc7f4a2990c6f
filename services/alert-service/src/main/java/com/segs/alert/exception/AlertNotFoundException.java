package com.segs.alert.exception;

import java.util.UUID;

/**
 * Exception thrown when an alert is not found
 * Results in HTTP 404 Not Found
 */
public class AlertNotFoundException extends AlertServiceException {

    public AlertNotFoundException(UUID alertId) {
        super("ALERT_NOT_FOUND", "Alert not found with ID: " + alertId);
    }
}
