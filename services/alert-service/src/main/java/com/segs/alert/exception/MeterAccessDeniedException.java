package com.segs.alert.exception;

import java.util.UUID;

/**
 * A user asked for an alert that belongs to another meter.
 * Results in HTTP 403 Forbidden
 */
public class MeterAccessDeniedException extends AlertServiceException {

    public MeterAccessDeniedException(UUID alertId, String meterId) {
        super("METER_ACCESS_DENIED",
              String.format("Alert %s does not belong to meter %s", alertId, meterId));
    }
}
