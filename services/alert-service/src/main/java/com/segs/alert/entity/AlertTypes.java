package com.segs.alert.entity;

/**
 * Alert types raised by this service. Anomaly events keep the type
 * supplied upstream.
 */
public final class AlertTypes {

    public static final String REGIONAL_OVERLOAD = "REGIONAL_OVERLOAD";
    public static final String METER_OUTAGE = "METER_OUTAGE";
    public static final String ANOMALY = "anomaly";

    private AlertTypes() {
    }
}
