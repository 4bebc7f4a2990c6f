package com.segs.alert.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity. Serialized in lowercase on the wire.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
