package com.segs.alert.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert status. Acknowledgement is tracked separately on the alert,
 * so an acknowledged alert stays {@link #ACTIVE} until it is resolved.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return AlertStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }
}
