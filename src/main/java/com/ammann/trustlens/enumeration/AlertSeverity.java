package com.ammann.trustlens.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a recorded alert.
 */
public enum AlertSeverity
{
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
