package com.ammann.trustlens.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health classification of a monitored data source.
 */
public enum SourceStatus
{
    HEALTHY,
    WARNING,
    FAILING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
