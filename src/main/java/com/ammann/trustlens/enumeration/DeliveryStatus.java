package com.ammann.trustlens.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result classification of a single notification delivery attempt.
 *
 * <p>{@link #NOT_CONFIGURED} is an expected outcome when no webhook destination is set and
 * is not treated as a failure.
 */
public enum DeliveryStatus
{
    /** The webhook accepted the message with a 2xx response. */
    SENT("sent"),
    /** No webhook destination is configured; nothing was sent. */
    NOT_CONFIGURED("not_configured"),
    /** The webhook call errored or answered with a non-2xx status. */
    FAILED("failed");

    private final String wireName;

    DeliveryStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() { return wireName; }
}
