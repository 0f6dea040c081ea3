/* (C)2026 */
package com.ammann.trustlens.model;

import com.ammann.trustlens.exception.ValidationException;

/**
 * Caller-supplied limits against which data quality metrics are compared.
 *
 * @param nullThreshold maximum tolerated null rate, in [0, 1]
 * @param minutesThreshold maximum tolerated minutes since the last update
 */
public record AlertThresholds(double nullThreshold, long minutesThreshold) {

    /** Default null-rate threshold (20 percent). */
    public static final double DEFAULT_NULL_THRESHOLD = 0.2;

    /** Default staleness threshold in minutes. */
    public static final long DEFAULT_MINUTES_THRESHOLD = 60;

    public AlertThresholds {
        if (Double.isNaN(nullThreshold) || nullThreshold < 0.0 || nullThreshold > 1.0) {
            throw ValidationException.invalidParameter(
                    "null_threshold", nullThreshold, "value between 0 and 1");
        }
        if (minutesThreshold < 0) {
            throw ValidationException.invalidParameter(
                    "minutes_threshold", minutesThreshold, "non-negative integer");
        }
    }

    public static AlertThresholds defaults() {
        return new AlertThresholds(DEFAULT_NULL_THRESHOLD, DEFAULT_MINUTES_THRESHOLD);
    }
}
