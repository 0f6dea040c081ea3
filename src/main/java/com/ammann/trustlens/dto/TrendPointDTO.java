/* (C)2026 */
package com.ammann.trustlens.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Point of the null-rate / freshness trend")
/**
 * One minute of the synthetic quality trend.
 *
 * @param t minute label in {@code HH:mm} (UTC)
 * @param nullRate null rate in percent
 * @param freshnessMin minutes since last update
 */
public record TrendPointDTO(
        @Schema(description = "Minute label (HH:mm, UTC)") String t,
        @Schema(description = "Null rate in percent") double nullRate,
        @Schema(description = "Minutes since last update") int freshnessMin) {}
