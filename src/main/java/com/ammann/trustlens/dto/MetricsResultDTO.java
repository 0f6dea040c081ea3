/* (C)2026 */
package com.ammann.trustlens.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Data quality signals computed for a dataset.
 *
 * <p>Absent values are serialized as JSON {@code null}: {@code null_rate} when the dataset
 * has no data cells, {@code minutes_since_last_update} when there is no {@code updated_at}
 * column.
 *
 * @param nullRate fraction of missing data cells, rounded to 3 decimals
 * @param minutesSinceLastUpdate whole minutes since the most recent {@code updated_at} value
 */
@Schema(description = "Data quality metrics")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record MetricsResultDTO(
        @Schema(description = "Fraction of null cells (0..1), 3 decimals", nullable = true)
                @JsonProperty("null_rate")
                Double nullRate,
        @Schema(description = "Minutes since the most recent update", nullable = true)
                @JsonProperty("minutes_since_last_update")
                Long minutesSinceLastUpdate) {}
