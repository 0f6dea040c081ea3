/* (C)2026 */
package com.ammann.trustlens.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Response of a metrics check: either the metrics of a source or an error when the source
 * has not been ingested.
 *
 * @param source requested source key
 * @param metrics computed metrics
 * @param error error message when no dataset is loaded
 */
@Schema(description = "Metrics check result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricsCheckResponseDTO(
        @Schema(description = "Source key") String source,
        @Schema(description = "Computed metrics") MetricsResultDTO metrics,
        @Schema(description = "Error message if the source has no data") String error) {

    public static MetricsCheckResponseDTO of(String source, MetricsResultDTO metrics) {
        return new MetricsCheckResponseDTO(source, metrics, null);
    }

    public static MetricsCheckResponseDTO noData(String source) {
        return new MetricsCheckResponseDTO(null, null, noDataMessage(source));
    }

    /**
     * Message reported for a source key that has never been ingested.
     */
    public static String noDataMessage(String source) {
        return String.format("No data loaded for source '%s'", source);
    }
}
