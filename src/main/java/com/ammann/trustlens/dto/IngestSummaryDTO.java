/* (C)2026 */
package com.ammann.trustlens.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Summary returned after a dataset has been ingested.
 *
 * @param source source key the dataset was stored under
 * @param rows number of data rows
 * @param columns ordered column names
 */
@Schema(description = "Ingested dataset summary")
public record IngestSummaryDTO(
        @Schema(description = "Source key") String source,
        @Schema(description = "Number of data rows") int rows,
        @Schema(description = "Ordered column names") List<String> columns) {}
