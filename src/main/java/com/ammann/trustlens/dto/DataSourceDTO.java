/* (C)2026 */
package com.ammann.trustlens.dto;

import com.ammann.trustlens.enumeration.SourceStatus;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Monitored data source")
/**
 * Catalog entry for a monitored data source.
 *
 * @param id source identifier
 * @param name display name
 * @param type connector type (postgres, api, s3, ...)
 * @param status current health classification
 * @param lastRun time of the last monitoring run
 */
public record DataSourceDTO(
        @Schema(description = "Source identifier") String id,
        @Schema(description = "Display name") String name,
        @Schema(description = "Connector type") String type,
        @Schema(description = "Health status", enumeration = {"healthy", "warning", "failing"})
                SourceStatus status,
        @Schema(description = "Time of the last monitoring run") Instant lastRun) {}
