/* (C)2026 */
package com.ammann.trustlens.dto;

import com.ammann.trustlens.enumeration.AlertSeverity;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Recorded alert")
/**
 * Entry of the alert history.
 *
 * @param id alert identifier
 * @param severity alert severity
 * @param message alert text
 * @param createdAt creation time
 */
public record AlertRecordDTO(
        @Schema(description = "Alert identifier") int id,
        @Schema(description = "Severity", enumeration = {"low", "medium", "high"})
                AlertSeverity severity,
        @Schema(description = "Alert text") String message,
        @Schema(description = "Creation time") @JsonProperty("created_at") Instant createdAt) {}
