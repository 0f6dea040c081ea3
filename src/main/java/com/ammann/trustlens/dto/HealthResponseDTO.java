/* (C)2026 */
package com.ammann.trustlens.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Service heartbeat payload.
 *
 * @param ok always {@code true} when the service answers
 * @param service service name
 * @param time server time of the response
 */
@Schema(description = "Service heartbeat")
public record HealthResponseDTO(
        @Schema(description = "Whether the service is responding") boolean ok,
        @Schema(description = "Service name") String service,
        @Schema(description = "Server time (ISO-8601)") Instant time) {}
