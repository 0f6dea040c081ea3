/* (C)2026 */
package com.ammann.trustlens.dto;

import com.ammann.trustlens.enumeration.DeliveryStatus;
import com.ammann.trustlens.model.DeliveryOutcome;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Response of the test notification endpoint.
 *
 * @param status delivery status of the test message
 * @param message the message that was sent
 * @param delivery full delivery outcome
 */
@Schema(description = "Test notification result")
public record TestAlertResponseDTO(
        @Schema(description = "Delivery status") DeliveryStatus status,
        @Schema(description = "Message that was sent") String message,
        @Schema(description = "Delivery outcome") DeliveryOutcome delivery) {}
