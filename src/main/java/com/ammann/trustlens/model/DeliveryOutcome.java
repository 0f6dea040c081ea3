/* (C)2026 */
package com.ammann.trustlens.model;

import com.ammann.trustlens.enumeration.DeliveryStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of a single notification delivery attempt.
 *
 * @param status delivery classification
 * @param httpStatus HTTP status returned by the webhook, if a response was received
 * @param detail human-readable detail for non-successful outcomes
 */
@Schema(description = "Result of a notification delivery attempt")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryOutcome(
        @Schema(description = "Delivery status") DeliveryStatus status,
        @Schema(description = "HTTP status code returned by the webhook") Integer httpStatus,
        @Schema(description = "Additional detail for failed or skipped deliveries") String detail) {

    public static DeliveryOutcome sent(int httpStatus) {
        return new DeliveryOutcome(DeliveryStatus.SENT, httpStatus, null);
    }

    public static DeliveryOutcome notConfigured() {
        return new DeliveryOutcome(
                DeliveryStatus.NOT_CONFIGURED, null, "No notification webhook configured");
    }

    public static DeliveryOutcome failed(Integer httpStatus, String detail) {
        return new DeliveryOutcome(DeliveryStatus.FAILED, httpStatus, detail);
    }

    public boolean delivered() {
        return status == DeliveryStatus.SENT;
    }
}
