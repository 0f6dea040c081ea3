/* (C)2026 */
package com.ammann.trustlens.dto;

import com.ammann.trustlens.enumeration.DeliveryStatus;
import com.ammann.trustlens.model.DeliveryOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of an alert trigger request.
 *
 * <p>Exactly one of three shapes is produced: alerts raised (with the delivery outcome),
 * all clear (empty alert list, no delivery) or an error for an unknown source.
 *
 * @param source evaluated source key
 * @param alerts raised alert messages, in evaluation order
 * @param status {@value #ALERTS_RAISED} or {@value #ALL_GOOD}
 * @param slack delivery status of the notification
 * @param delivery full delivery outcome
 * @param error error message for an unknown source
 */
@Schema(description = "Alert trigger result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertTriggerResponseDTO(
        @Schema(description = "Source key") String source,
        @Schema(description = "Raised alerts") List<String> alerts,
        @Schema(description = "Evaluation status") String status,
        @Schema(description = "Notification delivery status") DeliveryStatus slack,
        @Schema(description = "Notification delivery outcome") DeliveryOutcome delivery,
        @Schema(description = "Error message if the source has no data") String error) {

    public static final String ALERTS_RAISED = "alerts raised";
    public static final String ALL_GOOD = "all good";

    public static AlertTriggerResponseDTO raised(
            String source, List<String> alerts, DeliveryOutcome delivery) {
        return new AlertTriggerResponseDTO(
                source, List.copyOf(alerts), ALERTS_RAISED, delivery.status(), delivery, null);
    }

    public static AlertTriggerResponseDTO allGood(String source) {
        return new AlertTriggerResponseDTO(source, List.of(), ALL_GOOD, null, null, null);
    }

    public static AlertTriggerResponseDTO noData(String source) {
        return new AlertTriggerResponseDTO(
                null, null, null, null, null, MetricsCheckResponseDTO.noDataMessage(source));
    }
}
