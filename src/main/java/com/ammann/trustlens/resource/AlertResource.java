/* (C)2026 */
package com.ammann.trustlens.resource;

import com.ammann.trustlens.dto.AlertRecordDTO;
import com.ammann.trustlens.dto.AlertTriggerResponseDTO;
import com.ammann.trustlens.dto.TestAlertResponseDTO;
import com.ammann.trustlens.model.AlertThresholds;
import com.ammann.trustlens.properties.ApiProperties;
import com.ammann.trustlens.service.AlertTriggerService;
import com.ammann.trustlens.service.CatalogService;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for the alert history and for evaluating and delivering alerts.
 *
 * <p>Trigger thresholds default to {@code trustlens.alerts.default-null-threshold} and
 * {@code trustlens.alerts.default-minutes-threshold} when not supplied.
 */
@Path(ApiProperties.Alerts.BASE)
@Tag(name = "Alerts API", description = "Alert history, evaluation and notification")
@Produces(MediaType.APPLICATION_JSON)
public class AlertResource {

    private static final Logger LOG = Logger.getLogger(AlertResource.class);

    @Inject CatalogService catalogService;

    @Inject AlertTriggerService alertTriggerService;

    @ConfigProperty(name = "trustlens.alerts.default-null-threshold", defaultValue = "0.2")
    double defaultNullThreshold;

    @ConfigProperty(name = "trustlens.alerts.default-minutes-threshold", defaultValue = "60")
    long defaultMinutesThreshold;

    @GET
    @Operation(summary = "List Alerts", description = "Returns up to 'limit' recorded alerts")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Alerts retrieved successfully",
                content =
                        @Content(
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = AlertRecordDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid limit")
    })
    public Response listAlerts(
            @Parameter(description = "Maximum number of alerts to return")
                    @QueryParam("limit")
                    @DefaultValue("20")
                    int limit) {
        List<AlertRecordDTO> alerts = catalogService.listAlerts(limit);
        return Response.ok(alerts).build();
    }

    @POST
    @Path(ApiProperties.Alerts.TRIGGER)
    @Operation(
            summary = "Trigger Alert Evaluation",
            description =
                    "Computes the metrics of an ingested source, evaluates the alert thresholds and"
                            + " sends a notification when any alert fires")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Evaluation result (alerts, all clear, or unknown source)",
                content =
                        @Content(schema = @Schema(implementation = AlertTriggerResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid thresholds or unparseable data")
    })
    public Response triggerAlert(
            @Parameter(description = "Source key of an ingested dataset")
                    @QueryParam("source")
                    @DefaultValue(ApiProperties.CSV_SOURCE)
                    String source,
            @Parameter(description = "Null-rate threshold (0..1)") @QueryParam("null_threshold")
                    Double nullThreshold,
            @Parameter(description = "Staleness threshold in minutes")
                    @QueryParam("minutes_threshold")
                    Long minutesThreshold) {

        AlertThresholds thresholds =
                new AlertThresholds(
                        nullThreshold != null ? nullThreshold : defaultNullThreshold,
                        minutesThreshold != null ? minutesThreshold : defaultMinutesThreshold);

        LOG.debugf("Alert trigger request: source=%s, thresholds=%s", source, thresholds);
        AlertTriggerResponseDTO result = alertTriggerService.trigger(source, thresholds);
        return Response.ok(result).build();
    }

    @POST
    @Path(ApiProperties.Alerts.TEST)
    @Operation(
            summary = "Send Test Alert",
            description = "Sends a fixed test message through the notification webhook")
    @APIResponse(
            responseCode = "200",
            description = "Delivery outcome of the test message",
            content = @Content(schema = @Schema(implementation = TestAlertResponseDTO.class)))
    public Response testAlert() {
        return Response.ok(alertTriggerService.sendTestAlert()).build();
    }
}
