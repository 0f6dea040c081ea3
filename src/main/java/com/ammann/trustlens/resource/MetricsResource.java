/* (C)2026 */
package com.ammann.trustlens.resource;

import com.ammann.trustlens.dto.MetricsCheckResponseDTO;
import com.ammann.trustlens.dto.TrendPointDTO;
import com.ammann.trustlens.properties.ApiProperties;
import com.ammann.trustlens.service.AlertTriggerService;
import com.ammann.trustlens.service.CatalogService;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
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
 * REST resource for data quality metrics.
 *
 * <p>{@code /metrics/check} computes null rate and freshness of an ingested dataset;
 * {@code /metrics/null-rate} serves the synthetic dashboard trend.
 */
@Path(ApiProperties.Metrics.BASE)
@Tag(name = "Metrics API", description = "Data quality metrics")
@Produces(MediaType.APPLICATION_JSON)
public class MetricsResource {

    private static final Logger LOG = Logger.getLogger(MetricsResource.class);

    @Inject CatalogService catalogService;

    @Inject AlertTriggerService alertTriggerService;

    @GET
    @Path(ApiProperties.Metrics.NULL_RATE)
    @Operation(
            summary = "Null Rate Trend",
            description = "Returns one null-rate/freshness point per minute of the window")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Trend points in chronological order",
                content =
                        @Content(
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = TrendPointDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid window")
    })
    public Response nullRateTrend(
            @Parameter(description = "Window such as 30min or 2h") @QueryParam("window")
                    @DefaultValue("30min")
                    String window) {
        List<TrendPointDTO> trend = catalogService.nullRateTrend(window);
        LOG.debugf("Null-rate trend for window %s: %d points", window, trend.size());
        return Response.ok(trend).build();
    }

    @GET
    @Path(ApiProperties.Metrics.CHECK)
    @Operation(
            summary = "Check Dataset Metrics",
            description =
                    "Computes the null rate and minutes since last update of an ingested source")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Metrics, or an error message if the source has no data",
                content =
                        @Content(schema = @Schema(implementation = MetricsCheckResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Unparseable updated_at values")
    })
    public Response checkMetrics(
            @Parameter(description = "Source key of an ingested dataset")
                    @QueryParam("source")
                    @DefaultValue(ApiProperties.CSV_SOURCE)
                    String source) {
        return Response.ok(alertTriggerService.checkMetrics(source)).build();
    }
}
