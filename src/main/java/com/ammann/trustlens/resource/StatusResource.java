/* (C)2026 */
package com.ammann.trustlens.resource;

import com.ammann.trustlens.dto.DataSourceDTO;
import com.ammann.trustlens.dto.HealthResponseDTO;
import com.ammann.trustlens.properties.ApiProperties;
import com.ammann.trustlens.service.CatalogService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for the service heartbeat and the monitored data source catalog.
 */
@Path("/")
@Tag(name = "Status API", description = "Service heartbeat and data source catalog")
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    @Inject CatalogService catalogService;

    @Inject Clock clock;

    @ConfigProperty(name = "trustlens.service-name", defaultValue = "trustlens-api")
    String serviceName;

    @GET
    @Path(ApiProperties.HEALTH)
    @Operation(summary = "Service Heartbeat", description = "Reports that the service is up")
    @APIResponse(
            responseCode = "200",
            description = "Service is up",
            content = @Content(schema = @Schema(implementation = HealthResponseDTO.class)))
    public Response health() {
        return Response.ok(new HealthResponseDTO(true, serviceName, clock.instant())).build();
    }

    @GET
    @Path(ApiProperties.DataSources.BASE)
    @Operation(summary = "List Data Sources", description = "Returns the monitored data sources")
    @APIResponse(
            responseCode = "200",
            description = "Data sources",
            content =
                    @Content(
                            schema =
                                    @Schema(
                                            type = SchemaType.ARRAY,
                                            implementation = DataSourceDTO.class)))
    public Response listDataSources() {
        List<DataSourceDTO> sources = catalogService.listDataSources();
        return Response.ok(sources).build();
    }
}
