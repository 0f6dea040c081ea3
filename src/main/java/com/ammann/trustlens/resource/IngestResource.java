/* (C)2026 */
package com.ammann.trustlens.resource;

import com.ammann.trustlens.dto.IngestSummaryDTO;
import com.ammann.trustlens.exception.ApiException;
import com.ammann.trustlens.exception.ValidationException;
import com.ammann.trustlens.properties.ApiProperties;
import com.ammann.trustlens.service.IngestService;
import com.ammann.trustlens.store.TabularStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.IOException;
import java.nio.file.Files;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

/**
 * REST resource for loading datasets into the in-memory store.
 *
 * <p>Uploaded CSV files are stored under the {@code csv} source key, the demo fixture under
 * {@code demo}. Re-ingesting a key replaces the previous dataset.
 */
@Path(ApiProperties.Ingest.BASE)
@Tag(name = "Ingest API", description = "Dataset ingestion")
@Produces(MediaType.APPLICATION_JSON)
public class IngestResource {

    private static final Logger LOG = Logger.getLogger(IngestResource.class);

    @Inject IngestService ingestService;

    @Inject TabularStore store;

    @POST
    @Path(ApiProperties.Ingest.CSV)
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Operation(
            summary = "Upload CSV",
            description = "Parses an uploaded CSV file and stores it under the 'csv' source key")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Dataset stored",
                content = @Content(schema = @Schema(implementation = IngestSummaryDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing or malformed CSV file")
    })
    public Response uploadCsv(@RestForm("file") FileUpload file) {
        if (file == null || file.uploadedFile() == null) {
            throw new ValidationException("Multipart field 'file' is required");
        }

        byte[] content;
        try {
            content = Files.readAllBytes(file.uploadedFile());
        } catch (IOException e) {
            throw new ApiException("Failed to read uploaded file " + file.fileName(), e);
        }

        LOG.debugf("CSV upload '%s' (%d bytes)", file.fileName(), content.length);
        return Response.ok(ingestService.ingestCsv(content)).build();
    }

    @GET
    @Path(ApiProperties.Ingest.DEMO)
    @Operation(
            summary = "Load Demo Dataset",
            description = "Stores a fixed three-row dataset under the 'demo' source key")
    @APIResponse(
            responseCode = "200",
            description = "Dataset stored",
            content = @Content(schema = @Schema(implementation = IngestSummaryDTO.class)))
    public Response loadDemo() {
        return Response.ok(ingestService.ingestDemo()).build();
    }

    @POST
    @Path(ApiProperties.Ingest.DEMO)
    @Operation(summary = "Load Demo Dataset (POST)", description = "Same as GET /ingest/demo")
    public Response loadDemoPost() {
        return loadDemo();
    }

    @GET
    @Path(ApiProperties.Ingest.SOURCES)
    @Operation(summary = "List Loaded Sources", description = "Returns the ingested source keys")
    public Response listSources() {
        return Response.ok(store.sourceKeys()).build();
    }
}
