package com.ammann.trustlens.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Handles validation, dataset parse and not-found errors. Other JAX-RS client errors
 * (405, 415, ...) keep their status. Unhandled exceptions are logged at ERROR level and
 * returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof DatasetParseException parseException) {
            LOG.debugf("Dataset parse error for path %s: %s", path, exception.getMessage());
            ErrorResponse errorResponse = new ErrorResponse(
                    "PARSE_ERROR",
                    exception.getMessage(),
                    path,
                    Response.Status.BAD_REQUEST.getStatusCode());
            errorResponse.row = parseException.getRow();
            errorResponse.column = parseException.getColumn();
            return Response.status(Response.Status.BAD_REQUEST).entity(errorResponse).build();
        }

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof WebApplicationException webException
                && webException.getResponse() != null
                && webException.getResponse().getStatus() < 500) {
            int statusCode = webException.getResponse().getStatus();
            Response.Status status = Response.Status.fromStatusCode(statusCode);
            LOG.debugf("Request rejected with HTTP %d for path %s: %s", statusCode, path, exception.getMessage());
            ErrorResponse errorResponse = new ErrorResponse(
                    status != null ? status.name() : "CLIENT_ERROR",
                    exception.getMessage(),
                    path,
                    statusCode);
            return Response.status(statusCode).entity(errorResponse).build();
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }


    /**
     * Structured error response body returned to API clients.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse
    {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;
        public Integer row;
        public String column;

        public ErrorResponse(String code, String message)
        {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status)
        {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
