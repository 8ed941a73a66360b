/* (C)2026 */
package com.ammann.reflectometry.exception;

import com.ammann.reflectometry.dto.ErrorResponseDTO;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.stream.Collectors;

/**
 * Global JAX-RS exception mapper that translates reduction and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Invalid requests and configuration map to 400, unreadable measurements to 422 and unsupported
 * corrections to 501. Unhandled exceptions are logged at ERROR level and returned as
 * HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ConstraintViolationException violation) {
            String message = violation.getConstraintViolations().stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            return createResponse(
                    Response.Status.BAD_REQUEST.getStatusCode(),
                    message,
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof ReductionConfigurationException) {
            LOG.warnf("Rejected configuration for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST.getStatusCode(),
                    exception.getMessage(),
                    "CONFIGURATION_ERROR",
                    path
            );
        }

        if (exception instanceof MetadataReadException) {
            LOG.debugf("Unreadable measurement for path %s: %s", path, exception.getMessage());
            return createResponse(
                    UNPROCESSABLE_ENTITY,
                    exception.getMessage(),
                    "METADATA_ERROR",
                    path
            );
        }

        if (exception instanceof UnsupportedCorrectionException unsupported) {
            LOG.warnf("Unsupported correction '%s' requested", unsupported.getCorrection());
            return createResponse(
                    Response.Status.NOT_IMPLEMENTED.getStatusCode(),
                    exception.getMessage(),
                    "UNSUPPORTED_CORRECTION",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND.getStatusCode(),
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof WebApplicationException web) {
            return createResponse(
                    web.getResponse().getStatus(),
                    exception.getMessage(),
                    "REQUEST_ERROR",
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(int status, String message, String code, String path)
    {
        ErrorResponseDTO errorResponse = new ErrorResponseDTO(message, code, path, status);
        return Response.status(status).entity(errorResponse).build();
    }
}
