package com.agentic.customergraph.exception;

import com.agentic.customergraph.utils.SensitiveDataSanitizer;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class CustomerGraphExceptionMapper implements ExceptionMapper<CustomerGraphException> {

    private static final Logger LOG = Logger.getLogger(CustomerGraphExceptionMapper.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final CustomerGraphException exception) {
        final int status = statusOf(exception);
        if (Response.Status.Family.familyOf(status) == Response.Status.Family.SERVER_ERROR) {
            LOG.errorf(exception, "Request to %s failed at %s", uriInfo.getPath(), exception.getStage());
        }

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            titleOf(status),
            status,
            SensitiveDataSanitizer.sanitize(exception.getMessage()),
            uriInfo.getPath(),
            exception.getCustomerId(),
            exception.getExtractionId(),
            exception.getStage().name(),
            exception.getWriteOutcome().name()
        );

        return Response.status(status)
                .entity(error)
                .type("application/problem+json")
                .build();
    }

    static int statusOf(final CustomerGraphException exception) {
        if (exception instanceof MissingPrimarySubjectException || exception instanceof EmptyGraphException
                || exception instanceof InvalidSnapshotException) {
            return UNPROCESSABLE_ENTITY;
        }
        if (exception instanceof CrossCustomerViolationException) {
            return Response.Status.CONFLICT.getStatusCode();
        }
        if (exception instanceof SnapshotNotFoundException) {
            return Response.Status.NOT_FOUND.getStatusCode();
        }
        if (exception instanceof ExtractionStoreException && !exception.isRetryable()) {
            return Response.Status.CONFLICT.getStatusCode();
        }
        if (exception.isRetryable()) {
            return Response.Status.SERVICE_UNAVAILABLE.getStatusCode();
        }
        return Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
    }

    static String titleOf(final int status) {
        if (status == UNPROCESSABLE_ENTITY) {
            return "Unprocessable Entity";
        }
        final Response.Status known = Response.Status.fromStatusCode(status);
        return known != null ? known.getReasonPhrase() : "Error";
    }
}
