package com.agentic.customergraph.llm;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns LLM error responses into exceptions that keep the response body for diagnosis.
 */
public class LlmChatClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(LlmChatClientExceptionMapper.class);

    @Override
    public RuntimeException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        if (response.hasEntity()) {
            try {
                responseBody = response.readEntity(String.class);
            } catch (RuntimeException e) {
                LOG.warn("Failed to read LLM error response body", e);
            }
        }

        int status = response.getStatus();
        String statusInfo = response.getStatusInfo().getReasonPhrase();
        LOG.errorf("LLM API error %d %s: %s", status, statusInfo,
            responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty body)");

        String errorMessage = String.format(
            "LLM API returned %d %s%s",
            status,
            statusInfo,
            responseBody != null ? " - " + responseBody : ""
        );
        return new WebApplicationException(errorMessage, response);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
