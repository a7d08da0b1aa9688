package it.unimib.datai.handlerharness.core.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Response of one invocation before status interpretation.
 *
 * @param statusCode transport status code (HTTP status for the HTTP client)
 * @param body       the response text as received
 * @param payload    the body parsed as a JSON object
 */
public record RawResponse(int statusCode, String body, ObjectNode payload) {
    public RawResponse {
        Objects.requireNonNull(payload, "payload");
    }
}
