package it.unimib.datai.handlerharness.common.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Payload of one handler invocation.
 *
 * <p>{@code callbackContext} is empty on the first invocation of a run and is replaced
 * wholesale by the context the handler returned on the previous one. {@code bearerToken}
 * is the same for every invocation of a run.
 */
@JsonPropertyOrder({"action", "bearerToken", "resourceRequest", "callbackContext"})
public record InvocationRequest(
        Action action,
        ObjectNode resourceRequest,
        ObjectNode callbackContext,
        String bearerToken
) {
    public InvocationRequest {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resourceRequest, "resourceRequest");
        Objects.requireNonNull(bearerToken, "bearerToken");
        if (callbackContext == null) {
            callbackContext = JsonNodeFactory.instance.objectNode();
        }
    }

    public static InvocationRequest first(Action action, ObjectNode resourceRequest, String bearerToken) {
        return new InvocationRequest(action, resourceRequest, JsonNodeFactory.instance.objectNode(), bearerToken);
    }

    public InvocationRequest withCallbackContext(ObjectNode context) {
        return new InvocationRequest(action, resourceRequest, context, bearerToken);
    }
}
