package it.unimib.datai.handlerharness.core.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.handlerharness.common.model.Action;
import it.unimib.datai.handlerharness.common.model.InvocationRequest;
import it.unimib.datai.handlerharness.core.json.JsonCodec;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds the first request of a run: the caller's resource request, an empty callback
 * context and a fresh bearer token.
 */
public final class RequestBuilder {
    private final JsonCodec json;
    private final Supplier<String> bearerTokens;

    public RequestBuilder() {
        this(new JsonCodec(), () -> UUID.randomUUID().toString());
    }

    public RequestBuilder(JsonCodec json, Supplier<String> bearerTokens) {
        this.json = json;
        this.bearerTokens = bearerTokens;
    }

    public InvocationRequest build(Action action, String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new MalformedRequestException("Request body is empty");
        }
        JsonNode body;
        try {
            body = json.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return build(action, body);
    }

    /**
     * @throws it.unimib.datai.handlerharness.common.model.InvalidActionException for an unknown action name
     */
    public InvocationRequest build(String actionName, JsonNode body) {
        return build(Action.fromName(actionName), body);
    }

    public InvocationRequest build(Action action, JsonNode body) {
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (body == null || !body.isObject()) {
            String type = body == null ? "nothing" : body.getNodeType().toString();
            throw new MalformedRequestException("Request body must be a JSON object, got " + type);
        }
        return InvocationRequest.first(action, (ObjectNode) body, bearerTokens.get());
    }
}
