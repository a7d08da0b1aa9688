package it.unimib.datai.handlerharness.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Response envelope of one handler invocation.
 *
 * @param status               whether the handler reached a terminal state
 * @param message              optional human-readable progress or failure message
 * @param errorCode            failure classification, verbatim as returned by the handler
 * @param callbackContext      state to echo back on the next invocation (IN_PROGRESS only)
 * @param callbackDelaySeconds minimum wait before the next invocation (IN_PROGRESS only)
 * @param resourceModel        current resource state, if the handler returned one
 * @param resourceModels       resource states returned by LIST
 * @param nextToken            LIST pagination token
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
        OperationStatus status,
        String message,
        String errorCode,
        ObjectNode callbackContext,
        Integer callbackDelaySeconds,
        JsonNode resourceModel,
        ArrayNode resourceModels,
        String nextToken
) {
    public ProgressEvent {
        Objects.requireNonNull(status, "status");
    }

    public static ProgressEvent success(JsonNode resourceModel) {
        return new ProgressEvent(OperationStatus.SUCCESS, null, null, null, null, resourceModel, null, null);
    }

    public static ProgressEvent failed(String errorCode, String message) {
        return new ProgressEvent(OperationStatus.FAILED, message, errorCode, null, null, null, null, null);
    }

    public static ProgressEvent inProgress(ObjectNode callbackContext, Integer callbackDelaySeconds) {
        return new ProgressEvent(OperationStatus.IN_PROGRESS, null, null, callbackContext, callbackDelaySeconds,
                null, null, null);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @JsonIgnore
    public Optional<HandlerErrorCode> handlerErrorCode() {
        return HandlerErrorCode.lookup(errorCode);
    }

    /**
     * The context to carry into the next invocation; an empty object when the handler sent none.
     */
    @JsonIgnore
    public ObjectNode callbackContextOrEmpty() {
        return callbackContext == null ? JsonNodeFactory.instance.objectNode() : callbackContext;
    }

    @JsonIgnore
    public int callbackDelaySecondsOrZero() {
        return callbackDelaySeconds == null ? 0 : callbackDelaySeconds;
    }
}
