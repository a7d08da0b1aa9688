package it.unimib.datai.handlerharness.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.handlerharness.common.model.HandlerErrorCode;
import it.unimib.datai.handlerharness.common.model.OperationStatus;
import it.unimib.datai.handlerharness.common.model.ProgressEvent;
import it.unimib.datai.handlerharness.core.transport.RawResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw handler response into a {@link ProgressEvent}.
 *
 * <p>Violations that leave the run without a usable next step raise
 * {@link ProgressEventValidationException}. Anything else is returned as a
 * {@link ContractWarning} next to the event.
 */
public final class ProgressEventParser {

    public ParsedProgressEvent parse(RawResponse raw) {
        ObjectNode payload = raw.payload();
        String body = raw.body();
        List<ContractWarning> warnings = new ArrayList<>();

        OperationStatus status = parseStatus(payload.get("status"), body);
        String message = textOrNull(payload.get("message"));
        String errorCode = textOrNull(payload.get("errorCode"));
        JsonNode contextNode = nullToAbsent(payload.get("callbackContext"));
        JsonNode resourceModel = nullToAbsent(payload.get("resourceModel"));
        ArrayNode resourceModels = payload.get("resourceModels") instanceof ArrayNode models ? models : null;
        String nextToken = textOrNull(payload.get("nextToken"));
        JsonNode delayNode = nullToAbsent(payload.get("callbackDelaySeconds"));

        ObjectNode callbackContext = null;
        Integer delay = null;
        switch (status) {
            case SUCCESS -> {
                if (errorCode != null) {
                    warnings.add(new ContractWarning(WarningCode.SUCCESS_WITH_ERROR_CODE,
                            "SUCCESS event carries errorCode " + errorCode));
                }
                if (contextNode != null) {
                    warnings.add(new ContractWarning(WarningCode.SUCCESS_WITH_CALLBACK_CONTEXT,
                            "SUCCESS event carries callbackContext " + contextNode));
                    callbackContext = objectOrNull(contextNode);
                }
                checkTerminalDelay(delayNode, status, warnings);
            }
            case FAILED -> {
                if (errorCode == null || errorCode.isBlank()) {
                    throw new ProgressEventValidationException(ValidationFailure.MISSING_ERROR_CODE,
                            "FAILED event without errorCode", body);
                }
                if (HandlerErrorCode.lookup(errorCode).isEmpty()) {
                    warnings.add(new ContractWarning(WarningCode.UNKNOWN_ERROR_CODE,
                            "FAILED event carries unrecognised errorCode " + errorCode));
                }
                if (contextNode != null) {
                    warnings.add(new ContractWarning(WarningCode.FAILED_WITH_CALLBACK_CONTEXT,
                            "FAILED event carries callbackContext " + contextNode));
                    callbackContext = objectOrNull(contextNode);
                }
                if (message == null || message.isBlank()) {
                    warnings.add(new ContractWarning(WarningCode.FAILED_WITHOUT_MESSAGE,
                            "FAILED event has no message"));
                }
                checkTerminalDelay(delayNode, status, warnings);
            }
            case IN_PROGRESS -> {
                callbackContext = parseCallbackContext(contextNode, body);
                delay = parseDelay(delayNode, body);
                if (errorCode != null) {
                    warnings.add(new ContractWarning(WarningCode.IN_PROGRESS_WITH_ERROR_CODE,
                            "IN_PROGRESS event carries errorCode " + errorCode));
                }
                if (resourceModels != null) {
                    warnings.add(new ContractWarning(WarningCode.IN_PROGRESS_WITH_RESOURCE_MODELS,
                            "IN_PROGRESS event carries resourceModels"));
                }
            }
        }

        ProgressEvent event = new ProgressEvent(status, message, errorCode, callbackContext, delay,
                resourceModel, resourceModels, nextToken);
        return new ParsedProgressEvent(event, warnings);
    }

    private static OperationStatus parseStatus(JsonNode node, String body) {
        if (node == null || !node.isTextual()) {
            throw new ProgressEventValidationException(ValidationFailure.UNKNOWN_STATUS,
                    "Response has no status", body);
        }
        try {
            return OperationStatus.valueOf(node.asText());
        } catch (IllegalArgumentException e) {
            throw new ProgressEventValidationException(ValidationFailure.UNKNOWN_STATUS,
                    "Unknown status '" + node.asText() + "'", body);
        }
    }

    /**
     * The context carried into the next invocation; only IN_PROGRESS needs a usable one.
     */
    private static ObjectNode parseCallbackContext(JsonNode node, String body) {
        if (node == null) {
            return null;
        }
        if (!node.isObject()) {
            throw new ProgressEventValidationException(ValidationFailure.INVALID_CALLBACK_CONTEXT,
                    "callbackContext must be a JSON object, got " + node.getNodeType(), body);
        }
        return (ObjectNode) node;
    }

    private static ObjectNode objectOrNull(JsonNode node) {
        return node instanceof ObjectNode object ? object : null;
    }

    private static Integer parseDelay(JsonNode node, String body) {
        if (node == null) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ProgressEventValidationException(ValidationFailure.INVALID_DELAY,
                    "callbackDelaySeconds must be a non-negative integer, got " + node, body);
        }
        int delay = node.intValue();
        if (delay < 0) {
            throw new ProgressEventValidationException(ValidationFailure.INVALID_DELAY,
                    "callbackDelaySeconds must be a non-negative integer, got " + delay, body);
        }
        return delay;
    }

    private static void checkTerminalDelay(JsonNode node, OperationStatus status, List<ContractWarning> warnings) {
        if (node != null && node.isNumber() && node.asDouble() > 0) {
            warnings.add(new ContractWarning(WarningCode.TERMINAL_WITH_CALLBACK_DELAY,
                    status + " event carries callbackDelaySeconds " + node.asText()));
        }
    }

    private static String textOrNull(JsonNode node) {
        JsonNode present = nullToAbsent(node);
        if (present == null) {
            return null;
        }
        return present.isValueNode() ? present.asText() : present.toString();
    }

    private static JsonNode nullToAbsent(JsonNode node) {
        return (node == null || node.isNull() || node.isMissingNode()) ? null : node;
    }
}
