package it.unimib.datai.handlerharness.core.outcome;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import it.unimib.datai.handlerharness.common.model.Action;
import it.unimib.datai.handlerharness.common.model.ProgressEvent;
import it.unimib.datai.handlerharness.core.event.ContractWarning;
import it.unimib.datai.handlerharness.core.loop.RunError;

import java.util.List;

/**
 * The single definitive result of one run.
 *
 * @param kind        result class
 * @param action      action the run performed
 * @param bearerToken correlation token of the run
 * @param invocations number of invocations issued
 * @param message     handler message of the last event, or the error description
 * @param errorCode   handler error code, verbatim (FAILED only)
 * @param resourceModel  resource model returned on success
 * @param resourceModels resource models returned by LIST
 * @param nextToken      LIST pagination token
 * @param lastEvent   last event received; for EXHAUSTED the last IN_PROGRESS event
 * @param error       transport, validation or cancellation error (ERROR only)
 * @param warnings    contract warnings observed during the run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "action", "bearerToken", "invocations", "message", "errorCode"})
public record ExitOutcome(
        OutcomeKind kind,
        Action action,
        String bearerToken,
        int invocations,
        String message,
        String errorCode,
        JsonNode resourceModel,
        JsonNode resourceModels,
        String nextToken,
        ProgressEvent lastEvent,
        RunError error,
        List<ContractWarning> warnings
) {
    public ExitOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonIgnore
    public int exitCode() {
        return kind.exitCode();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return kind == OutcomeKind.SUCCESS;
    }

    @JsonIgnore
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
