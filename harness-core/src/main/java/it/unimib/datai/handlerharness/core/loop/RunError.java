package it.unimib.datai.handlerharness.core.loop;

import com.fasterxml.jackson.annotation.JsonInclude;
import it.unimib.datai.handlerharness.core.event.ProgressEventValidationException;
import it.unimib.datai.handlerharness.core.transport.HandlerTransportException;

/**
 * Why a run ended in {@link LoopPhase#DONE_ERROR}.
 *
 * @param kind    error class
 * @param reason  finer-grained cause, e.g. the validation failure name
 * @param message human-readable description
 * @param detail  offending raw response, when one was received
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunError(RunErrorKind kind, String reason, String message, String detail) {

    public static RunError transport(HandlerTransportException e) {
        String reason = e.status() > 0 ? "HTTP_" + e.status() : e.failure().name();
        return new RunError(RunErrorKind.of(e.failure()), reason, e.getMessage(), e.body());
    }

    public static RunError validation(ProgressEventValidationException e) {
        return new RunError(RunErrorKind.VALIDATION, e.failure().name(), e.getMessage(), e.rawBody());
    }

    public static RunError cancelled(String reason) {
        return new RunError(RunErrorKind.CANCELLED, "CANCELLED", "Run cancelled: " + reason, null);
    }
}
