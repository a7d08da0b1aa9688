package it.unimib.datai.handlerharness.core.event;

/**
 * A response detail that violates the handler contract without stopping the run.
 *
 * @param invocation 1-based invocation the warning was observed on, 0 if not yet attributed
 */
public record ContractWarning(WarningCode code, String message, int invocation) {

    public ContractWarning(WarningCode code, String message) {
        this(code, message, 0);
    }

    public ContractWarning atInvocation(int invocation) {
        return new ContractWarning(code, message, invocation);
    }
}
