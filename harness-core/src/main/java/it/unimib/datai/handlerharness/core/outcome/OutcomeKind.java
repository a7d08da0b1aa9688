package it.unimib.datai.handlerharness.core.outcome;

/**
 * Terminal result class of a run, with the process exit status a presentation layer should use.
 */
public enum OutcomeKind {
    SUCCESS(0),
    FAILED(1),
    EXHAUSTED(3),
    ERROR(4);

    /** Exit status for configuration errors detected before any invocation. */
    public static final int CONFIGURATION_ERROR_EXIT_CODE = 2;
    /** Exit status for a run that ended with contract warnings when warnings are treated as failures. */
    public static final int CONTRACT_VIOLATION_EXIT_CODE = 5;

    private final int exitCode;

    OutcomeKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
