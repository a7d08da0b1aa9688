package it.unimib.datai.handlerharness.core.loop;

public enum LoopPhase {
    PENDING,
    RUNNING,
    CONTINUING,
    DONE_SUCCESS,
    DONE_FAILED,
    DONE_EXHAUSTED,
    DONE_ERROR;

    public boolean isTerminal() {
        return switch (this) {
            case DONE_SUCCESS, DONE_FAILED, DONE_EXHAUSTED, DONE_ERROR -> true;
            default -> false;
        };
    }
}
