package it.unimib.datai.handlerharness.common.model;

public enum OperationStatus {
    SUCCESS,
    FAILED,
    IN_PROGRESS;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
