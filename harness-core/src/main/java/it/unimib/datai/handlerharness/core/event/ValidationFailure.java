package it.unimib.datai.handlerharness.core.event;

public enum ValidationFailure {
    UNKNOWN_STATUS,
    MISSING_ERROR_CODE,
    INVALID_DELAY,
    INVALID_CALLBACK_CONTEXT
}
