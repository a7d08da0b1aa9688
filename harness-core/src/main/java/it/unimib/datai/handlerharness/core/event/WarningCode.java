package it.unimib.datai.handlerharness.core.event;

public enum WarningCode {
    SUCCESS_WITH_ERROR_CODE,
    SUCCESS_WITH_CALLBACK_CONTEXT,
    FAILED_WITH_CALLBACK_CONTEXT,
    TERMINAL_WITH_CALLBACK_DELAY,
    IN_PROGRESS_WITH_ERROR_CODE,
    IN_PROGRESS_WITH_RESOURCE_MODELS,
    FAILED_WITHOUT_MESSAGE,
    UNKNOWN_ERROR_CODE,
    SYNCHRONOUS_ACTION_IN_PROGRESS,
    INVOCATION_TIME_EXCEEDED
}
