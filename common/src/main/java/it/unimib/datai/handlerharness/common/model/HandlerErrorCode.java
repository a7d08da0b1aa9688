package it.unimib.datai.handlerharness.common.model;

import java.util.Optional;

/**
 * Error codes a handler may report together with a FAILED status.
 * The wire value is the constant name.
 */
public enum HandlerErrorCode {
    NotUpdatable,
    InvalidRequest,
    AccessDenied,
    InvalidCredentials,
    AlreadyExists,
    NotFound,
    ResourceConflict,
    Throttling,
    ServiceLimitExceeded,
    NotStabilized,
    GeneralServiceException,
    ServiceInternalError,
    NetworkFailure,
    InternalFailure,
    InvalidTypeConfiguration,
    HandlerInternalFailure,
    NonCompliant,
    Unknown,
    UnsupportedTarget;

    public static Optional<HandlerErrorCode> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (HandlerErrorCode value : values()) {
            if (value.name().equals(code)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
