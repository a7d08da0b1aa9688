package it.unimib.datai.handlerharness.core.loop;

import it.unimib.datai.handlerharness.core.transport.TransportFailure;

public enum RunErrorKind {
    CONNECTION,
    TIMEOUT,
    PROTOCOL,
    VALIDATION,
    CANCELLED;

    static RunErrorKind of(TransportFailure failure) {
        return switch (failure) {
            case CONNECTION -> CONNECTION;
            case TIMEOUT -> TIMEOUT;
            case PROTOCOL -> PROTOCOL;
            case CANCELLED -> CANCELLED;
        };
    }
}
