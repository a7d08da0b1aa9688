package it.unimib.datai.handlerharness.core.transport;

public enum TransportFailure {
    /** Endpoint unreachable or the connection broke. */
    CONNECTION,
    /** No response within the invocation deadline. */
    TIMEOUT,
    /** The endpoint answered, but not with a usable response envelope. */
    PROTOCOL,
    /** The caller cancelled the run while the call was in flight. */
    CANCELLED
}
