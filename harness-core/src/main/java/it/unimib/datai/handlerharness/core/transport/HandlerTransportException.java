package it.unimib.datai.handlerharness.core.transport;

public final class HandlerTransportException extends RuntimeException {
    private final TransportFailure failure;
    private final int status;
    private final String body;

    public HandlerTransportException(TransportFailure failure, String message) {
        this(failure, message, 0, null, null);
    }

    public HandlerTransportException(TransportFailure failure, String message, Throwable cause) {
        this(failure, message, 0, null, cause);
    }

    public HandlerTransportException(TransportFailure failure, String message, int status, String body) {
        this(failure, message, status, body, null);
    }

    private HandlerTransportException(TransportFailure failure, String message, int status, String body,
                                      Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.status = status;
        this.body = body;
    }

    public TransportFailure failure() {
        return failure;
    }

    /**
     * HTTP status of the offending response, 0 when no response was received.
     */
    public int status() {
        return status;
    }

    public String body() {
        return body;
    }
}
