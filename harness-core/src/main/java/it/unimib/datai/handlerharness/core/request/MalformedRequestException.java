package it.unimib.datai.handlerharness.core.request;

public final class MalformedRequestException extends IllegalArgumentException {

    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
