package it.unimib.datai.handlerharness.core.event;

/**
 * The handler answered with an envelope that breaks the response contract badly enough
 * that the run cannot continue.
 */
public final class ProgressEventValidationException extends RuntimeException {
    private final ValidationFailure failure;
    private final String rawBody;

    public ProgressEventValidationException(ValidationFailure failure, String message, String rawBody) {
        super(message);
        this.failure = failure;
        this.rawBody = rawBody;
    }

    public ValidationFailure failure() {
        return failure;
    }

    public String rawBody() {
        return rawBody;
    }
}
