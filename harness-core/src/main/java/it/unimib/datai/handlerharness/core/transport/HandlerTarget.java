package it.unimib.datai.handlerharness.core.transport;

import java.net.URI;
import java.time.Duration;

/**
 * Where and how to reach the handler under test.
 *
 * @param endpoint           base URL of the function endpoint
 * @param functionIdentity   logical function name behind the endpoint
 * @param invocationTimeout  deadline for a single invocation
 */
public record HandlerTarget(String endpoint, String functionIdentity, Duration invocationTimeout) {
    public static final String DEFAULT_ENDPOINT = "http://127.0.0.1:3001";
    public static final String DEFAULT_FUNCTION = "TestEntrypoint";
    public static final Duration DEFAULT_INVOCATION_TIMEOUT = Duration.ofSeconds(60);

    public HandlerTarget {
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = DEFAULT_ENDPOINT;
        }
        if (functionIdentity == null || functionIdentity.isBlank()) {
            functionIdentity = DEFAULT_FUNCTION;
        }
        if (invocationTimeout == null) {
            invocationTimeout = DEFAULT_INVOCATION_TIMEOUT;
        }
        if (invocationTimeout.isZero() || invocationTimeout.isNegative()) {
            throw new IllegalArgumentException("invocationTimeout must be positive: " + invocationTimeout);
        }
    }

    public static HandlerTarget defaults() {
        return new HandlerTarget(null, null, null);
    }

    public HandlerTarget(String endpoint, String functionIdentity) {
        this(endpoint, functionIdentity, null);
    }

    /**
     * Lambda Invoke API path as served by local function emulators.
     */
    public URI invokeUri() {
        String base = endpoint.endsWith("/") ? endpoint : (endpoint + "/");
        return URI.create(base).resolve("2015-03-31/functions/" + functionIdentity + "/invocations");
    }
}
