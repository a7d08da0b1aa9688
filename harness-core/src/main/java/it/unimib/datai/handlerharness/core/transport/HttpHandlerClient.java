package it.unimib.datai.handlerharness.core.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.handlerharness.common.model.InvocationRequest;
import it.unimib.datai.handlerharness.core.json.JsonCodec;
import it.unimib.datai.handlerharness.core.loop.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Invokes a handler through the Lambda Invoke API of a local function endpoint.
 * One instance may serve any number of concurrent runs.
 */
public final class HttpHandlerClient implements HandlerClient {
    private static final Logger log = LoggerFactory.getLogger(HttpHandlerClient.class);
    static final String FUNCTION_ERROR_HEADER = "X-Amz-Function-Error";

    private final HandlerTarget target;
    private final URI invokeUri;
    private final HttpClient http;
    private final JsonCodec json;

    public HttpHandlerClient(HandlerTarget target) {
        this(target, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build(), new JsonCodec());
    }

    // Visible for testing
    HttpHandlerClient(HandlerTarget target, HttpClient http, JsonCodec json) {
        this.target = target;
        this.invokeUri = target.invokeUri();
        this.http = http;
        this.json = json;
    }

    @Override
    public RawResponse invoke(InvocationRequest request, CancellationSignal cancellation) {
        HttpRequest req = HttpRequest.newBuilder(invokeUri)
                .header("Content-Type", "application/json")
                .header("X-Amz-Invocation-Type", "RequestResponse")
                .POST(HttpRequest.BodyPublishers.ofString(json.toJson(request)))
                .timeout(target.invocationTimeout())
                .build();

        log.debug("POST {} action={}", invokeUri, request.action());
        CompletableFuture<HttpResponse<String>> call = http.sendAsync(req, HttpResponse.BodyHandlers.ofString());
        try (CancellationSignal.Registration ignored = cancellation.onCancel(() -> call.cancel(true))) {
            return toRawResponse(call.get());
        } catch (CancellationException e) {
            throw new HandlerTransportException(TransportFailure.CANCELLED,
                    "Invocation cancelled: " + cancellation.reason());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new HandlerTransportException(TransportFailure.CANCELLED, "Interrupted while invoking handler", e);
        } catch (ExecutionException e) {
            throw classify(unwrap(e));
        }
    }

    private RawResponse toRawResponse(HttpResponse<String> resp) {
        String body = resp.body();
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new HandlerTransportException(TransportFailure.PROTOCOL,
                    "Handler endpoint returned HTTP " + resp.statusCode(), resp.statusCode(), body);
        }

        String functionError = resp.headers().firstValue(FUNCTION_ERROR_HEADER).orElse(null);
        if (functionError != null) {
            throw new HandlerTransportException(TransportFailure.PROTOCOL,
                    "Handler raised an unhandled error (" + functionError + "): " + describeFunctionError(body),
                    resp.statusCode(), body);
        }

        JsonNode payload;
        try {
            payload = json.readTree(body);
        } catch (IOException e) {
            throw new HandlerTransportException(TransportFailure.PROTOCOL,
                    "Handler response is not valid JSON", resp.statusCode(), body);
        }
        if (payload == null || !payload.isObject()) {
            throw new HandlerTransportException(TransportFailure.PROTOCOL,
                    "Handler response is not a JSON object", resp.statusCode(), body);
        }
        return new RawResponse(resp.statusCode(), body, (ObjectNode) payload);
    }

    private String describeFunctionError(String body) {
        try {
            JsonNode error = json.readTree(body);
            String type = error.path("errorType").asText("");
            String message = error.path("errorMessage").asText("");
            if (!type.isEmpty() || !message.isEmpty()) {
                return (type + " " + message).trim();
            }
        } catch (IOException e) {
            log.debug("Unhandled-error body is not JSON: {}", e.getMessage());
        }
        return body == null ? "" : body;
    }

    private HandlerTransportException classify(Throwable cause) {
        if (cause instanceof HttpConnectTimeoutException) {
            return new HandlerTransportException(TransportFailure.CONNECTION,
                    "Timed out connecting to " + invokeUri, cause);
        }
        if (cause instanceof HttpTimeoutException) {
            return new HandlerTransportException(TransportFailure.TIMEOUT,
                    "No response from " + invokeUri + " within " + target.invocationTimeout(), cause);
        }
        if (cause instanceof IOException) {
            return new HandlerTransportException(TransportFailure.CONNECTION,
                    "I/O error calling " + invokeUri + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof HandlerTransportException transport) {
            return transport;
        }
        return new HandlerTransportException(TransportFailure.PROTOCOL,
                "Unexpected failure calling " + invokeUri + ": " + cause, cause);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
