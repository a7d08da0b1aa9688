package it.unimib.datai.handlerharness.core;

import com.fasterxml.jackson.databind.JsonNode;
import it.unimib.datai.handlerharness.common.model.Action;
import it.unimib.datai.handlerharness.common.model.InvocationRequest;
import it.unimib.datai.handlerharness.core.loop.CancellationSignal;
import it.unimib.datai.handlerharness.core.loop.LoopSettings;
import it.unimib.datai.handlerharness.core.loop.LoopState;
import it.unimib.datai.handlerharness.core.loop.ReinvocationLoop;
import it.unimib.datai.handlerharness.core.outcome.ExitOutcome;
import it.unimib.datai.handlerharness.core.outcome.OutcomeReporter;
import it.unimib.datai.handlerharness.core.request.RequestBuilder;
import it.unimib.datai.handlerharness.core.transport.HandlerTarget;
import it.unimib.datai.handlerharness.core.transport.HttpHandlerClient;

/**
 * Runs one lifecycle action against a handler and returns its outcome.
 *
 * <p>Configuration errors (unknown action, malformed body) are thrown before any invocation;
 * everything that happens afterwards is reported through the returned {@link ExitOutcome}.
 */
public final class HandlerHarness {
    private final RequestBuilder requests;
    private final ReinvocationLoop loop;
    private final OutcomeReporter reporter;

    public HandlerHarness(HandlerTarget target, LoopSettings settings) {
        this(new RequestBuilder(), new ReinvocationLoop(new HttpHandlerClient(target), settings),
                new OutcomeReporter());
    }

    public HandlerHarness(RequestBuilder requests, ReinvocationLoop loop, OutcomeReporter reporter) {
        this.requests = requests;
        this.loop = loop;
        this.reporter = reporter;
    }

    public ExitOutcome run(String actionName, String rawBody) {
        return run(Action.fromName(actionName), rawBody, new CancellationSignal());
    }

    public ExitOutcome run(Action action, String rawBody, CancellationSignal cancellation) {
        return execute(requests.build(action, rawBody), cancellation);
    }

    public ExitOutcome run(Action action, JsonNode body) {
        return run(action, body, new CancellationSignal());
    }

    public ExitOutcome run(Action action, JsonNode body, CancellationSignal cancellation) {
        return execute(requests.build(action, body), cancellation);
    }

    private ExitOutcome execute(InvocationRequest first, CancellationSignal cancellation) {
        LoopState state = loop.run(first, cancellation);
        return reporter.report(state);
    }
}
