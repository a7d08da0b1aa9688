package it.unimib.datai.handlerharness.core.loop;

import it.unimib.datai.handlerharness.common.model.Action;
import it.unimib.datai.handlerharness.common.model.InvocationRequest;
import it.unimib.datai.handlerharness.common.model.ProgressEvent;
import it.unimib.datai.handlerharness.core.event.ContractWarning;
import it.unimib.datai.handlerharness.core.event.ParsedProgressEvent;
import it.unimib.datai.handlerharness.core.event.ProgressEventParser;
import it.unimib.datai.handlerharness.core.event.ProgressEventValidationException;
import it.unimib.datai.handlerharness.core.event.WarningCode;
import it.unimib.datai.handlerharness.core.transport.HandlerClient;
import it.unimib.datai.handlerharness.core.transport.HandlerTransportException;
import it.unimib.datai.handlerharness.core.transport.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drives one logical operation to a terminal outcome by invoking the handler until it
 * reports SUCCESS or FAILED, the re-invocation budget is spent, or an error occurs.
 *
 * <p>Invocations of a run are strictly sequential. Each IN_PROGRESS response hands its
 * callback context, unchanged, to the next invocation, after waiting the requested delay.
 * Transport failures are not retried.
 *
 * <p>A loop instance holds no per-run state and may drive several runs concurrently.
 */
public final class ReinvocationLoop {
    private static final Logger log = LoggerFactory.getLogger(ReinvocationLoop.class);
    static final String MDC_BEARER_TOKEN = "bearerToken";
    static final String MDC_ACTION = "action";

    private final HandlerClient client;
    private final ProgressEventParser parser;
    private final Sleeper sleeper;
    private final Clock clock;
    private final LoopSettings settings;

    public ReinvocationLoop(HandlerClient client, LoopSettings settings) {
        this(client, new ProgressEventParser(), Sleeper.interruptible(), Clock.systemUTC(), settings);
    }

    public ReinvocationLoop(HandlerClient client, ProgressEventParser parser, Sleeper sleeper, Clock clock,
                            LoopSettings settings) {
        this.client = client;
        this.parser = parser;
        this.sleeper = sleeper;
        this.clock = clock;
        this.settings = settings;
    }

    public LoopState run(InvocationRequest initial) {
        return run(initial, new CancellationSignal());
    }

    public LoopState run(InvocationRequest initial, CancellationSignal cancellation) {
        LoopState state = new LoopState(initial.action(), initial.bearerToken(), settings.maxReinvoke());
        MDC.put(MDC_BEARER_TOKEN, initial.bearerToken());
        MDC.put(MDC_ACTION, initial.action().name());
        try {
            log.info("Starting {} run (maxReinvoke={})", initial.action(),
                    settings.maxReinvoke() == null ? "unbounded" : settings.maxReinvoke());
            InvocationRequest request = initial;
            while (!state.isDone()) {
                request = step(state, request, cancellation);
            }
            log.info("{} run finished in {} after {} invocation(s)", initial.action(), state.phase(),
                    state.invocationCount());
            return state;
        } finally {
            MDC.remove(MDC_BEARER_TOKEN);
            MDC.remove(MDC_ACTION);
        }
    }

    /**
     * One iteration: invoke, classify, and prepare the next request when the handler is
     * still in progress.
     *
     * @return the request for the next invocation; meaningless once the state is terminal
     */
    private InvocationRequest step(LoopState state, InvocationRequest request, CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            state.markError(RunError.cancelled(cancellation.reason()), clock.instant());
            return request;
        }

        state.markRunning(clock.instant());
        log.debug("Invocation {} callbackContext={}", state.invocationCount(), request.callbackContext());

        Instant started = clock.instant();
        RawResponse raw;
        try {
            raw = client.invoke(request, cancellation);
        } catch (HandlerTransportException e) {
            RunError error = cancellation.isCancelled()
                    ? RunError.cancelled(cancellation.reason())
                    : RunError.transport(e);
            log.warn("Invocation {} failed: {} {}", state.invocationCount(), error.kind(), e.getMessage());
            state.markError(error, clock.instant());
            return request;
        }
        checkElapsed(state, Duration.between(started, clock.instant()));

        ParsedProgressEvent parsed;
        try {
            parsed = parser.parse(raw);
        } catch (ProgressEventValidationException e) {
            log.warn("Invocation {} returned an invalid response: {}", state.invocationCount(), e.getMessage());
            state.markError(RunError.validation(e), clock.instant());
            return request;
        }

        ProgressEvent event = parsed.event();
        state.record(event, parsed.warnings());
        log.debug("Invocation {} returned {}", state.invocationCount(), event.status());

        switch (event.status()) {
            case SUCCESS -> state.markSuccess(clock.instant());
            case FAILED -> state.markFailed(clock.instant());
            case IN_PROGRESS -> {
                return continueWith(state, request, event, cancellation);
            }
        }
        return request;
    }

    private InvocationRequest continueWith(LoopState state, InvocationRequest request, ProgressEvent event,
                                           CancellationSignal cancellation) {
        if (state.action().isSynchronous()) {
            state.warn(new ContractWarning(WarningCode.SYNCHRONOUS_ACTION_IN_PROGRESS,
                    state.action() + " returned IN_PROGRESS"));
        }
        state.markContinuing();
        InvocationRequest next = request.withCallbackContext(event.callbackContextOrEmpty());

        if (state.reinvocationBudgetSpent()) {
            log.info("Re-invocation budget of {} spent after {} invocation(s)", state.maxReinvoke(),
                    state.invocationCount());
            state.markExhausted(clock.instant());
            return next;
        }

        int delaySeconds = event.callbackDelaySecondsOrZero();
        if (delaySeconds > 0) {
            log.debug("Waiting {}s before invocation {}", delaySeconds, state.invocationCount() + 1);
            try {
                if (!sleeper.pause(Duration.ofSeconds(delaySeconds), cancellation)) {
                    state.markError(RunError.cancelled(cancellation.reason()), clock.instant());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.markError(RunError.cancelled("interrupted while waiting for callback delay"),
                        clock.instant());
            }
        }
        return next;
    }

    private void checkElapsed(LoopState state, Duration elapsed) {
        Action action = state.action();
        Duration limit = action.isSynchronous() ? LoopSettings.SYNCHRONOUS_ACTION_LIMIT : settings.enforceTimeout();
        if (elapsed.compareTo(limit) > 0) {
            state.warn(new ContractWarning(WarningCode.INVOCATION_TIME_EXCEEDED,
                    action + " invocation took " + elapsed.toMillis() + " ms, limit is " + limit.toMillis() + " ms"));
        }
    }
}
