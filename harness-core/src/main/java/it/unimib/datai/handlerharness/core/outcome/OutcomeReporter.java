package it.unimib.datai.handlerharness.core.outcome;

import it.unimib.datai.handlerharness.common.model.ProgressEvent;
import it.unimib.datai.handlerharness.core.loop.LoopState;
import it.unimib.datai.handlerharness.core.loop.RunError;

/**
 * Maps a finished {@link LoopState} to its {@link ExitOutcome}. Has no side effects.
 */
public final class OutcomeReporter {

    public ExitOutcome report(LoopState state) {
        if (!state.isDone()) {
            throw new IllegalStateException("Run has not finished: " + state.phase());
        }
        ProgressEvent last = state.lastEvent();
        return switch (state.phase()) {
            case DONE_SUCCESS -> new ExitOutcome(OutcomeKind.SUCCESS, state.action(), state.bearerToken(),
                    state.invocationCount(), last.message(), null, last.resourceModel(), last.resourceModels(),
                    last.nextToken(), last, null, state.warnings());
            case DONE_FAILED -> new ExitOutcome(OutcomeKind.FAILED, state.action(), state.bearerToken(),
                    state.invocationCount(), last.message(), last.errorCode(), null, null, null, last, null,
                    state.warnings());
            case DONE_EXHAUSTED -> new ExitOutcome(OutcomeKind.EXHAUSTED, state.action(), state.bearerToken(),
                    state.invocationCount(), exhaustedMessage(state), null, null, null, null, last, null,
                    state.warnings());
            case DONE_ERROR -> {
                RunError error = state.error();
                yield new ExitOutcome(OutcomeKind.ERROR, state.action(), state.bearerToken(),
                        state.invocationCount(), error.message(), null, null, null, null, last, error,
                        state.warnings());
            }
            default -> throw new IllegalStateException("Unexpected terminal phase " + state.phase());
        };
    }

    private static String exhaustedMessage(LoopState state) {
        return "Handler still IN_PROGRESS after " + state.invocationCount()
                + " invocation(s); re-invocation budget of " + state.maxReinvoke() + " exceeded";
    }
}
