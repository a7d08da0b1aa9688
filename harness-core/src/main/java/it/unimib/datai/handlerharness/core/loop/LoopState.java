package it.unimib.datai.handlerharness.core.loop;

import it.unimib.datai.handlerharness.common.model.Action;
import it.unimib.datai.handlerharness.common.model.ProgressEvent;
import it.unimib.datai.handlerharness.core.event.ContractWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * State of one loop run.
 *
 * Only {@link ReinvocationLoop} mutates an instance, from the single thread driving the run;
 * everything outside the package sees the read-only accessors.
 */
public final class LoopState {
    private static final Logger log = LoggerFactory.getLogger(LoopState.class);
    private static final Map<LoopPhase, EnumSet<LoopPhase>> ALLOWED_TRANSITIONS;

    static {
        ALLOWED_TRANSITIONS = new EnumMap<>(LoopPhase.class);
        ALLOWED_TRANSITIONS.put(LoopPhase.PENDING, EnumSet.of(LoopPhase.RUNNING, LoopPhase.DONE_ERROR));
        ALLOWED_TRANSITIONS.put(LoopPhase.RUNNING, EnumSet.of(LoopPhase.CONTINUING, LoopPhase.DONE_SUCCESS,
                LoopPhase.DONE_FAILED, LoopPhase.DONE_ERROR));
        ALLOWED_TRANSITIONS.put(LoopPhase.CONTINUING, EnumSet.of(LoopPhase.RUNNING, LoopPhase.DONE_EXHAUSTED,
                LoopPhase.DONE_ERROR));
        ALLOWED_TRANSITIONS.put(LoopPhase.DONE_SUCCESS, EnumSet.noneOf(LoopPhase.class));
        ALLOWED_TRANSITIONS.put(LoopPhase.DONE_FAILED, EnumSet.noneOf(LoopPhase.class));
        ALLOWED_TRANSITIONS.put(LoopPhase.DONE_EXHAUSTED, EnumSet.noneOf(LoopPhase.class));
        ALLOWED_TRANSITIONS.put(LoopPhase.DONE_ERROR, EnumSet.noneOf(LoopPhase.class));
    }

    private final Action action;
    private final String bearerToken;
    private final Integer maxReinvoke;
    private final List<ContractWarning> warnings = new ArrayList<>();

    private LoopPhase phase = LoopPhase.PENDING;
    private int invocationCount;
    private ProgressEvent lastEvent;
    private RunError error;
    private Instant startedAt;
    private Instant finishedAt;

    LoopState(Action action, String bearerToken, Integer maxReinvoke) {
        this.action = action;
        this.bearerToken = bearerToken;
        this.maxReinvoke = maxReinvoke;
    }

    public Action action() {
        return action;
    }

    public String bearerToken() {
        return bearerToken;
    }

    public Integer maxReinvoke() {
        return maxReinvoke;
    }

    public LoopPhase phase() {
        return phase;
    }

    public int invocationCount() {
        return invocationCount;
    }

    public ProgressEvent lastEvent() {
        return lastEvent;
    }

    public RunError error() {
        return error;
    }

    public List<ContractWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isDone() {
        return phase.isTerminal();
    }

    /**
     * True when another invocation would exceed the re-invocation budget.
     */
    boolean reinvocationBudgetSpent() {
        return maxReinvoke != null && invocationCount > maxReinvoke;
    }

    void markRunning(Instant now) {
        transition(LoopPhase.RUNNING);
        if (startedAt == null) {
            startedAt = now;
        }
        invocationCount++;
    }

    void record(ProgressEvent event, List<ContractWarning> observed) {
        lastEvent = event;
        for (ContractWarning warning : observed) {
            warn(warning);
        }
    }

    void warn(ContractWarning warning) {
        ContractWarning attributed = warning.invocation() == 0 ? warning.atInvocation(invocationCount) : warning;
        log.warn("Contract warning on invocation {}: {} {}", attributed.invocation(), attributed.code(),
                attributed.message());
        warnings.add(attributed);
    }

    void markContinuing() {
        transition(LoopPhase.CONTINUING);
    }

    void markSuccess(Instant now) {
        finish(LoopPhase.DONE_SUCCESS, now);
    }

    void markFailed(Instant now) {
        finish(LoopPhase.DONE_FAILED, now);
    }

    void markExhausted(Instant now) {
        finish(LoopPhase.DONE_EXHAUSTED, now);
    }

    void markError(RunError runError, Instant now) {
        this.error = runError;
        finish(LoopPhase.DONE_ERROR, now);
    }

    private void finish(LoopPhase target, Instant now) {
        transition(target);
        if (startedAt == null) {
            startedAt = now;
        }
        finishedAt = now;
    }

    private void transition(LoopPhase target) {
        EnumSet<LoopPhase> allowed = ALLOWED_TRANSITIONS.getOrDefault(phase, EnumSet.noneOf(LoopPhase.class));
        if (!allowed.contains(target)) {
            throw new IllegalStateException("Invalid loop transition " + phase + " -> " + target);
        }
        log.debug("Loop transition {} -> {} (invocation {})", phase, target, invocationCount);
        phase = target;
    }
}
