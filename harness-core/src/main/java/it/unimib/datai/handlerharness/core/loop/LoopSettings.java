package it.unimib.datai.handlerharness.core.loop;

import java.time.Duration;

/**
 * Policy for one loop run.
 *
 * @param maxReinvoke    ceiling on IN_PROGRESS re-invocations, not counting the first
 *                       invocation; {@code null} means unbounded
 * @param enforceTimeout time a single CREATE/UPDATE/DELETE invocation may take before a
 *                       contract warning is raised
 */
public record LoopSettings(Integer maxReinvoke, Duration enforceTimeout) {
    public static final Duration DEFAULT_ENFORCE_TIMEOUT = Duration.ofSeconds(30);
    /** READ and LIST must always answer within this limit. */
    public static final Duration SYNCHRONOUS_ACTION_LIMIT = Duration.ofSeconds(30);

    public LoopSettings {
        if (maxReinvoke != null && maxReinvoke < 0) {
            throw new IllegalArgumentException("maxReinvoke must be >= 0: " + maxReinvoke);
        }
        if (enforceTimeout == null) {
            enforceTimeout = DEFAULT_ENFORCE_TIMEOUT;
        }
        if (enforceTimeout.isZero() || enforceTimeout.isNegative()) {
            throw new IllegalArgumentException("enforceTimeout must be positive: " + enforceTimeout);
        }
    }

    public static LoopSettings unbounded() {
        return new LoopSettings(null, null);
    }

    public static LoopSettings maxReinvoke(int maxReinvoke) {
        return new LoopSettings(maxReinvoke, null);
    }
}
