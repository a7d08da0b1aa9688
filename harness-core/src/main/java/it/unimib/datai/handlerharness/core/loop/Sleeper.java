package it.unimib.datai.handlerharness.core.loop;

import java.time.Duration;

/**
 * Waits out a callback delay between two invocations.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @return true if the full delay elapsed, false if the wait ended because the run was cancelled
     */
    boolean pause(Duration delay, CancellationSignal cancellation) throws InterruptedException;

    /**
     * Blocks the calling thread until the delay elapses or the signal is cancelled.
     */
    static Sleeper interruptible() {
        return (delay, cancellation) -> !cancellation.await(delay);
    }
}
