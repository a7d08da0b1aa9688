package it.unimib.datai.handlerharness.core.loop;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * External abort request for a loop run. Cancelling wakes a pending delay and runs the
 * registered listeners, which abort in-flight calls.
 */
public final class CancellationSignal {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    // Guarded by 'this'
    private final List<Runnable> listeners = new ArrayList<>();
    private String reason;

    public void cancel(String reason) {
        List<Runnable> toRun;
        synchronized (this) {
            if (this.reason != null) {
                return;
            }
            this.reason = (reason == null || reason.isBlank()) ? "cancelled" : reason;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        cancelled.countDown();
        toRun.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public synchronized String reason() {
        return reason;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the signal was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers an action to run on cancellation. Runs it immediately if the signal is
     * already cancelled. Closing the registration removes the action.
     */
    public Registration onCancel(Runnable action) {
        synchronized (this) {
            if (reason == null) {
                listeners.add(action);
                return () -> {
                    synchronized (CancellationSignal.this) {
                        listeners.remove(action);
                    }
                };
            }
        }
        action.run();
        return () -> { };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
