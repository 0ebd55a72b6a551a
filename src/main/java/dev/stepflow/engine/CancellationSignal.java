package dev.stepflow.engine;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Externally controlled cancellation for a run, optionally with a deadline.
 * Fires once: either {@link #cancel()} is called or the deadline passes.
 */
public final class CancellationSignal {

    private final long createdAtNanos = System.nanoTime();
    private final long timeoutNanos;
    private final Duration timeout;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationSignal(Duration timeout) {
        this.timeout = timeout;
        // Saturates at Long.MAX_VALUE for timeouts beyond ~292 years.
        this.timeoutNanos = timeout == null ? Long.MAX_VALUE : TimeUnit.NANOSECONDS.convert(timeout);
    }

    /** A signal that only fires on an explicit {@link #cancel()}. */
    public static CancellationSignal create() {
        return new CancellationSignal(null);
    }

    /** A signal that also fires once {@code timeout} has elapsed from now. */
    public static CancellationSignal withTimeout(Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative, got " + timeout);
        }
        return new CancellationSignal(timeout);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || remainingNanos() <= 0;
    }

    public boolean hasDeadline() {
        return timeout != null;
    }

    /** Nanoseconds until the deadline, {@code Long.MAX_VALUE} without one. */
    public long remainingNanos() {
        return hasDeadline() ? timeoutNanos - (System.nanoTime() - createdAtNanos) : Long.MAX_VALUE;
    }

    public void throwIfCancelled() throws RunCancelledException {
        if (cancelled.get()) {
            throw new RunCancelledException("Run cancelled");
        }
        if (remainingNanos() <= 0) {
            throw new RunCancelledException("Run deadline of " + timeout + " exceeded");
        }
    }

    /**
     * Register a callback for an explicit {@link #cancel()}. Deadline expiry does
     * not invoke listeners; waiters bound their waits by {@link #remainingNanos()}.
     */
    Subscription onCancel(Runnable listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
