package dev.stepflow.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting admission control: at most {@code capacity} units are held at once.
 * No priority and no fairness beyond the order in which waiters are woken.
 */
public final class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private int admitted;

    public AdmissionGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Block until {@code n} units are free, then take them.
     *
     * @throws RunCancelledException the signal fired first; nothing was acquired
     */
    public void acquire(int n, CancellationSignal signal) throws RunCancelledException {
        if (n < 1 || n > capacity) {
            throw new IllegalArgumentException("cannot acquire %d of %d units".formatted(n, capacity));
        }
        try (CancellationSignal.Subscription ignored = signal.onCancel(this::wakeAll)) {
            lock.lock();
            try {
                while (admitted + n > capacity) {
                    signal.throwIfCancelled();
                    if (signal.hasDeadline()) {
                        released.awaitNanos(signal.remainingNanos());
                    } else {
                        released.await();
                    }
                }
                signal.throwIfCancelled();
                admitted += n;
                log.debug("Admitted {} unit(s), {}/{} in use", n, admitted, capacity);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException("Interrupted while waiting for admission", e);
            } finally {
                lock.unlock();
            }
        }
    }

    /** Return {@code n} previously acquired units. */
    public void release(int n) {
        lock.lock();
        try {
            if (n < 1 || n > admitted) {
                throw new IllegalStateException("cannot release %d unit(s), %d held".formatted(n, admitted));
            }
            admitted -= n;
            log.debug("Released {} unit(s), {}/{} in use", n, admitted, capacity);
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int admitted() {
        lock.lock();
        try {
            return admitted;
        } finally {
            lock.unlock();
        }
    }

    private void wakeAll() {
        lock.lock();
        try {
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
