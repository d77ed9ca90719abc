package io.krpc.server.core;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Wakes the tick thread when the I/O thread has queued a frame.
 */
final class ReceiveSignal {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition frameArrived = lock.newCondition();

    void signal() {
        lock.lock();
        try {
            frameArrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until {@code ready} holds or {@code timeout} elapses.
     *
     * @return the final value of {@code ready}
     */
    boolean await(Duration timeout, BooleanSupplier ready) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!ready.getAsBoolean()) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = frameArrived.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
