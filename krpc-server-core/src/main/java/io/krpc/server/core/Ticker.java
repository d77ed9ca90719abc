package io.krpc.server.core;

/**
 * Monotonic nanosecond time source, replaceable in tests.
 */
@FunctionalInterface
public interface Ticker {

    long nanoTime();

    static Ticker system() {
        return System::nanoTime;
    }
}
