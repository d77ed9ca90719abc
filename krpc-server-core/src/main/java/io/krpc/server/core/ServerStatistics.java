package io.krpc.server.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters behind {@code KRPC.GetStatus}.
 *
 * <p>Byte counters are updated from the I/O thread; everything else from the tick thread.
 * Rates are computed over the interval since the previous {@link #sample()}.
 */
public final class ServerStatistics {

    private static final double SMOOTHING = 0.1;

    private final Ticker ticker;
    private final AtomicLong bytesRead = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();
    private final AtomicLong rpcsExecuted = new AtomicLong();
    private final AtomicLong streamRpcsExecuted = new AtomicLong();

    private volatile double timePerRpcTickNanos;
    private volatile double execTimePerRpcTickNanos;
    private volatile double timePerStreamTickNanos;

    private long lastSampleNanos;
    private long lastBytesRead;
    private long lastBytesWritten;
    private long lastRpcs;
    private long lastStreamRpcs;

    public ServerStatistics(Ticker ticker) {
        this.ticker = ticker;
        this.lastSampleNanos = ticker.nanoTime();
    }

    void recordBytesRead(long count) {
        bytesRead.addAndGet(count);
    }

    void recordBytesWritten(long count) {
        bytesWritten.addAndGet(count);
    }

    void recordRpcTick(long calls, long tickNanos, long execNanos) {
        rpcsExecuted.addAndGet(calls);
        timePerRpcTickNanos = smooth(timePerRpcTickNanos, tickNanos);
        execTimePerRpcTickNanos = smooth(execTimePerRpcTickNanos, execNanos);
    }

    void recordStreamTick(long calls, long tickNanos) {
        streamRpcsExecuted.addAndGet(calls);
        timePerStreamTickNanos = smooth(timePerStreamTickNanos, tickNanos);
    }

    public long bytesRead() {
        return bytesRead.get();
    }

    public long bytesWritten() {
        return bytesWritten.get();
    }

    public long rpcsExecuted() {
        return rpcsExecuted.get();
    }

    public long streamRpcsExecuted() {
        return streamRpcsExecuted.get();
    }

    /**
     * Current counters plus rates since the previous sample.
     */
    public synchronized Snapshot sample() {
        long now = ticker.nanoTime();
        double seconds = Math.max(now - lastSampleNanos, 1L) / 1_000_000_000.0;
        long read = bytesRead.get();
        long written = bytesWritten.get();
        long rpcs = rpcsExecuted.get();
        long streamRpcs = streamRpcsExecuted.get();
        Snapshot snapshot = new Snapshot(
                read,
                written,
                (float) ((read - lastBytesRead) / seconds),
                (float) ((written - lastBytesWritten) / seconds),
                rpcs,
                (float) ((rpcs - lastRpcs) / seconds),
                streamRpcs,
                (float) ((streamRpcs - lastStreamRpcs) / seconds),
                (float) (timePerRpcTickNanos / 1000.0),
                (float) (execTimePerRpcTickNanos / 1000.0),
                (float) (timePerStreamTickNanos / 1000.0));
        lastSampleNanos = now;
        lastBytesRead = read;
        lastBytesWritten = written;
        lastRpcs = rpcs;
        lastStreamRpcs = streamRpcs;
        return snapshot;
    }

    private static double smooth(double current, long sample) {
        return current == 0.0 ? sample : current + SMOOTHING * (sample - current);
    }

    /**
     * Point-in-time counters. Rates are per second, tick times in microseconds.
     */
    public record Snapshot(
            long bytesRead,
            long bytesWritten,
            float bytesReadRate,
            float bytesWrittenRate,
            long rpcsExecuted,
            float rpcRate,
            long streamRpcsExecuted,
            float streamRpcRate,
            float timePerRpcTickMicros,
            float execTimePerRpcTickMicros,
            float timePerStreamTickMicros) {}
}
