package io.krpc.server.core;

import java.nio.ByteBuffer;

/**
 * Outbound side of one socket. Implementations queue writes and never block the caller.
 */
public interface Transport {

    /**
     * Queue bytes for sending. Ignored once {@link #close()} has been called.
     */
    void write(ByteBuffer data);

    /**
     * Bytes queued by {@link #write} and not yet handed to the socket.
     */
    long queuedBytes();

    /**
     * Close after the bytes already queued have been flushed.
     */
    void close();

    /**
     * Close at once, discarding queued bytes.
     */
    void abort();

    /**
     * The connection's inbox crossed its limit in either direction; reading should pause or resume
     * to match {@link Connection#acceptsInput()}.
     */
    void inputBacklogChanged();

    String remoteAddress();
}
