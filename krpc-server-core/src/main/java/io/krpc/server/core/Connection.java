package io.krpc.server.core;

import io.krpc.core.DecodeException;
import io.krpc.core.KrpcException;
import io.krpc.core.ProtocolMessage.ConnectionType;
import io.krpc.server.spi.DisconnectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One accepted socket.
 *
 * <p>The I/O thread feeds received bytes through {@link #receive(ByteBuffer)}, which cuts them into
 * frames and queues the payloads for the tick thread. A connection-fatal fault closes only this
 * connection; the tick thread notices the close on its next session update.
 */
final class Connection {

    private static final Logger LOG = LoggerFactory.getLogger(Connection.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final ConnectionType type;
    private final Transport transport;
    private final ReceiveBuffer buffer;
    private final ReceiveSignal signal;
    private final ServerStatistics statistics;
    private final long openedAtNanos;
    private final int sendQueueCapacity;
    private final int maxQueuedRequests;
    private final Queue<byte[]> inbox = new ConcurrentLinkedQueue<>();
    private final AtomicReference<DisconnectReason> closeReason = new AtomicReference<>();

    Connection(ConnectionType type, Transport transport, ServerConfig config, ReceiveSignal signal,
               ServerStatistics statistics, long openedAtNanos) {
        this.type = Objects.requireNonNull(type, "type");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.buffer = new ReceiveBuffer(config.receiveBufferCapacity(), config.maxFrameLength());
        this.signal = signal;
        this.statistics = statistics;
        this.openedAtNanos = openedAtNanos;
        this.sendQueueCapacity = config.sendQueueCapacity();
        this.maxQueuedRequests = config.maxQueuedRequests();
    }

    long id() {
        return id;
    }

    ConnectionType type() {
        return type;
    }

    String remoteAddress() {
        return transport.remoteAddress();
    }

    long openedAtNanos() {
        return openedAtNanos;
    }

    /**
     * Called by the I/O thread with bytes read from the socket.
     */
    void receive(ByteBuffer bytes) {
        if (isClosed()) {
            return;
        }
        statistics.recordBytesRead(bytes.remaining());
        List<byte[]> frames;
        try {
            frames = buffer.append(bytes);
        } catch (KrpcException.RequestBufferOverflow e) {
            LOG.warn("Closing {} connection {} from {}: {}", type, id, remoteAddress(), e.getMessage());
            close(DisconnectReason.REQUEST_BUFFER_OVERFLOW);
            signal.signal();
            return;
        } catch (DecodeException e) {
            LOG.warn("Closing {} connection {} from {}: {}", type, id, remoteAddress(), e.getMessage());
            close(DisconnectReason.DECODE_ERROR);
            signal.signal();
            return;
        }
        if (!frames.isEmpty()) {
            inbox.addAll(frames);
            signal.signal();
            if (!acceptsInput()) {
                transport.inputBacklogChanged();
            }
        }
    }

    /**
     * False while the inbox holds {@link ServerConfig#maxQueuedRequests()} frames or more; the
     * transport stops reading until the tick thread catches up.
     */
    boolean acceptsInput() {
        return inbox.size() < maxQueuedRequests;
    }

    boolean hasFrame() {
        return !inbox.isEmpty() && !isClosed();
    }

    /**
     * Next received frame payload, or null.
     */
    byte[] pollFrame() {
        if (isClosed()) {
            return null;
        }
        byte[] frame = inbox.poll();
        if (frame != null) {
            transport.inputBacklogChanged();
        }
        return frame;
    }

    /**
     * Queues an already framed message. Dropped if the connection has closed. A client whose unsent
     * bytes would exceed {@link ServerConfig#sendQueueCapacity()} is disconnected at once.
     */
    void send(byte[] framed) {
        if (isClosed()) {
            return;
        }
        if (transport.queuedBytes() + framed.length > sendQueueCapacity) {
            LOG.warn("Closing {} connection {} from {}: {} unsent bytes exceed send queue capacity {}",
                    type, id, remoteAddress(), transport.queuedBytes() + framed.length, sendQueueCapacity);
            abort(DisconnectReason.SEND_BUFFER_OVERFLOW);
            signal.signal();
            return;
        }
        statistics.recordBytesWritten(framed.length);
        transport.write(ByteBuffer.wrap(framed));
    }

    /**
     * Closes the connection, keeping the first reason given.
     *
     * @return true if this call closed it
     */
    boolean close(DisconnectReason reason) {
        if (!closeReason.compareAndSet(null, reason)) {
            return false;
        }
        inbox.clear();
        transport.close();
        return true;
    }

    /**
     * Closes the connection without flushing queued bytes.
     */
    boolean abort(DisconnectReason reason) {
        if (!closeReason.compareAndSet(null, reason)) {
            return false;
        }
        inbox.clear();
        transport.abort();
        return true;
    }

    boolean isClosed() {
        return closeReason.get() != null;
    }

    /**
     * Why the connection closed, or null while open.
     */
    DisconnectReason closeReason() {
        return closeReason.get();
    }

    @Override
    public String toString() {
        return type + " connection " + id + " from " + remoteAddress();
    }
}
