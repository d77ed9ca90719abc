package io.krpc.server.core;

import io.krpc.server.spi.DisconnectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Transport} over a non-blocking socket channel. Reads and flushes happen on the selector
 * thread; {@link #write} and {@link #close} may be called from any thread.
 */
final class ChannelTransport implements Transport {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelTransport.class);
    private static final int READ_BUFFER_SIZE = 64 * 1024;

    private final TcpServer server;
    private final SocketChannel channel;
    private final String remoteAddress;
    private final Queue<ByteBuffer> writeQueue = new ConcurrentLinkedQueue<>();
    private final AtomicLong queuedBytes = new AtomicLong();
    private final ByteBuffer readBuffer = ByteBuffer.allocate(READ_BUFFER_SIZE);
    private volatile boolean closeRequested;
    private volatile boolean readPaused;
    private Connection connection;

    ChannelTransport(TcpServer server, SocketChannel channel) {
        this.server = server;
        this.channel = channel;
        this.remoteAddress = describe(channel);
    }

    void bind(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void write(ByteBuffer data) {
        if (closeRequested) {
            return;
        }
        queuedBytes.addAndGet(data.remaining());
        writeQueue.add(data);
        server.refreshInterest(this);
    }

    @Override
    public long queuedBytes() {
        return queuedBytes.get();
    }

    @Override
    public void close() {
        if (closeRequested) {
            return;
        }
        closeRequested = true;
        // the channel closes once the queued bytes are flushed
        server.refreshInterest(this);
    }

    @Override
    public void abort() {
        closeRequested = true;
        closeChannel();
    }

    @Override
    public void inputBacklogChanged() {
        if (readPaused || !connection.acceptsInput()) {
            server.refreshInterest(this);
        }
    }

    SocketChannel channel() {
        return channel;
    }

    /**
     * Operations to select for, from the current state. Selector thread only.
     */
    int interestOps() {
        if (closeRequested) {
            return SelectionKey.OP_WRITE;
        }
        // published before the inbox is checked so a concurrent drain sees the pause
        readPaused = true;
        int ops = 0;
        if (connection == null || connection.acceptsInput()) {
            readPaused = false;
            ops |= SelectionKey.OP_READ;
        }
        if (!writeQueue.isEmpty()) {
            ops |= SelectionKey.OP_WRITE;
        }
        return ops;
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    void continueRead() {
        readBuffer.clear();
        int read;
        try {
            read = channel.read(readBuffer);
        } catch (IOException e) {
            LOG.debug("Read failed on {}", connection, e);
            connection.close(DisconnectReason.IO_ERROR);
            closeChannel();
            return;
        }
        if (read < 0) {
            connection.close(DisconnectReason.CLIENT_CLOSED);
            closeChannel();
            return;
        }
        readBuffer.flip();
        connection.receive(readBuffer);
    }

    void continueWrite() {
        try {
            while (!writeQueue.isEmpty()) {
                ByteBuffer top = writeQueue.peek();
                queuedBytes.addAndGet(-channel.write(top));
                if (top.hasRemaining()) {
                    return;
                }
                writeQueue.remove();
            }
        } catch (IOException e) {
            LOG.debug("Write failed on {}", connection, e);
            connection.close(DisconnectReason.IO_ERROR);
            closeChannel();
            return;
        }
        if (closeRequested) {
            closeChannel();
        } else {
            server.refreshInterest(this);
        }
    }

    private void closeChannel() {
        writeQueue.clear();
        queuedBytes.set(0);
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("Error while closing {}", connection, e);
        }
    }

    private static String describe(SocketChannel channel) {
        try {
            return String.valueOf(channel.getRemoteAddress());
        } catch (IOException e) {
            return "unknown";
        }
    }
}
