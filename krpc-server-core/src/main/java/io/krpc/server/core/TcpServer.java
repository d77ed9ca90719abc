package io.krpc.server.core;

import io.krpc.core.KrpcException;
import io.krpc.core.ProtocolMessage.ConnectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Non-blocking TCP front end: one selector thread serving the RPC and stream listen ports and
 * every accepted socket.
 *
 * <p>The selector thread only moves bytes. Received bytes are handed to each socket's
 * {@link Connection}; outbound bytes are queued by the tick thread and flushed when the socket
 * is writable. Interest changes requested from other threads run as selector tasks.
 */
public final class TcpServer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(TcpServer.class);

    private final ServerConfig config;
    private final SessionManager sessions;
    private final Queue<Runnable> selectorTasks = new ConcurrentLinkedQueue<>();

    private Selector selector;
    private ServerSocketChannel rpcChannel;
    private ServerSocketChannel streamChannel;
    private Thread selectorThread;
    private int boundRpcPort;
    private int boundStreamPort;
    private volatile boolean running;

    TcpServer(ServerConfig config, SessionManager sessions) {
        this.config = Objects.requireNonNull(config, "config");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    /**
     * Binds both ports and starts the selector thread.
     *
     * @throws KrpcException.ServerException if a port cannot be bound
     */
    void start() {
        try {
            selector = Selector.open();
            rpcChannel = listen(config.rpcPort(), ConnectionType.RPC);
            streamChannel = listen(config.streamPort(), ConnectionType.STREAM);
            boundRpcPort = ((InetSocketAddress) rpcChannel.getLocalAddress()).getPort();
            boundStreamPort = ((InetSocketAddress) streamChannel.getLocalAddress()).getPort();
        } catch (IOException e) {
            closeChannels();
            throw new KrpcException.ServerException("Cannot listen on " + config.address()
                    + " ports " + config.rpcPort() + "/" + config.streamPort(), e);
        }
        running = true;
        selectorThread = new Thread(this::serve, "krpc-io");
        selectorThread.setDaemon(true);
        selectorThread.start();
        LOG.info("Listening on {} (rpc port {}, stream port {})", config.address(), boundRpcPort, boundStreamPort);
    }

    int rpcPort() {
        return boundRpcPort;
    }

    int streamPort() {
        return boundStreamPort;
    }

    boolean isRunning() {
        return running;
    }

    /**
     * Stops the selector thread and closes every socket.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        selector.wakeup();
        if (Thread.currentThread() != selectorThread) {
            try {
                selectorThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Recomputes the operations a socket is selected for. Safe to call from any thread; the new
     * interest set is computed on the selector thread.
     */
    void refreshInterest(ChannelTransport transport) {
        Selector current = selector;
        if (current == null) {
            return;
        }
        SelectionKey key = transport.channel().keyFor(current);
        if (key == null) {
            return;
        }
        if (Thread.currentThread() == selectorThread) {
            applyInterest(key, transport);
        } else {
            selectorTasks.add(() -> applyInterest(key, transport));
            current.wakeup();
        }
    }

    private static void applyInterest(SelectionKey key, ChannelTransport transport) {
        try {
            if (key.isValid()) {
                key.interestOps(transport.interestOps());
            }
        } catch (CancelledKeyException e) {
            LOG.debug("Socket {} closed before its interest could change", transport.remoteAddress());
        }
    }

    private ServerSocketChannel listen(int port, ConnectionType type) throws IOException {
        ServerSocketChannel channel = ServerSocketChannel.open();
        channel.bind(new InetSocketAddress(config.address(), port));
        channel.configureBlocking(false);
        channel.register(selector, SelectionKey.OP_ACCEPT, type);
        return channel;
    }

    private void serve() {
        try {
            while (running) {
                selector.select();
                runSelectorTasks();
                for (SelectionKey key : selector.selectedKeys()) {
                    if (!key.isValid()) {
                        continue;
                    }
                    if (key.isAcceptable()) {
                        handleAccept(key);
                    } else {
                        handleReadWrite(key);
                    }
                }
                selector.selectedKeys().clear();
            }
        } catch (ClosedSelectorException e) {
            LOG.debug("Selector closed");
        } catch (IOException e) {
            LOG.error("Network loop failed", e);
        } finally {
            running = false;
            closeChannels();
            LOG.info("Network loop stopped");
        }
    }

    private void runSelectorTasks() {
        Runnable task;
        while ((task = selectorTasks.poll()) != null) {
            task.run();
        }
    }

    private void handleAccept(SelectionKey key) throws IOException {
        ConnectionType type = (ConnectionType) key.attachment();
        SocketChannel channel = ((ServerSocketChannel) key.channel()).accept();
        if (channel == null) {
            return;
        }
        channel.configureBlocking(false);
        channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
        ChannelTransport transport = new ChannelTransport(this, channel);
        Connection connection = sessions.accept(type, transport);
        transport.bind(connection);
        channel.register(selector, SelectionKey.OP_READ, transport);
    }

    private void handleReadWrite(SelectionKey key) {
        ChannelTransport transport = (ChannelTransport) key.attachment();
        try {
            if (key.isReadable()) {
                transport.continueRead();
            }
            if (key.isValid() && key.isWritable()) {
                transport.continueWrite();
            }
        } catch (CancelledKeyException e) {
            // aborted from the tick thread while selected
            LOG.debug("Socket {} closed while selected", transport.remoteAddress());
        }
    }

    private void closeChannels() {
        if (selector != null) {
            for (SelectionKey key : selector.keys()) {
                closeQuietly(key.channel());
            }
            closeQuietly(selector);
        }
        closeQuietly(rpcChannel);
        closeQuietly(streamChannel);
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            LOG.debug("Error while closing {}", closeable, e);
        }
    }
}
