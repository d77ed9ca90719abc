package io.krpc.server.core;

import io.krpc.server.spi.ConnectionApprover;
import io.krpc.server.spi.DisconnectReason;
import io.krpc.server.spi.ObjectStore;
import io.krpc.server.spi.ProcedureDispatcher;
import io.krpc.server.spi.ServerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Embeddable RPC server driven by the host's update loop.
 *
 * <pre>{@code
 * KrpcServer server = KrpcServer.builder(dispatcher)
 *     .config(ServerConfig.builder().rpcPort(50000).streamPort(50001).build())
 *     .approver(ConnectionApprover.allowAll())
 *     .build();
 * server.start();
 * while (running) {
 *     simulate();
 *     server.tick();
 * }
 * server.stop();
 * }</pre>
 *
 * <p>{@link #tick()} and {@link #stop()} must be called from the host's tick thread.
 */
public final class KrpcServer {

    private static final Logger LOG = LoggerFactory.getLogger(KrpcServer.class);

    public static final String VERSION = "0.1.0";

    private final ServerContext context;
    private final ServerListener listener;
    private final TcpServer tcpServer;
    private boolean started;

    public static Builder builder(ProcedureDispatcher dispatcher) {
        return new Builder(dispatcher);
    }

    private KrpcServer(Builder builder) {
        ServerConfig config = builder.config != null ? builder.config : ServerConfig.defaults();
        ObjectStore objectStore = builder.objectStore != null ? builder.objectStore : new IdentityObjectStore();
        ConnectionApprover approver = builder.approver != null ? builder.approver : ConnectionApprover.allowAll();
        this.listener = builder.listener != null ? builder.listener : ServerListener.NONE;
        Ticker ticker = builder.ticker != null ? builder.ticker : Ticker.system();
        this.context = new ServerContext(config, builder.dispatcher, objectStore, approver, listener, ticker);
        this.tcpServer = new TcpServer(config, context.sessions());
    }

    /**
     * Binds the listen ports and starts accepting clients.
     *
     * @throws io.krpc.core.KrpcException.ServerException if a port cannot be bound
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Server already started");
        }
        tcpServer.start();
        started = true;
        LOG.info("Server started (version {})", VERSION);
        listener.onServerStarted();
    }

    /**
     * Disconnects every client, closes the sockets, drops all streams and clears the object store.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        context.sessions().closeAll(DisconnectReason.SERVER_STOPPED);
        context.streams().clear();
        tcpServer.close();
        if (context.objectStore() instanceof IdentityObjectStore) {
            ((IdentityObjectStore) context.objectStore()).clear();
        }
        LOG.info("Server stopped");
        listener.onServerStopped();
    }

    public synchronized boolean isRunning() {
        return started;
    }

    /**
     * One server update: queued requests within the configured budget, then every stream.
     */
    public void tick() {
        if (!isRunning()) {
            return;
        }
        context.scheduler().tick();
        context.streams().tick();
    }

    /**
     * One server update with an explicit RPC time budget.
     */
    public void tick(Duration budget) {
        if (!isRunning()) {
            return;
        }
        context.scheduler().tick(budget);
        context.streams().tick();
    }

    /** Bound RPC port; differs from the configured one when that was 0. */
    public int rpcPort() {
        return tcpServer.rpcPort();
    }

    /** Bound stream port. */
    public int streamPort() {
        return tcpServer.streamPort();
    }

    public ServerContext context() {
        return context;
    }

    public ObjectStore objectStore() {
        return context.objectStore();
    }

    /**
     * Builder for {@link KrpcServer}.
     */
    public static final class Builder {
        private final ProcedureDispatcher dispatcher;
        private ServerConfig config;
        private ObjectStore objectStore;
        private ConnectionApprover approver;
        private ServerListener listener;
        private Ticker ticker;

        private Builder(ProcedureDispatcher dispatcher) {
            this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        }

        /** Sets the configuration. Default: {@link ServerConfig#defaults()}. */
        public Builder config(ServerConfig config) {
            this.config = config;
            return this;
        }

        /** Sets the object store. Default: a new {@link IdentityObjectStore}. */
        public Builder objectStore(ObjectStore objectStore) {
            this.objectStore = objectStore;
            return this;
        }

        /** Sets the connection approver. Default: {@link ConnectionApprover#allowAll()}. */
        public Builder approver(ConnectionApprover approver) {
            this.approver = approver;
            return this;
        }

        /** Sets the lifecycle listener. Default: {@link ServerListener#NONE}. */
        public Builder listener(ServerListener listener) {
            this.listener = listener;
            return this;
        }

        /** Sets the time source. Default: {@link System#nanoTime()}. */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public KrpcServer build() {
            return new KrpcServer(this);
        }
    }
}
