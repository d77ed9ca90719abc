package io.krpc.server.core;

import io.krpc.core.DecodeException;
import io.krpc.core.ProtocolCodec;
import io.krpc.core.ProtocolMessage.ConnectionRequest;
import io.krpc.core.ProtocolMessage.ConnectionResponse;
import io.krpc.core.ProtocolMessage.ConnectionStatus;
import io.krpc.core.ProtocolMessage.ConnectionType;
import io.krpc.core.ProtocolMessage.Request;
import io.krpc.server.spi.ConnectionApprover;
import io.krpc.server.spi.ConnectionApprover.Decision;
import io.krpc.server.spi.DisconnectReason;
import io.krpc.server.spi.ServerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Tracks client sessions from accept to disconnect.
 *
 * <p>{@link #accept} is called by the I/O thread; every other method belongs to the tick thread.
 * Handshakes, approval, stream linking and disconnect bookkeeping all happen in {@link #update()}.
 */
public final class SessionManager {

    private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

    private final ServerConfig config;
    private final ProtocolCodec codec;
    private final ConnectionApprover approver;
    private final ServerListener listener;
    private final ServerStatistics statistics;
    private final Ticker ticker;
    private final ReceiveSignal signal;

    private final Queue<Connection> accepted = new ConcurrentLinkedQueue<>();
    private final List<ClientSession> sessions = new ArrayList<>();
    private final Map<UUID, ClientSession> sessionsById = new HashMap<>();
    private final List<Connection> pendingStreams = new ArrayList<>();
    private final List<Consumer<UUID>> disconnectHooks = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    SessionManager(ServerConfig config, ProtocolCodec codec, ConnectionApprover approver, ServerListener listener,
                   ServerStatistics statistics, Ticker ticker, ReceiveSignal signal) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.approver = Objects.requireNonNull(approver, "approver");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    /**
     * Registers a newly accepted socket. Safe to call from the I/O thread.
     */
    Connection accept(ConnectionType type, Transport transport) {
        Connection connection = new Connection(type, transport, config, signal, statistics, ticker.nanoTime());
        if (closed) {
            connection.close(DisconnectReason.SERVER_STOPPED);
            return connection;
        }
        accepted.add(connection);
        LOG.debug("Accepted {}", connection);
        return connection;
    }

    /**
     * Runs after a session is gone, with its client identifier.
     */
    void addDisconnectHook(Consumer<UUID> hook) {
        disconnectHooks.add(hook);
    }

    /**
     * Advances every handshake and approval, links stream connections, and finishes sessions
     * whose RPC connection has closed.
     */
    public void update() {
        drainAccepted();
        long now = ticker.nanoTime();
        for (ClientSession session : new ArrayList<>(sessions)) {
            Connection rpc = session.rpcConnection();
            if (rpc.isClosed()) {
                finish(session, rpc.closeReason());
                continue;
            }
            switch (session.state()) {
                case CONNECTING -> handshake(session, now);
                case AWAITING_APPROVAL -> approve(session, now);
                case CONNECTED -> checkStream(session);
                default -> { }
            }
        }
        linkStreams(now);
    }

    /**
     * Sessions in connection order, including those still handshaking.
     */
    List<ClientSession> sessions() {
        return Collections.unmodifiableList(sessions);
    }

    List<ClientSession> connectedSessions() {
        List<ClientSession> connected = new ArrayList<>(sessions.size());
        for (ClientSession session : sessions) {
            if (session.isConnected()) {
                connected.add(session);
            }
        }
        return connected;
    }

    Optional<ClientSession> find(UUID id) {
        return Optional.ofNullable(sessionsById.get(id));
    }

    int pendingApprovals() {
        int count = 0;
        for (ClientSession session : sessions) {
            if (session.state() == ClientSession.State.AWAITING_APPROVAL) {
                count++;
            }
        }
        return count;
    }

    boolean hasPendingRequest() {
        for (ClientSession session : sessions) {
            if (session.isConnected() && session.rpcConnection().hasFrame()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Decodes the next queued request of a connected session.
     *
     * @return the request, or null if none is queued or it was malformed (the session is then disconnected)
     */
    Request takeRequest(ClientSession session) {
        byte[] frame = session.rpcConnection().pollFrame();
        if (frame == null) {
            return null;
        }
        try {
            return codec.decodeRequest(frame);
        } catch (DecodeException e) {
            LOG.warn("Malformed request from {}: {}", session, e.getMessage());
            disconnect(session, DisconnectReason.DECODE_ERROR);
            return null;
        }
    }

    /**
     * Closes both connections of a session and reports it gone. Repeated calls do nothing.
     */
    void disconnect(ClientSession session, DisconnectReason reason) {
        session.rpcConnection().close(reason);
        finish(session, session.rpcConnection().closeReason());
    }

    /**
     * Disconnects every session and refuses further connections.
     */
    void closeAll(DisconnectReason reason) {
        closed = true;
        drainAccepted();
        for (ClientSession session : new ArrayList<>(sessions)) {
            disconnect(session, reason);
        }
        for (Connection stream : pendingStreams) {
            stream.close(reason);
        }
        pendingStreams.clear();
    }

    private void drainAccepted() {
        Connection connection;
        while ((connection = accepted.poll()) != null) {
            if (connection.type() == ConnectionType.RPC) {
                ClientSession session = new ClientSession(UUID.randomUUID(), connection);
                sessions.add(session);
                sessionsById.put(session.id(), session);
            } else {
                pendingStreams.add(connection);
            }
        }
    }

    private void handshake(ClientSession session, long now) {
        Connection rpc = session.rpcConnection();
        byte[] frame = rpc.pollFrame();
        if (frame == null) {
            if (now - rpc.openedAtNanos() > config.handshakeTimeout().toNanos()) {
                refuse(session, ConnectionStatus.TIMEOUT, "Timed out waiting for the connection request",
                        DisconnectReason.HANDSHAKE_FAILED);
            }
            return;
        }
        ConnectionRequest request;
        try {
            request = codec.decodeConnectionRequest(frame);
        } catch (DecodeException e) {
            refuse(session, ConnectionStatus.MALFORMED_MESSAGE, e.getMessage(), DisconnectReason.HANDSHAKE_FAILED);
            return;
        }
        if (request.connectionType() != ConnectionType.RPC) {
            refuse(session, ConnectionStatus.WRONG_TYPE, "Expected an RPC connection request",
                    DisconnectReason.HANDSHAKE_FAILED);
            return;
        }
        session.name(request.clientName());
        if (pendingApprovals() >= config.maxPendingConnections()) {
            refuse(session, ConnectionStatus.REJECTED, "Too many connections awaiting approval", DisconnectReason.DENIED);
            return;
        }
        session.awaitApproval(now);
        approve(session, now);
    }

    private void approve(ClientSession session, long now) {
        Decision decision;
        try {
            decision = approver.onConnectionRequested(session.info());
        } catch (RuntimeException e) {
            LOG.warn("Connection approver failed for {}", session, e);
            decision = new Decision.Deny("Connection approval failed");
        }
        if (decision instanceof Decision.Allow) {
            session.state(ClientSession.State.CONNECTED);
            session.rpcConnection().send(codec.encodeFramed(ConnectionResponse.ok(ClientIds.toBytes(session.id()))));
            LOG.info("Client connected: {} from {}", session.name(), session.info().address());
            try {
                listener.onClientConnected(session.info());
            } catch (RuntimeException e) {
                LOG.warn("Server listener failed on connect of {}", session, e);
            }
        } else if (decision instanceof Decision.Deny deny) {
            refuse(session, ConnectionStatus.REJECTED, deny.reason(), DisconnectReason.DENIED);
        } else if (now - session.awaitingSinceNanos() >= config.approvalTimeout().toNanos()) {
            LOG.warn("Approval timed out for {}", session);
            refuse(session, ConnectionStatus.TIMEOUT, "Timed out waiting for connection approval",
                    DisconnectReason.APPROVAL_TIMEOUT);
        }
    }

    private void refuse(ClientSession session, ConnectionStatus status, String message, DisconnectReason reason) {
        session.rpcConnection().send(codec.encodeFramed(ConnectionResponse.failed(status, message)));
        disconnect(session, reason);
    }

    private void checkStream(ClientSession session) {
        Connection stream = session.streamConnection();
        if (stream == null) {
            return;
        }
        if (stream.isClosed()) {
            LOG.info("Stream connection of {} closed: {}", session, stream.closeReason());
            session.streamConnection(null);
            return;
        }
        // clients never send on a linked stream connection
        while (stream.pollFrame() != null) {
            LOG.debug("Ignoring frame on stream connection of {}", session);
        }
    }

    private void linkStreams(long now) {
        Iterator<Connection> it = pendingStreams.iterator();
        while (it.hasNext()) {
            Connection stream = it.next();
            if (stream.isClosed()) {
                it.remove();
                continue;
            }
            byte[] frame = stream.pollFrame();
            if (frame == null) {
                if (now - stream.openedAtNanos() > config.handshakeTimeout().toNanos()) {
                    refuseStream(stream, ConnectionStatus.TIMEOUT, "Timed out waiting for the connection request");
                    it.remove();
                }
                continue;
            }
            it.remove();
            ConnectionRequest request;
            try {
                request = codec.decodeConnectionRequest(frame);
            } catch (DecodeException e) {
                refuseStream(stream, ConnectionStatus.MALFORMED_MESSAGE, e.getMessage());
                continue;
            }
            if (request.connectionType() != ConnectionType.STREAM) {
                refuseStream(stream, ConnectionStatus.WRONG_TYPE, "Expected a stream connection request");
                continue;
            }
            UUID id = ClientIds.fromBytes(request.clientIdentifier());
            ClientSession session = id == null ? null : sessionsById.get(id);
            if (session == null || !session.isConnected() || session.streamConnection() != null) {
                refuseStream(stream, ConnectionStatus.MALFORMED_MESSAGE, "Unknown or already linked client identifier");
                continue;
            }
            session.streamConnection(stream);
            stream.send(codec.encodeFramed(ConnectionResponse.ok(ClientIds.toBytes(session.id()))));
            LOG.debug("Linked stream connection for {}", session);
        }
    }

    private void refuseStream(Connection stream, ConnectionStatus status, String message) {
        LOG.warn("Refusing {}: {}", stream, message);
        stream.send(codec.encodeFramed(ConnectionResponse.failed(status, message)));
        stream.close(DisconnectReason.HANDSHAKE_FAILED);
    }

    private void finish(ClientSession session, DisconnectReason reason) {
        if (session.state() == ClientSession.State.DISCONNECTED) {
            return;
        }
        session.state(ClientSession.State.DISCONNECTED);
        Connection stream = session.streamConnection();
        if (stream != null) {
            stream.close(reason);
            session.streamConnection(null);
        }
        sessions.remove(session);
        sessionsById.remove(session.id());
        for (Consumer<UUID> hook : disconnectHooks) {
            hook.accept(session.id());
        }
        LOG.info("Client disconnected: {} ({})", session.name(), reason);
        try {
            listener.onClientDisconnected(session.info(), reason);
        } catch (RuntimeException e) {
            LOG.warn("Server listener failed on disconnect of {}", session, e);
        }
    }
}
