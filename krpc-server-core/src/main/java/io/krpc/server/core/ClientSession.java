package io.krpc.server.core;

import io.krpc.server.spi.ClientInfo;

import java.util.Objects;
import java.util.UUID;

/**
 * Server-side state of one client: its RPC connection, the optional linked stream connection,
 * and where it is in the handshake.
 *
 * <p>Owned by the tick thread.
 */
final class ClientSession {

    enum State {
        CONNECTING,
        AWAITING_APPROVAL,
        CONNECTED,
        DISCONNECTED
    }

    private final UUID id;
    private final Connection rpcConnection;
    private Connection streamConnection;
    private String name = "";
    private State state = State.CONNECTING;
    private long awaitingSinceNanos;
    private ClientInfo info;

    ClientSession(UUID id, Connection rpcConnection) {
        this.id = Objects.requireNonNull(id, "id");
        this.rpcConnection = Objects.requireNonNull(rpcConnection, "rpcConnection");
    }

    UUID id() {
        return id;
    }

    String name() {
        return name;
    }

    void name(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.info = null;
    }

    State state() {
        return state;
    }

    void state(State state) {
        this.state = state;
    }

    boolean isConnected() {
        return state == State.CONNECTED;
    }

    long awaitingSinceNanos() {
        return awaitingSinceNanos;
    }

    void awaitApproval(long nowNanos) {
        this.state = State.AWAITING_APPROVAL;
        this.awaitingSinceNanos = nowNanos;
    }

    Connection rpcConnection() {
        return rpcConnection;
    }

    /**
     * The linked stream connection, or null.
     */
    Connection streamConnection() {
        return streamConnection;
    }

    void streamConnection(Connection streamConnection) {
        this.streamConnection = streamConnection;
    }

    ClientInfo info() {
        if (info == null) {
            info = new ClientInfo(id, name, rpcConnection.remoteAddress());
        }
        return info;
    }

    @Override
    public String toString() {
        return "client " + id + " '" + name + "' (" + state + ")";
    }
}
