package io.krpc.server.spi;

/**
 * Server lifecycle callbacks. Client callbacks are delivered on the tick thread, each session's
 * disconnect exactly once.
 */
public interface ServerListener {

    default void onServerStarted() {}

    default void onServerStopped() {}

    default void onClientConnected(ClientInfo client) {}

    /**
     * @param client the client, or a placeholder with an empty name if it never finished its handshake
     * @param reason why the session ended
     */
    default void onClientDisconnected(ClientInfo client, DisconnectReason reason) {}

    ServerListener NONE = new ServerListener() {};
}
