package io.krpc.client;

import io.krpc.core.ProtocolMessage.ConnectionStatus;

import java.io.IOException;

/**
 * The server refused a connection handshake.
 */
public final class KrpcConnectionException extends IOException {

    private static final long serialVersionUID = 1L;

    private final ConnectionStatus status;

    public KrpcConnectionException(ConnectionStatus status, String message) {
        super("Connection refused (" + status + ")" + (message.isEmpty() ? "" : ": " + message));
        this.status = status;
    }

    public ConnectionStatus status() {
        return status;
    }
}
