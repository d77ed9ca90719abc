package io.krpc.server.spi;

public enum DisconnectReason {
    CLIENT_CLOSED,
    IO_ERROR,
    DECODE_ERROR,
    REQUEST_BUFFER_OVERFLOW,
    SEND_BUFFER_OVERFLOW,
    HANDSHAKE_FAILED,
    DENIED,
    APPROVAL_TIMEOUT,
    SERVER_STOPPED
}
