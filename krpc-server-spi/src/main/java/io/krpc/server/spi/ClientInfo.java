package io.krpc.server.spi;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a connected client.
 *
 * @param id server-issued identifier, also used to link the stream connection
 * @param name name the client presented in its handshake
 * @param address remote address of the RPC connection
 */
public record ClientInfo(UUID id, String name, String address) {
    public ClientInfo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(address, "address");
    }
}
