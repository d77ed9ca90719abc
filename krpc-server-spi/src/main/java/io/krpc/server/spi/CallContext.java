package io.krpc.server.spi;

import java.util.Objects;

/**
 * What a procedure can see about the call it is executing.
 *
 * @param client the calling client
 * @param objectStore the server-wide object store
 */
public record CallContext(ClientInfo client, ObjectStore objectStore) {
    public CallContext {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(objectStore, "objectStore");
    }
}
