package io.krpc.server.core;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Client identifiers travel as the 16 big-endian bytes of a UUID.
 */
final class ClientIds {

    static final int LENGTH = 16;

    private ClientIds() {}

    static byte[] toBytes(UUID id) {
        return ByteBuffer.allocate(LENGTH)
                .putLong(id.getMostSignificantBits())
                .putLong(id.getLeastSignificantBits())
                .array();
    }

    /**
     * @return the identifier, or null if {@code bytes} is not 16 bytes long
     */
    static UUID fromBytes(byte[] bytes) {
        if (bytes.length != LENGTH) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}
