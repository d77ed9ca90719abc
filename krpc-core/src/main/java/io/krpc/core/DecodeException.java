package io.krpc.core;

/**
 * Structurally invalid bytes: bad tag, truncated element, malformed varint or invalid UTF-8.
 */
public final class DecodeException extends Exception {
    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }
}
