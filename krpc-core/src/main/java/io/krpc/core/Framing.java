package io.krpc.core;

import java.nio.ByteBuffer;

/**
 * Length-delimited framing: {@code [varint byte length][payload]}.
 *
 * <p>Requests, responses, handshake messages and stream pushes all use the same framing.
 */
public final class Framing {

    private static final int LENGTH_PREFIX_MAX_BYTES = 5;

    private Framing() {}

    /**
     * Result of trying to cut one frame from the front of a buffer.
     */
    public sealed interface FrameResult permits Frame, NeedMoreData {}

    /**
     * A complete frame.
     *
     * @param payload the frame payload
     * @param consumed number of bytes the frame occupied, prefix included
     */
    public record Frame(byte[] payload, int consumed) implements FrameResult {}

    /**
     * Not enough bytes yet. Not an error: retry once more bytes arrive.
     *
     * @param requiredBytes total bytes needed for the frame once its length prefix is known,
     *                      or {@code -1} while the prefix itself is incomplete
     */
    public record NeedMoreData(int requiredBytes) implements FrameResult {
        public boolean lengthKnown() {
            return requiredBytes >= 0;
        }
    }

    public static byte[] encodeMessage(byte[] payload) {
        BinaryWriter writer = new BinaryWriter();
        writer.writeCount(payload.length);
        writer.writeRawBytes(payload);
        return writer.toByteArray();
    }

    /**
     * Decodes the first frame in {@code buffer} between its position and limit. The buffer's
     * position, limit and contents are never modified; callers drop {@link Frame#consumed()}
     * bytes themselves.
     *
     * @throws DecodeException if the length prefix is malformed or exceeds {@code Integer.MAX_VALUE}
     */
    public static FrameResult decodeMessage(ByteBuffer buffer) throws DecodeException {
        ByteBuffer view = buffer.duplicate();
        int start = view.position();
        long length = 0L;
        int prefixBytes = 0;

        while (true) {
            if (!view.hasRemaining()) {
                return new NeedMoreData(-1);
            }
            int read = view.get() & 0xFF;
            length |= (long) (read & 0x7F) << (7 * prefixBytes);
            prefixBytes++;
            if ((read & 0x80) == 0) {
                break;
            }
            if (prefixBytes == LENGTH_PREFIX_MAX_BYTES) {
                throw new DecodeException("Frame length prefix is too long");
            }
        }

        if (length > Integer.MAX_VALUE - LENGTH_PREFIX_MAX_BYTES) {
            throw new DecodeException("Frame length out of range: " + length);
        }

        int total = prefixBytes + (int) length;
        if (view.limit() - start < total) {
            return new NeedMoreData(total);
        }

        byte[] payload = new byte[(int) length];
        view.get(payload);
        return new Frame(payload, total);
    }

    public static FrameResult decodeMessage(byte[] data, int offset, int length) throws DecodeException {
        return decodeMessage(ByteBuffer.wrap(data, offset, length));
    }
}
