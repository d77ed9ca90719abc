package io.krpc.server.core;

import io.krpc.core.DecodeException;
import io.krpc.core.Framing;
import io.krpc.core.KrpcException;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded accumulation buffer that cuts complete frames out of a byte stream.
 *
 * <p>Used by exactly one I/O thread per connection. Partial frames stay buffered between calls.
 */
final class ReceiveBuffer {

    private static final int INITIAL_SIZE = 4096;

    private final int capacity;
    private final int maxFrameLength;
    private byte[] data;
    private int size;

    ReceiveBuffer(int capacity, int maxFrameLength) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.maxFrameLength = maxFrameLength;
        this.data = new byte[Math.min(INITIAL_SIZE, capacity)];
    }

    /**
     * Appends {@code incoming} and returns every frame payload completed by it, in order.
     *
     * @throws KrpcException.RequestBufferOverflow if the buffer fills, or a frame announces a
     *         length that can never fit, before a complete frame is available
     * @throws DecodeException if a length prefix is malformed or above the frame length limit
     */
    List<byte[]> append(ByteBuffer incoming) throws DecodeException {
        List<byte[]> frames = new ArrayList<>();
        while (incoming.hasRemaining()) {
            int chunk = Math.min(incoming.remaining(), capacity - size);
            ensureSize(size + chunk);
            incoming.get(data, size, chunk);
            size += chunk;
            drainFrames(frames);
        }
        return frames;
    }

    int size() {
        return size;
    }

    int capacity() {
        return capacity;
    }

    private void drainFrames(List<byte[]> frames) throws DecodeException {
        int offset = 0;
        while (true) {
            Framing.FrameResult result = Framing.decodeMessage(data, offset, size - offset);
            if (result instanceof Framing.Frame frame) {
                if (frame.payload().length > maxFrameLength) {
                    throw new DecodeException("Frame of " + frame.payload().length + " bytes exceeds limit " + maxFrameLength);
                }
                frames.add(frame.payload());
                offset += frame.consumed();
                continue;
            }
            Framing.NeedMoreData needMore = (Framing.NeedMoreData) result;
            if (needMore.lengthKnown()) {
                if (needMore.requiredBytes() > capacity) {
                    throw new KrpcException.RequestBufferOverflow(capacity);
                }
                int announced = needMore.requiredBytes() - prefixLength(offset);
                if (announced > maxFrameLength) {
                    throw new DecodeException("Frame of " + announced + " bytes exceeds limit " + maxFrameLength);
                }
            }
            break;
        }
        if (offset > 0) {
            System.arraycopy(data, offset, data, 0, size - offset);
            size -= offset;
        }
        if (size == capacity) {
            throw new KrpcException.RequestBufferOverflow(capacity);
        }
    }

    private int prefixLength(int offset) {
        int length = 1;
        while ((data[offset + length - 1] & 0x80) != 0) {
            length++;
        }
        return length;
    }

    private void ensureSize(int required) {
        if (required <= data.length) {
            return;
        }
        int newSize = data.length;
        while (newSize < required) {
            newSize = (int) Math.min((long) newSize * 2, capacity);
        }
        byte[] grown = new byte[newSize];
        System.arraycopy(data, 0, grown, 0, size);
        data = grown;
    }
}
