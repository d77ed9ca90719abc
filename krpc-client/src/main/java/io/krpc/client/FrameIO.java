package io.krpc.client;

import io.krpc.core.DecodeException;
import io.krpc.core.Framing;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads length-delimited frames from a blocking stream.
 */
final class FrameIO {

    private static final int MAX_PREFIX = 5;

    private FrameIO() {}

    /**
     * @return the next frame payload, or null if the stream ended cleanly between frames
     */
    static byte[] readFrame(InputStream input) throws IOException {
        byte[] prefix = new byte[MAX_PREFIX];
        int length = 0;
        while (true) {
            int next = input.read();
            if (next < 0) {
                if (length == 0) {
                    return null;
                }
                throw new EOFException("Connection closed inside a frame header");
            }
            prefix[length++] = (byte) next;
            Framing.FrameResult result;
            try {
                result = Framing.decodeMessage(prefix, 0, length);
            } catch (DecodeException e) {
                throw new IOException("Malformed frame header", e);
            }
            if (result instanceof Framing.Frame frame) {
                return frame.payload();
            }
            Framing.NeedMoreData needMore = (Framing.NeedMoreData) result;
            if (needMore.lengthKnown()) {
                int payloadLength = needMore.requiredBytes() - length;
                byte[] payload = input.readNBytes(payloadLength);
                if (payload.length < payloadLength) {
                    throw new EOFException("Connection closed inside a frame");
                }
                return payload;
            }
        }
    }

    static byte[] requireFrame(InputStream input) throws IOException {
        byte[] frame = readFrame(input);
        if (frame == null) {
            throw new EOFException("Connection closed by server");
        }
        return frame;
    }
}
