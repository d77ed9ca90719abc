package io.krpc.core;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class BinaryReader {
    private static final int VAR_LONG_MAX_BYTES = 10;

    private final byte[] data;
    private int cursor;

    public BinaryReader(byte[] data) {
        this.data = data.clone();
    }

    public long readVarLong() throws DecodeException {
        long result = 0L;

        for (int numRead = 0; numRead < VAR_LONG_MAX_BYTES; numRead++) {
            if (!hasRemaining()) {
                throw new DecodeException("Unexpected end of data while reading varint");
            }

            int read = readUnsignedByte();

            if (numRead == VAR_LONG_MAX_BYTES - 1 && (read & 0xFE) != 0) {
                throw new DecodeException("Varint overflows 64 bits");
            }

            result |= (long) (read & 0x7F) << (7 * numRead);

            if ((read & 0x80) == 0) {
                return result;
            }
        }

        throw new DecodeException("Varint is too long");
    }

    public long readUInt32() throws DecodeException {
        long value = readVarLong();

        if ((value & 0xFFFFFFFF00000000L) != 0) {
            throw new DecodeException("Varint out of uint32 range: " + Long.toUnsignedString(value));
        }

        return value;
    }

    public int readZigZagInt() throws DecodeException {
        int raw = (int) readUInt32();
        return (raw >>> 1) ^ -(raw & 1);
    }

    public long readZigZagLong() throws DecodeException {
        long raw = readVarLong();
        return (raw >>> 1) ^ -(raw & 1);
    }

    /**
     * Reads an element or byte count. Every encoded element occupies at least one byte,
     * so a count larger than the remaining data can never be satisfied.
     */
    public int readCount() throws DecodeException {
        long count = readUInt32();

        if (count > remaining()) {
            throw new DecodeException("Count exceeds remaining data: " + count);
        }

        return (int) count;
    }

    public double readDouble() throws DecodeException {
        return Double.longBitsToDouble(readLittleEndian(Long.BYTES));
    }

    public float readFloat() throws DecodeException {
        return Float.intBitsToFloat((int) readLittleEndian(Integer.BYTES));
    }

    public boolean readBool() throws DecodeException {
        int value = readUnsignedByte();

        if (value > 1) {
            throw new DecodeException("Invalid boolean byte: " + value);
        }

        return value == 1;
    }

    public int readUnsignedByte() throws DecodeException {
        return readByte() & 0xFF;
    }

    public byte readByte() throws DecodeException {
        if (!hasRemaining()) {
            throw new DecodeException("Unexpected end of data");
        }

        return data[cursor++];
    }

    public byte[] readRawBytes(int byteCount) throws DecodeException {
        if (byteCount < 0 || byteCount > remaining()) {
            throw new DecodeException("Requested byte count out of bounds: " + byteCount);
        }

        byte[] out = new byte[byteCount];
        System.arraycopy(data, cursor, out, 0, byteCount);
        cursor += byteCount;
        return out;
    }

    public byte[] readBytes() throws DecodeException {
        return readRawBytes(readCount());
    }

    public String readString() throws DecodeException {
        byte[] utf8 = readBytes();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        try {
            return decoder.decode(ByteBuffer.wrap(utf8)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Invalid UTF-8 string");
        }
    }

    public int remaining() {
        return data.length - cursor;
    }

    public boolean hasRemaining() {
        return cursor < data.length;
    }

    public void expectEnd() throws DecodeException {
        if (hasRemaining()) {
            throw new DecodeException("Unexpected trailing bytes: " + remaining());
        }
    }

    private long readLittleEndian(int byteCount) throws DecodeException {
        if (remaining() < byteCount) {
            throw new DecodeException("Unexpected end of data while reading " + byteCount + "-byte value");
        }

        long result = 0L;
        for (int i = 0; i < byteCount; i++) {
            result |= (long) readUnsignedByte() << (i * 8);
        }

        return result;
    }
}
