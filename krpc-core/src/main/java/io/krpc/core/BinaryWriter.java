package io.krpc.core;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

public final class BinaryWriter {
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    /**
     * Unsigned LEB128 varint of all 64 bits.
     */
    public void writeVarLong(long value) {
        long current = value;

        while ((current & ~0x7FL) != 0) {
            output.write((int) ((current & 0x7F) | 0x80));
            current >>>= 7;
        }

        output.write((int) current);
    }

    public void writeVarInt(int value) {
        writeVarLong(Integer.toUnsignedLong(value));
    }

    public void writeZigZagInt(int value) {
        writeVarInt((value << 1) ^ (value >> 31));
    }

    public void writeZigZagLong(long value) {
        writeVarLong((value << 1) ^ (value >> 63));
    }

    public void writeCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative count: " + count);
        }

        writeVarInt(count);
    }

    public void writeDouble(double value) {
        writeLittleEndian(Double.doubleToRawLongBits(value), Long.BYTES);
    }

    public void writeFloat(float value) {
        writeLittleEndian(Float.floatToRawIntBits(value), Integer.BYTES);
    }

    public void writeBool(boolean value) {
        output.write(value ? 1 : 0);
    }

    public void writeByte(int value) {
        output.write(value & 0xFF);
    }

    public void writeRawBytes(byte[] data) {
        output.writeBytes(data);
    }

    public void writeBytes(byte[] data) {
        writeCount(data.length);
        output.writeBytes(data);
    }

    public void writeString(String value) {
        writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public int size() {
        return output.size();
    }

    public byte[] toByteArray() {
        return output.toByteArray();
    }

    private void writeLittleEndian(long bits, int byteCount) {
        for (int i = 0; i < byteCount; i++) {
            output.write((int) (bits >>> (i * 8)) & 0xFF);
        }
    }
}
