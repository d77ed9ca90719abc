package io.krpc.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binary encoding of {@link Value}s.
 *
 * <ul>
 *   <li>double/float: little-endian IEEE-754, 8 and 4 bytes</li>
 *   <li>int32/int64/enum: zig-zag varint</li>
 *   <li>uint32/uint64/object handle: varint</li>
 *   <li>bool: one byte, 0 or 1</li>
 *   <li>string/bytes: varint length, then the raw bytes (strings as UTF-8)</li>
 *   <li>null: varint 0, the same bytes as a null handle</li>
 *   <li>message: varint length, then the message body</li>
 *   <li>list/set/tuple: varint count, then each element; dictionary: count, then key/value pairs</li>
 * </ul>
 *
 * <p>The encoding is not self-describing: decoding needs the {@link ValueType} the caller expects.
 */
public final class ValueCodec {

    private static final ProtocolCodec MESSAGES = new ProtocolCodec();

    private ValueCodec() {}

    public static byte[] encode(Value value) {
        BinaryWriter writer = new BinaryWriter();
        write(writer, value);
        return writer.toByteArray();
    }

    /**
     * Decodes a complete value; trailing bytes are an error.
     */
    public static Value decode(byte[] data, ValueType type) throws DecodeException {
        BinaryReader reader = new BinaryReader(data);
        Value value = read(reader, type);
        reader.expectEnd();
        return value;
    }

    public static void write(BinaryWriter writer, Value value) {
        switch (value.kind()) {
            case NULL -> writer.writeVarLong(0L);
            case DOUBLE -> writer.writeDouble(((Value.DoubleValue) value).value());
            case FLOAT -> writer.writeFloat(((Value.FloatValue) value).value());
            case INT32 -> writer.writeZigZagInt(((Value.Int32Value) value).value());
            case INT64 -> writer.writeZigZagLong(((Value.Int64Value) value).value());
            case UINT32 -> writer.writeVarLong(((Value.UInt32Value) value).value());
            case UINT64 -> writer.writeVarLong(((Value.UInt64Value) value).value());
            case BOOL -> writer.writeBool(((Value.BoolValue) value).value());
            case STRING -> writer.writeString(((Value.StringValue) value).value());
            case BYTES -> writer.writeBytes(((Value.BytesValue) value).value());
            case ENUM -> writer.writeZigZagInt(((Value.EnumValue) value).value());
            case OBJECT_HANDLE -> writer.writeVarLong(((Value.HandleValue) value).handle());
            case MESSAGE -> writer.writeBytes(MESSAGES.encode(((Value.MessageValue) value).message()));
            case LIST -> writeAll(writer, ((Value.ListValue) value).items());
            case SET -> writeAll(writer, ((Value.SetValue) value).items());
            case TUPLE -> writeAll(writer, ((Value.TupleValue) value).items());
            case DICTIONARY -> {
                Map<Value, Value> entries = ((Value.DictionaryValue) value).entries();
                writer.writeCount(entries.size());
                for (Map.Entry<Value, Value> entry : entries.entrySet()) {
                    write(writer, entry.getKey());
                    write(writer, entry.getValue());
                }
            }
        }
    }

    public static Value read(BinaryReader reader, ValueType type) throws DecodeException {
        return switch (type.kind()) {
            case NULL -> {
                long raw = reader.readVarLong();
                if (raw != 0L) {
                    throw new DecodeException("Expected null, found " + Long.toUnsignedString(raw));
                }
                yield Value.nullValue();
            }
            case DOUBLE -> Value.of(reader.readDouble());
            case FLOAT -> Value.of(reader.readFloat());
            case INT32 -> Value.of(reader.readZigZagInt());
            case INT64 -> Value.of(reader.readZigZagLong());
            case UINT32 -> Value.uint32(reader.readUInt32());
            case UINT64 -> Value.uint64(reader.readVarLong());
            case BOOL -> Value.of(reader.readBool());
            case STRING -> Value.of(reader.readString());
            case BYTES -> Value.of(reader.readBytes());
            case ENUM -> Value.enumValue(reader.readZigZagInt());
            case OBJECT_HANDLE -> Value.handle(reader.readVarLong());
            case MESSAGE -> Value.message(MESSAGES.decode(reader.readBytes(), type.messageType()));
            case LIST -> Value.list(readAll(reader, reader.readCount(), type.element(0)));
            case SET -> {
                int count = reader.readCount();
                Set<Value> items = new LinkedHashSet<>();
                for (int i = 0; i < count; i++) {
                    if (!items.add(read(reader, type.element(0)))) {
                        throw new DecodeException("Duplicate set element at index " + i);
                    }
                }
                yield Value.set(items);
            }
            case TUPLE -> {
                int count = reader.readCount();
                if (count != type.elements().size()) {
                    throw new DecodeException("Tuple arity mismatch: expected " + type.elements().size() + ", found " + count);
                }
                List<Value> items = new ArrayList<>(count);
                for (ValueType element : type.elements()) {
                    items.add(read(reader, element));
                }
                yield new Value.TupleValue(items);
            }
            case DICTIONARY -> {
                int count = reader.readCount();
                Map<Value, Value> entries = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    Value key = read(reader, type.element(0));
                    Value value = read(reader, type.element(1));
                    if (entries.putIfAbsent(key, value) != null) {
                        throw new DecodeException("Duplicate dictionary key at index " + i);
                    }
                }
                yield Value.dictionary(entries);
            }
        };
    }

    /**
     * True when {@code value} has the shape {@code type}, recursively. A null value or a null
     * handle fits any handle shape.
     */
    public static boolean conforms(Value value, ValueType type) {
        if (value.kind() == Value.Kind.NULL) {
            return type.kind() == Value.Kind.NULL || type.kind() == Value.Kind.OBJECT_HANDLE;
        }
        if (value.kind() != type.kind()) {
            return false;
        }
        return switch (value.kind()) {
            case MESSAGE -> ((Value.MessageValue) value).message().type() == type.messageType();
            case LIST -> allConform(((Value.ListValue) value).items(), type.element(0));
            case SET -> allConform(((Value.SetValue) value).items(), type.element(0));
            case DICTIONARY -> ((Value.DictionaryValue) value).entries().entrySet().stream()
                    .allMatch(e -> conforms(e.getKey(), type.element(0)) && conforms(e.getValue(), type.element(1)));
            case TUPLE -> {
                List<Value> items = ((Value.TupleValue) value).items();
                if (items.size() != type.elements().size()) {
                    yield false;
                }
                for (int i = 0; i < items.size(); i++) {
                    if (!conforms(items.get(i), type.element(i))) {
                        yield false;
                    }
                }
                yield true;
            }
            default -> true;
        };
    }

    /**
     * Rewrites every {@link Value.NullValue} sitting in a handle slot of {@code type} as the null
     * handle, so that decoding the encoded result yields an equal value. {@code value} must
     * {@link #conforms conform} to {@code type}.
     */
    public static Value normalize(Value value, ValueType type) {
        if (type.kind() == Value.Kind.OBJECT_HANDLE) {
            return value.kind() == Value.Kind.NULL ? Value.handle(0L) : value;
        }
        return switch (value.kind()) {
            case LIST -> {
                List<Value> items = new ArrayList<>();
                for (Value item : ((Value.ListValue) value).items()) {
                    items.add(normalize(item, type.element(0)));
                }
                yield Value.list(items);
            }
            case SET -> {
                Set<Value> items = new LinkedHashSet<>();
                for (Value item : ((Value.SetValue) value).items()) {
                    items.add(normalize(item, type.element(0)));
                }
                yield Value.set(items);
            }
            case DICTIONARY -> {
                Map<Value, Value> entries = new LinkedHashMap<>();
                ((Value.DictionaryValue) value).entries().forEach((k, v) ->
                        entries.put(normalize(k, type.element(0)), normalize(v, type.element(1))));
                yield Value.dictionary(entries);
            }
            case TUPLE -> {
                List<Value> items = ((Value.TupleValue) value).items();
                Value[] normalized = new Value[items.size()];
                for (int i = 0; i < normalized.length; i++) {
                    normalized[i] = normalize(items.get(i), type.element(i));
                }
                yield Value.tuple(normalized);
            }
            default -> value;
        };
    }

    private static boolean allConform(Iterable<Value> items, ValueType type) {
        for (Value item : items) {
            if (!conforms(item, type)) {
                return false;
            }
        }
        return true;
    }

    private static void writeAll(BinaryWriter writer, java.util.Collection<Value> items) {
        writer.writeCount(items.size());
        for (Value item : items) {
            write(writer, item);
        }
    }

    private static List<Value> readAll(BinaryReader reader, int count, ValueType element) throws DecodeException {
        List<Value> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(read(reader, element));
        }
        return items;
    }
}
