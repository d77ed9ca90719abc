package io.krpc.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A value that can cross the wire.
 *
 * <p>Closed union: every value has exactly one {@link Kind}, and encoders and decoders switch
 * over that kind exhaustively. Containers hold fully resolved values.
 */
public sealed interface Value permits
        Value.NullValue, Value.DoubleValue, Value.FloatValue,
        Value.Int32Value, Value.Int64Value, Value.UInt32Value, Value.UInt64Value,
        Value.BoolValue, Value.StringValue, Value.BytesValue, Value.EnumValue,
        Value.HandleValue, Value.MessageValue,
        Value.ListValue, Value.DictionaryValue, Value.SetValue, Value.TupleValue {

    enum Kind {
        NULL(0),
        DOUBLE(1),
        FLOAT(2),
        INT32(3),
        INT64(4),
        UINT32(5),
        UINT64(6),
        BOOL(7),
        STRING(8),
        BYTES(9),
        ENUM(10),
        OBJECT_HANDLE(11),
        MESSAGE(12),
        LIST(13),
        DICTIONARY(14),
        SET(15),
        TUPLE(16);

        private final int code;

        Kind(int code) {
            this.code = code;
        }

        /** Stable numeric code used when a type description goes over the wire. */
        public int code() {
            return code;
        }

        public static Kind fromCode(int code) throws DecodeException {
            for (Kind kind : values()) {
                if (kind.code == code) {
                    return kind;
                }
            }
            throw new DecodeException("Unknown value kind: " + code);
        }
    }

    Kind kind();

    static NullValue nullValue() {
        return NullValue.INSTANCE;
    }

    static DoubleValue of(double value) {
        return new DoubleValue(value);
    }

    static FloatValue of(float value) {
        return new FloatValue(value);
    }

    static Int32Value of(int value) {
        return new Int32Value(value);
    }

    static Int64Value of(long value) {
        return new Int64Value(value);
    }

    static BoolValue of(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static BytesValue of(byte[] value) {
        return new BytesValue(value);
    }

    static UInt32Value uint32(long value) {
        return new UInt32Value(value);
    }

    static UInt64Value uint64(long value) {
        return new UInt64Value(value);
    }

    static EnumValue enumValue(int value) {
        return new EnumValue(value);
    }

    static HandleValue handle(long handle) {
        return new HandleValue(handle);
    }

    static MessageValue message(ProtocolMessage message) {
        return new MessageValue(message);
    }

    static ListValue list(List<? extends Value> items) {
        return new ListValue(List.copyOf(items));
    }

    static ListValue list(Value... items) {
        return new ListValue(Arrays.asList(items));
    }

    static SetValue set(Set<? extends Value> items) {
        return new SetValue(new LinkedHashSet<Value>(items));
    }

    static DictionaryValue dictionary(Map<? extends Value, ? extends Value> entries) {
        return new DictionaryValue(new LinkedHashMap<Value, Value>(entries));
    }

    static TupleValue tuple(Value... items) {
        return new TupleValue(Arrays.asList(items));
    }

    final class NullValue implements Value {
        static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record DoubleValue(double value) implements Value {
        @Override
        public Kind kind() {
            return Kind.DOUBLE;
        }
    }

    record FloatValue(float value) implements Value {
        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }
    }

    record Int32Value(int value) implements Value {
        @Override
        public Kind kind() {
            return Kind.INT32;
        }
    }

    record Int64Value(long value) implements Value {
        @Override
        public Kind kind() {
            return Kind.INT64;
        }
    }

    /**
     * Unsigned 32-bit integer held in the low 32 bits of a long.
     */
    record UInt32Value(long value) implements Value {
        public UInt32Value {
            if ((value & 0xFFFFFFFF00000000L) != 0) {
                throw new IllegalArgumentException("uint32 out of range: " + value);
            }
        }

        @Override
        public Kind kind() {
            return Kind.UINT32;
        }
    }

    /**
     * Unsigned 64-bit integer; the long is read as unsigned.
     */
    record UInt64Value(long value) implements Value {
        @Override
        public Kind kind() {
            return Kind.UINT64;
        }

        @Override
        public String toString() {
            return "UInt64Value[value=" + Long.toUnsignedString(value) + "]";
        }
    }

    final class BoolValue implements Value {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        private final boolean value;

        private BoolValue(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record BytesValue(byte[] value) implements Value {
        public BytesValue {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public Kind kind() {
            return Kind.BYTES;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[length=" + value.length + "]";
        }
    }

    record EnumValue(int value) implements Value {
        @Override
        public Kind kind() {
            return Kind.ENUM;
        }
    }

    /**
     * Reference to a host instance held by the object store. Handle 0 stands for null.
     */
    record HandleValue(long handle) implements Value {
        public boolean isNull() {
            return handle == 0L;
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT_HANDLE;
        }

        @Override
        public String toString() {
            return "HandleValue[handle=" + Long.toUnsignedString(handle) + "]";
        }
    }

    record MessageValue(ProtocolMessage message) implements Value {
        public MessageValue {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Kind kind() {
            return Kind.MESSAGE;
        }
    }

    record ListValue(List<Value> items) implements Value {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }
    }

    record SetValue(Set<Value> items) implements Value {
        public SetValue {
            items = Collections.unmodifiableSet(new LinkedHashSet<>(items));
        }

        @Override
        public Kind kind() {
            return Kind.SET;
        }
    }

    /**
     * Dictionary preserving insertion order; equality ignores order.
     */
    record DictionaryValue(Map<Value, Value> entries) implements Value {
        public DictionaryValue {
            Map<Value, Value> copy = new LinkedHashMap<>();
            entries.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value")));
            entries = Collections.unmodifiableMap(copy);
        }

        @Override
        public Kind kind() {
            return Kind.DICTIONARY;
        }
    }

    record TupleValue(List<Value> items) implements Value {
        public TupleValue {
            items = Collections.unmodifiableList(new ArrayList<>(items));
            items.forEach(item -> Objects.requireNonNull(item, "item"));
        }

        public int arity() {
            return items.size();
        }

        @Override
        public Kind kind() {
            return Kind.TUPLE;
        }
    }
}
