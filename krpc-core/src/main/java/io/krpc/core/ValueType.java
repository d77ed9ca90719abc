package io.krpc.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The expected shape of an encoded value.
 *
 * <p>The wire format carries container sizes but not element types, so every decode is driven by
 * a shape taken from the static signature of the procedure being invoked.
 */
public final class ValueType {

    private static final ValueType[] SCALARS = new ValueType[Value.Kind.values().length];

    static {
        for (Value.Kind kind : Value.Kind.values()) {
            if (isScalar(kind)) {
                SCALARS[kind.ordinal()] = new ValueType(kind, List.of(), null);
            }
        }
    }

    public static final ValueType NULL = of(Value.Kind.NULL);
    public static final ValueType DOUBLE = of(Value.Kind.DOUBLE);
    public static final ValueType FLOAT = of(Value.Kind.FLOAT);
    public static final ValueType INT32 = of(Value.Kind.INT32);
    public static final ValueType INT64 = of(Value.Kind.INT64);
    public static final ValueType UINT32 = of(Value.Kind.UINT32);
    public static final ValueType UINT64 = of(Value.Kind.UINT64);
    public static final ValueType BOOL = of(Value.Kind.BOOL);
    public static final ValueType STRING = of(Value.Kind.STRING);
    public static final ValueType BYTES = of(Value.Kind.BYTES);
    public static final ValueType ENUM = of(Value.Kind.ENUM);
    public static final ValueType OBJECT_HANDLE = of(Value.Kind.OBJECT_HANDLE);

    private final Value.Kind kind;
    private final List<ValueType> elements;
    private final MessageType messageType;

    private ValueType(Value.Kind kind, List<ValueType> elements, MessageType messageType) {
        this.kind = kind;
        this.elements = elements;
        this.messageType = messageType;
    }

    /**
     * Shape of a value with no element types (numbers, strings, bytes, enums, handles, null).
     */
    public static ValueType of(Value.Kind kind) {
        Objects.requireNonNull(kind, "kind");
        if (!isScalar(kind)) {
            throw new IllegalArgumentException(kind + " needs element types or a message type");
        }
        return SCALARS[kind.ordinal()];
    }

    public static ValueType message(MessageType messageType) {
        return new ValueType(Value.Kind.MESSAGE, List.of(), Objects.requireNonNull(messageType, "messageType"));
    }

    public static ValueType list(ValueType element) {
        return new ValueType(Value.Kind.LIST, List.of(element), null);
    }

    public static ValueType set(ValueType element) {
        return new ValueType(Value.Kind.SET, List.of(element), null);
    }

    public static ValueType dictionary(ValueType key, ValueType value) {
        return new ValueType(Value.Kind.DICTIONARY, List.of(key, value), null);
    }

    public static ValueType tuple(ValueType... elements) {
        return tuple(Arrays.asList(elements));
    }

    public static ValueType tuple(List<ValueType> elements) {
        return new ValueType(Value.Kind.TUPLE, List.copyOf(elements), null);
    }

    public Value.Kind kind() {
        return kind;
    }

    /**
     * Element shapes: one for list and set, key then value for dictionary, one per slot for tuple.
     */
    public List<ValueType> elements() {
        return elements;
    }

    public ValueType element(int index) {
        return elements.get(index);
    }

    /**
     * Message type for {@link Value.Kind#MESSAGE} shapes, otherwise {@code null}.
     */
    public MessageType messageType() {
        return messageType;
    }

    private static boolean isScalar(Value.Kind kind) {
        switch (kind) {
            case MESSAGE:
            case LIST:
            case SET:
            case DICTIONARY:
            case TUPLE:
                return false;
            default:
                return true;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueType)) return false;
        ValueType other = (ValueType) o;
        return kind == other.kind && elements.equals(other.elements) && messageType == other.messageType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, elements, messageType);
    }

    @Override
    public String toString() {
        String name = kind.name().toLowerCase(java.util.Locale.ROOT);
        if (messageType != null) {
            return name + "<" + messageType.name().toLowerCase(java.util.Locale.ROOT) + ">";
        }
        if (elements.isEmpty() && kind != Value.Kind.TUPLE) {
            return name;
        }
        return elements.stream().map(ValueType::toString).collect(Collectors.joining(",", name + "<", ">"));
    }
}
