package io.krpc.core;

public enum MessageType {
    CONNECTION_REQUEST(1),
    CONNECTION_RESPONSE(2),
    PROCEDURE_CALL(3),
    REQUEST(4),
    RESPONSE(5),
    STREAM_UPDATE(6),
    STATUS(7),
    SERVICES(8);

    private final int id;

    MessageType(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static MessageType fromId(int id) throws DecodeException {
        for (MessageType type : values()) {
            if (type.id == id) {
                return type;
            }
        }

        throw new DecodeException("Unknown message type id: " + id);
    }
}
