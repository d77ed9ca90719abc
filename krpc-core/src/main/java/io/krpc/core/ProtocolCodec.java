package io.krpc.core;

import io.krpc.core.ProtocolMessage.Argument;
import io.krpc.core.ProtocolMessage.ConnectionRequest;
import io.krpc.core.ProtocolMessage.ConnectionResponse;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureError;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.ProtocolMessage.Request;
import io.krpc.core.ProtocolMessage.Response;
import io.krpc.core.ProtocolMessage.ServiceDescription;
import io.krpc.core.ProtocolMessage.Services;
import io.krpc.core.ProtocolMessage.Status;
import io.krpc.core.ProtocolMessage.StreamResult;
import io.krpc.core.ProtocolMessage.StreamUpdate;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes and decodes message bodies. Framing is applied separately by {@link Framing}.
 */
public final class ProtocolCodec {

    private static final int RESULT_SUCCESS = 0;
    private static final int RESULT_FAILURE = 1;

    public byte[] encode(ProtocolMessage message) {
        BinaryWriter writer = new BinaryWriter();
        write(writer, message);
        return writer.toByteArray();
    }

    /**
     * Encodes and frames a message, ready to be written to a socket.
     */
    public byte[] encodeFramed(ProtocolMessage message) {
        return Framing.encodeMessage(encode(message));
    }

    public ProtocolMessage decode(byte[] payload, MessageType expected) throws DecodeException {
        BinaryReader reader = new BinaryReader(payload);
        ProtocolMessage message = read(reader, expected);
        reader.expectEnd();
        return message;
    }

    public ConnectionRequest decodeConnectionRequest(byte[] payload) throws DecodeException {
        return (ConnectionRequest) decode(payload, MessageType.CONNECTION_REQUEST);
    }

    public ConnectionResponse decodeConnectionResponse(byte[] payload) throws DecodeException {
        return (ConnectionResponse) decode(payload, MessageType.CONNECTION_RESPONSE);
    }

    public Request decodeRequest(byte[] payload) throws DecodeException {
        return (Request) decode(payload, MessageType.REQUEST);
    }

    public Response decodeResponse(byte[] payload) throws DecodeException {
        return (Response) decode(payload, MessageType.RESPONSE);
    }

    public StreamUpdate decodeStreamUpdate(byte[] payload) throws DecodeException {
        return (StreamUpdate) decode(payload, MessageType.STREAM_UPDATE);
    }

    private void write(BinaryWriter writer, ProtocolMessage message) {
        switch (message.type()) {
            case CONNECTION_REQUEST -> {
                ConnectionRequest request = (ConnectionRequest) message;
                writer.writeVarInt(request.connectionType().ordinal());
                writer.writeString(request.clientName());
                writer.writeBytes(request.clientIdentifier());
            }
            case CONNECTION_RESPONSE -> {
                ConnectionResponse response = (ConnectionResponse) message;
                writer.writeVarInt(response.status().ordinal());
                writer.writeString(response.message());
                writer.writeBytes(response.clientIdentifier());
            }
            case PROCEDURE_CALL -> writeCall(writer, (ProcedureCall) message);
            case REQUEST -> {
                List<ProcedureCall> calls = ((Request) message).calls();
                writer.writeCount(calls.size());
                for (ProcedureCall call : calls) {
                    writeCall(writer, call);
                }
            }
            case RESPONSE -> {
                List<ProcedureResult> results = ((Response) message).results();
                writer.writeCount(results.size());
                for (ProcedureResult result : results) {
                    writeResult(writer, result);
                }
            }
            case STREAM_UPDATE -> {
                List<StreamResult> results = ((StreamUpdate) message).results();
                writer.writeCount(results.size());
                for (StreamResult result : results) {
                    writer.writeVarLong(result.streamId());
                    writeResult(writer, result.result());
                }
            }
            case STATUS -> writeStatus(writer, (Status) message);
            case SERVICES -> {
                List<ServiceDescription> services = ((Services) message).services();
                writer.writeCount(services.size());
                for (ServiceDescription service : services) {
                    writer.writeString(service.name());
                    writer.writeCount(service.procedures().size());
                    for (ProcedureSignature procedure : service.procedures()) {
                        writeSignature(writer, procedure);
                    }
                }
            }
        }
    }

    private ProtocolMessage read(BinaryReader reader, MessageType type) throws DecodeException {
        return switch (type) {
            case CONNECTION_REQUEST -> new ConnectionRequest(
                    readEnum(reader, ProtocolMessage.ConnectionType.values(), "connectionType"),
                    reader.readString(),
                    reader.readBytes());
            case CONNECTION_RESPONSE -> new ConnectionResponse(
                    readEnum(reader, ProtocolMessage.ConnectionStatus.values(), "status"),
                    reader.readString(),
                    reader.readBytes());
            case PROCEDURE_CALL -> readCall(reader);
            case REQUEST -> {
                int count = reader.readCount();
                if (count == 0) {
                    throw new DecodeException("Request contains no calls");
                }
                List<ProcedureCall> calls = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    calls.add(readCall(reader));
                }
                yield new Request(calls);
            }
            case RESPONSE -> {
                int count = reader.readCount();
                List<ProcedureResult> results = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    results.add(readResult(reader));
                }
                yield new Response(results);
            }
            case STREAM_UPDATE -> {
                int count = reader.readCount();
                List<StreamResult> results = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    results.add(new StreamResult(reader.readVarLong(), readResult(reader)));
                }
                yield new StreamUpdate(results);
            }
            case STATUS -> readStatus(reader);
            case SERVICES -> {
                int count = reader.readCount();
                List<ServiceDescription> services = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    String name = reader.readString();
                    int procedureCount = reader.readCount();
                    List<ProcedureSignature> procedures = new ArrayList<>(procedureCount);
                    for (int p = 0; p < procedureCount; p++) {
                        procedures.add(readSignature(reader, name));
                    }
                    services.add(new ServiceDescription(name, procedures));
                }
                yield new Services(services);
            }
        };
    }

    private static void writeCall(BinaryWriter writer, ProcedureCall call) {
        writer.writeString(call.service());
        writer.writeString(call.procedure());
        writer.writeCount(call.arguments().size());
        for (Argument argument : call.arguments()) {
            writer.writeVarInt(argument.position());
            writer.writeBytes(argument.value());
        }
    }

    private static ProcedureCall readCall(BinaryReader reader) throws DecodeException {
        String service = reader.readString();
        String procedure = reader.readString();
        int count = reader.readCount();
        List<Argument> arguments = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long position = reader.readUInt32();
            if (position > Integer.MAX_VALUE) {
                throw new DecodeException("Argument position out of range: " + position);
            }
            arguments.add(new Argument((int) position, reader.readBytes()));
        }
        return new ProcedureCall(service, procedure, arguments);
    }

    private static void writeResult(BinaryWriter writer, ProcedureResult result) {
        if (result instanceof ProcedureResult.Success success) {
            writer.writeByte(RESULT_SUCCESS);
            writer.writeBytes(success.value());
        } else {
            ProcedureError error = ((ProcedureResult.Failure) result).error();
            writer.writeByte(RESULT_FAILURE);
            writer.writeVarInt(error.kind().ordinal());
            writer.writeString(error.service());
            writer.writeString(error.procedure());
            writer.writeString(error.description());
            writer.writeString(error.faultType());
        }
    }

    private static ProcedureResult readResult(BinaryReader reader) throws DecodeException {
        int tag = reader.readUnsignedByte();
        if (tag == RESULT_SUCCESS) {
            return new ProcedureResult.Success(reader.readBytes());
        }
        if (tag != RESULT_FAILURE) {
            throw new DecodeException("Unknown result tag: " + tag);
        }
        return new ProcedureResult.Failure(new ProcedureError(
                readEnum(reader, ProtocolMessage.ErrorKind.values(), "errorKind"),
                reader.readString(),
                reader.readString(),
                reader.readString(),
                reader.readString()));
    }

    private static void writeStatus(BinaryWriter writer, Status status) {
        writer.writeString(status.version());
        writer.writeVarLong(status.bytesRead());
        writer.writeVarLong(status.bytesWritten());
        writer.writeFloat(status.bytesReadRate());
        writer.writeFloat(status.bytesWrittenRate());
        writer.writeVarLong(status.rpcsExecuted());
        writer.writeFloat(status.rpcRate());
        writer.writeVarInt(status.maxCallsPerTick());
        writer.writeVarLong(status.maxTimePerTickMicros());
        writer.writeBool(status.adaptiveRateControl());
        writer.writeBool(status.blockingReceive());
        writer.writeVarLong(status.receiveTimeoutMicros());
        writer.writeFloat(status.timePerRpcTickMicros());
        writer.writeFloat(status.execTimePerRpcTickMicros());
        writer.writeVarInt(status.streamRpcs());
        writer.writeVarLong(status.streamRpcsExecuted());
        writer.writeFloat(status.streamRpcRate());
        writer.writeFloat(status.timePerStreamTickMicros());
        writer.writeVarInt(status.connectedClients());
    }

    private static Status readStatus(BinaryReader reader) throws DecodeException {
        return new Status(
                reader.readString(),
                reader.readVarLong(),
                reader.readVarLong(),
                reader.readFloat(),
                reader.readFloat(),
                reader.readVarLong(),
                reader.readFloat(),
                (int) reader.readUInt32(),
                reader.readVarLong(),
                reader.readBool(),
                reader.readBool(),
                reader.readVarLong(),
                reader.readFloat(),
                reader.readFloat(),
                (int) reader.readUInt32(),
                reader.readVarLong(),
                reader.readFloat(),
                reader.readFloat(),
                (int) reader.readUInt32());
    }

    private static void writeSignature(BinaryWriter writer, ProcedureSignature signature) {
        writer.writeString(signature.name());
        writer.writeCount(signature.parameters().size());
        for (ProcedureSignature.Parameter parameter : signature.parameters()) {
            writer.writeString(parameter.name());
            writeType(writer, parameter.type());
            writer.writeBool(parameter.isOptional());
            if (parameter.isOptional()) {
                writer.writeBytes(ValueCodec.encode(parameter.defaultValue()));
            }
        }
        writeType(writer, signature.returnType());
    }

    private static ProcedureSignature readSignature(BinaryReader reader, String service) throws DecodeException {
        String name = reader.readString();
        int count = reader.readCount();
        List<ProcedureSignature.Parameter> parameters = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String parameterName = reader.readString();
            ValueType type = readType(reader);
            Value defaultValue = reader.readBool() ? ValueCodec.decode(reader.readBytes(), type) : null;
            parameters.add(new ProcedureSignature.Parameter(parameterName, type, defaultValue));
        }
        return new ProcedureSignature(service, name, parameters, readType(reader));
    }

    private static void writeType(BinaryWriter writer, ValueType type) {
        writer.writeVarInt(type.kind().code());
        switch (type.kind()) {
            case MESSAGE -> writer.writeVarInt(type.messageType().id());
            case LIST, SET, DICTIONARY, TUPLE -> {
                writer.writeCount(type.elements().size());
                for (ValueType element : type.elements()) {
                    writeType(writer, element);
                }
            }
            default -> {
            }
        }
    }

    private static ValueType readType(BinaryReader reader) throws DecodeException {
        Value.Kind kind = Value.Kind.fromCode((int) reader.readUInt32());
        return switch (kind) {
            case MESSAGE -> ValueType.message(MessageType.fromId((int) reader.readUInt32()));
            case LIST, SET -> {
                List<ValueType> elements = readTypes(reader, 1);
                yield kind == Value.Kind.LIST ? ValueType.list(elements.get(0)) : ValueType.set(elements.get(0));
            }
            case DICTIONARY -> {
                List<ValueType> elements = readTypes(reader, 2);
                yield ValueType.dictionary(elements.get(0), elements.get(1));
            }
            case TUPLE -> ValueType.tuple(readTypes(reader, -1));
            default -> ValueType.of(kind);
        };
    }

    private static List<ValueType> readTypes(BinaryReader reader, int expectedCount) throws DecodeException {
        int count = reader.readCount();
        if (expectedCount >= 0 && count != expectedCount) {
            throw new DecodeException("Expected " + expectedCount + " element types, found " + count);
        }
        List<ValueType> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            elements.add(readType(reader));
        }
        return elements;
    }

    private static <E extends Enum<E>> E readEnum(BinaryReader reader, E[] values, String fieldName)
            throws DecodeException {
        long ordinal = reader.readUInt32();
        if (ordinal >= values.length) {
            throw new DecodeException(fieldName + " out of bounds: " + ordinal);
        }
        return values[(int) ordinal];
    }
}
