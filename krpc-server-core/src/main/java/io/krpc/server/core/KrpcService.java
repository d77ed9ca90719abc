package io.krpc.server.core;

import io.krpc.core.KrpcException;
import io.krpc.core.MessageType;
import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProcedureSignature.Parameter;
import io.krpc.core.ProtocolMessage;
import io.krpc.core.Value;
import io.krpc.core.ValueType;
import io.krpc.server.spi.CallContext;
import io.krpc.server.spi.ClientInfo;
import io.krpc.server.spi.ProcedureDispatcher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The built-in {@value #SERVICE} service: client identity, server status, service discovery and
 * stream management. Resolved ahead of the host's dispatcher.
 */
public final class KrpcService implements ProcedureDispatcher {

    public static final String SERVICE = "KRPC";

    static final ProcedureSignature GET_CLIENT_ID =
            ProcedureSignature.of(SERVICE, "GetClientID", ValueType.BYTES);
    static final ProcedureSignature GET_CLIENT_NAME =
            ProcedureSignature.of(SERVICE, "GetClientName", ValueType.STRING);
    static final ProcedureSignature GET_CLIENTS =
            ProcedureSignature.of(SERVICE, "GetClients",
                    ValueType.list(ValueType.tuple(ValueType.BYTES, ValueType.STRING, ValueType.STRING)));
    static final ProcedureSignature GET_STATUS =
            ProcedureSignature.of(SERVICE, "GetStatus", ValueType.message(MessageType.STATUS));
    static final ProcedureSignature GET_SERVICES =
            ProcedureSignature.of(SERVICE, "GetServices", ValueType.message(MessageType.SERVICES));
    static final ProcedureSignature ADD_STREAM =
            ProcedureSignature.of(SERVICE, "AddStream", ValueType.UINT64,
                    Parameter.required("call", ValueType.message(MessageType.PROCEDURE_CALL)));
    static final ProcedureSignature REMOVE_STREAM =
            ProcedureSignature.of(SERVICE, "RemoveStream", ValueType.NULL,
                    Parameter.required("id", ValueType.UINT64));

    private static final Map<String, ProcedureSignature> PROCEDURES = new LinkedHashMap<>();

    static {
        for (ProcedureSignature signature : List.of(GET_CLIENT_ID, GET_CLIENT_NAME, GET_CLIENTS, GET_STATUS,
                GET_SERVICES, ADD_STREAM, REMOVE_STREAM)) {
            PROCEDURES.put(signature.name(), signature);
        }
    }

    private final ServerContext context;

    KrpcService(ServerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public Optional<ProcedureSignature> lookup(String service, String procedure) {
        if (!SERVICE.equals(service)) {
            return Optional.empty();
        }
        return Optional.ofNullable(PROCEDURES.get(procedure));
    }

    @Override
    public Value invoke(CallContext call, ProcedureSignature procedure, List<Value> arguments) {
        ClientInfo client = call.client();
        switch (procedure.name()) {
            case "GetClientID":
                return Value.of(ClientIds.toBytes(client.id()));
            case "GetClientName":
                return Value.of(client.name());
            case "GetClients":
                return getClients();
            case "GetStatus":
                return Value.message(context.status());
            case "GetServices":
                return Value.message(context.services());
            case "AddStream": {
                ProtocolMessage message = ((Value.MessageValue) arguments.get(0)).message();
                long id = context.streams().addStream(client, (ProtocolMessage.ProcedureCall) message);
                return Value.uint64(id);
            }
            case "RemoveStream":
                context.streams().removeStream(client.id(), ((Value.UInt64Value) arguments.get(0)).value());
                return Value.nullValue();
            default:
                throw new KrpcException.UnknownProcedure(procedure.service(), procedure.name());
        }
    }

    @Override
    public List<ProcedureSignature> procedures() {
        return List.copyOf(PROCEDURES.values());
    }

    private Value getClients() {
        List<Value> clients = new ArrayList<>();
        for (ClientSession session : context.sessions().connectedSessions()) {
            ClientInfo info = session.info();
            clients.add(Value.tuple(Value.of(ClientIds.toBytes(info.id())), Value.of(info.name()), Value.of(info.address())));
        }
        return Value.list(clients);
    }
}
