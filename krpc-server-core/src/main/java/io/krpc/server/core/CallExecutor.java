package io.krpc.server.core;

import io.krpc.core.DecodeException;
import io.krpc.core.KrpcException;
import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProtocolMessage.Argument;
import io.krpc.core.ProtocolMessage.ErrorKind;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureError;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.Value;
import io.krpc.core.ValueCodec;
import io.krpc.server.spi.CallContext;
import io.krpc.server.spi.ClientInfo;
import io.krpc.server.spi.ObjectStore;
import io.krpc.server.spi.ProcedureDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Executes one call: resolve, decode arguments, invoke, encode.
 *
 * <p>Never throws for a failing call. Every failure becomes a {@link ProcedureResult.Failure}
 * scoped to that call.
 */
public final class CallExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(CallExecutor.class);

    private final ProcedureDispatcher dispatcher;
    private final ObjectStore objectStore;

    public CallExecutor(ProcedureDispatcher dispatcher, ObjectStore objectStore) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
    }

    public ProcedureResult execute(ClientInfo client, ProcedureCall call) {
        ProcedureSignature signature;
        List<Value> arguments;
        try {
            signature = resolve(call.service(), call.procedure());
            arguments = decodeArguments(signature, call.arguments());
        } catch (KrpcException e) {
            return failure(call.service(), call.procedure(), e);
        } catch (RuntimeException e) {
            LOG.debug("Resolving {}.{} failed", call.service(), call.procedure(), e);
            return failure(call.service(), call.procedure(), e);
        }
        return invoke(client, signature, arguments);
    }

    /**
     * Invokes an already resolved procedure with decoded arguments.
     */
    public ProcedureResult invoke(ClientInfo client, ProcedureSignature signature, List<Value> arguments) {
        Value value;
        try {
            value = dispatcher.invoke(new CallContext(client, objectStore), signature, arguments);
        } catch (OutOfMemoryError | InternalError e) {
            throw e;
        } catch (Throwable t) {
            LOG.debug("Call to {} failed", signature.fullName(), t);
            return failure(signature.service(), signature.name(), t);
        }
        if (value == null || !ValueCodec.conforms(value, signature.returnType())) {
            String found = value == null ? "no value" : value.kind().toString();
            return new ProcedureResult.Failure(new ProcedureError(ErrorKind.EXECUTION_FAULT,
                    signature.service(), signature.name(),
                    "Procedure returned " + found + ", expected " + signature.returnType(),
                    IllegalStateException.class.getName()));
        }
        return new ProcedureResult.Success(ValueCodec.encode(ValueCodec.normalize(value, signature.returnType())));
    }

    /**
     * @throws KrpcException.UnknownProcedure if the dispatcher does not know the procedure
     */
    public ProcedureSignature resolve(String service, String procedure) {
        return dispatcher.lookup(service, procedure)
                .orElseThrow(() -> new KrpcException.UnknownProcedure(service, procedure));
    }

    /**
     * Decodes positional arguments against the signature, filling omitted optional parameters
     * with their defaults.
     *
     * @throws KrpcException.ArgumentError for a missing required argument, a duplicate or
     *         out-of-range position, or bytes that do not decode as the parameter type
     */
    public List<Value> decodeArguments(ProcedureSignature signature, List<Argument> arguments) {
        List<ProcedureSignature.Parameter> parameters = signature.parameters();
        Value[] values = new Value[parameters.size()];
        for (Argument argument : arguments) {
            int position = argument.position();
            if (position >= parameters.size()) {
                throw new KrpcException.ArgumentError(signature.fullName() + " takes " + parameters.size()
                        + " arguments, got position " + position);
            }
            if (values[position] != null) {
                throw new KrpcException.ArgumentError("Duplicate argument at position " + position
                        + " for " + signature.fullName());
            }
            ProcedureSignature.Parameter parameter = parameters.get(position);
            try {
                values[position] = ValueCodec.decode(argument.value(), parameter.type());
            } catch (DecodeException e) {
                throw new KrpcException.ArgumentError("Cannot decode argument '" + parameter.name() + "' of "
                        + signature.fullName() + " as " + parameter.type() + ": " + e.getMessage(), e);
            }
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                ProcedureSignature.Parameter parameter = parameters.get(i);
                values[i] = parameter.defaultValueIfPresent().orElseThrow(() -> new KrpcException.ArgumentError(
                        "Missing argument '" + parameter.name() + "' for " + signature.fullName()));
            }
        }
        return List.of(values);
    }

    static ProcedureResult failure(String service, String procedure, Throwable t) {
        ErrorKind kind;
        String faultType = "";
        if (t instanceof KrpcException.InvalidHandle) {
            kind = ErrorKind.INVALID_HANDLE;
        } else if (t instanceof KrpcException.ArgumentError) {
            kind = ErrorKind.ARGUMENT_ERROR;
        } else if (t instanceof KrpcException.UnknownProcedure) {
            kind = ErrorKind.UNKNOWN_PROCEDURE;
        } else {
            kind = ErrorKind.EXECUTION_FAULT;
            faultType = t.getClass().getName();
        }
        String description = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new ProcedureResult.Failure(new ProcedureError(kind, service, procedure, description, faultType));
    }
}
