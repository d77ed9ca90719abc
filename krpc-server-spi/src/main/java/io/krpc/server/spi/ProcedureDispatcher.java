package io.krpc.server.spi;

import io.krpc.core.ProcedureSignature;
import io.krpc.core.Value;

import java.util.List;
import java.util.Optional;

/**
 * Executes named procedures on behalf of clients.
 *
 * <p>All calls happen on the thread that drives the server tick, so implementations may touch host
 * state without further synchronization. A call that throws is reported to the client as an error
 * result for that call only: {@link io.krpc.core.KrpcException.InvalidHandle} and
 * {@link io.krpc.core.KrpcException.ArgumentError} keep their category, anything else becomes an
 * execution fault.
 */
public interface ProcedureDispatcher {

    /**
     * Resolve the static signature of a procedure.
     *
     * @param service service name
     * @param procedure procedure name
     * @return the signature, or empty if no such procedure exists
     */
    Optional<ProcedureSignature> lookup(String service, String procedure);

    /**
     * Execute a procedure.
     *
     * @param context the calling client and the shared object store
     * @param procedure signature previously returned by {@link #lookup}
     * @param arguments one decoded value per parameter, defaults already applied
     * @return the result, shaped as {@link ProcedureSignature#returnType()}
     */
    Value invoke(CallContext context, ProcedureSignature procedure, List<Value> arguments) throws Exception;

    /**
     * Every procedure this dispatcher can resolve, for service discovery.
     */
    default List<ProcedureSignature> procedures() {
        return List.of();
    }

    /**
     * Dispatcher that knows no procedures.
     */
    static ProcedureDispatcher empty() {
        return new ProcedureDispatcher() {
            @Override
            public Optional<ProcedureSignature> lookup(String service, String procedure) {
                return Optional.empty();
            }

            @Override
            public Value invoke(CallContext context, ProcedureSignature procedure, List<Value> arguments) {
                throw new io.krpc.core.KrpcException.UnknownProcedure(procedure.service(), procedure.name());
            }
        };
    }
}
