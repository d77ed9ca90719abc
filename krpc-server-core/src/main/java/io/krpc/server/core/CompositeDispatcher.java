package io.krpc.server.core;

import io.krpc.core.KrpcException;
import io.krpc.core.ProcedureSignature;
import io.krpc.core.Value;
import io.krpc.server.spi.CallContext;
import io.krpc.server.spi.ProcedureDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tries each dispatcher in order; the first that resolves a procedure owns it.
 */
final class CompositeDispatcher implements ProcedureDispatcher {

    private final List<ProcedureDispatcher> delegates;

    CompositeDispatcher(List<ProcedureDispatcher> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public Optional<ProcedureSignature> lookup(String service, String procedure) {
        for (ProcedureDispatcher delegate : delegates) {
            Optional<ProcedureSignature> signature = delegate.lookup(service, procedure);
            if (signature.isPresent()) {
                return signature;
            }
        }
        return Optional.empty();
    }

    @Override
    public Value invoke(CallContext context, ProcedureSignature procedure, List<Value> arguments) throws Exception {
        for (ProcedureDispatcher delegate : delegates) {
            if (delegate.lookup(procedure.service(), procedure.name()).isPresent()) {
                return delegate.invoke(context, procedure, arguments);
            }
        }
        throw new KrpcException.UnknownProcedure(procedure.service(), procedure.name());
    }

    @Override
    public List<ProcedureSignature> procedures() {
        List<ProcedureSignature> all = new ArrayList<>();
        for (ProcedureDispatcher delegate : delegates) {
            all.addAll(delegate.procedures());
        }
        return all;
    }
}
