package io.krpc.client;

import io.krpc.core.KrpcException;
import io.krpc.core.ProtocolMessage.ProcedureError;

/**
 * A call completed with an error result.
 */
public final class KrpcCallException extends KrpcException {

    private static final long serialVersionUID = 1L;

    private final transient ProcedureError error;

    public KrpcCallException(ProcedureError error) {
        super(error.service() + "." + error.procedure() + " failed (" + error.kind() + "): " + error.description());
        this.error = error;
    }

    public ProcedureError error() {
        return error;
    }
}
