/**
 * Contracts between the RPC server and the host it is embedded in.
 *
 * <p>The host supplies a {@link io.krpc.server.spi.ProcedureDispatcher} (what can be called), optionally a
 * {@link io.krpc.server.spi.ConnectionApprover} (who may connect) and {@link io.krpc.server.spi.ServerListener}
 * (lifecycle events), and shares instances with clients through the {@link io.krpc.server.spi.ObjectStore}.
 */
package io.krpc.server.spi;
