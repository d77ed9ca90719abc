/**
 * Reference implementation of the tick-driven RPC server.
 *
 * <p>The host constructs a {@link io.krpc.server.core.KrpcServer}, starts it, and calls
 * {@link io.krpc.server.core.KrpcServer#tick()} once per simulation cycle. Socket I/O runs on a
 * single selector thread owned by {@link io.krpc.server.core.TcpServer}; everything else, including
 * every procedure call, runs on the thread that calls {@code tick()}.
 */
package io.krpc.server.core;
