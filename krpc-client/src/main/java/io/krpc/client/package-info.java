/**
 * Blocking client for the RPC server.
 *
 * <p>{@link io.krpc.client.KrpcClient#builder()} opens the RPC connection, and the stream
 * connection when a {@link io.krpc.client.StreamListener} is given.
 */
package io.krpc.client;
