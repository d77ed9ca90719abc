/**
 * Protocol-centric core for the tick-driven RPC server.
 *
 * <p>This module is deliberately dependency-free. It contains only:
 * <ul>
 *   <li>The closed {@link io.krpc.core.Value} model and the {@link io.krpc.core.ValueType} shapes used to decode it</li>
 *   <li>The binary value codec and the length-delimited message framing</li>
 *   <li>Protocol messages (handshake, request, response, stream update, status, services)</li>
 * </ul>
 *
 * <p>Sockets, scheduling and dispatch live in other modules.
 */
package io.krpc.core;
