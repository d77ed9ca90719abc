package io.krpc.client;

import io.krpc.core.ProtocolMessage.StreamResult;

/**
 * Receives stream values pushed by the server, on the client's stream reader thread.
 */
@FunctionalInterface
public interface StreamListener {

    void onResult(StreamResult result);
}
