package io.krpc.client;

import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.Value;
import io.krpc.core.ValueType;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

public interface KrpcClient extends AutoCloseable {

    /**
     * Identifier the server issued during the handshake.
     */
    byte[] clientId();

    /**
     * Calls one procedure and decodes its result.
     *
     * @throws KrpcCallException if the server answers with an error result
     * @throws IOException if the connection fails
     */
    Value invoke(String service, String procedure, ValueType returnType, Value... arguments) throws IOException;

    /**
     * Sends several calls in one request. Results come back in call order; a failing call does
     * not affect the others.
     */
    List<ProcedureResult> invokeBatch(List<ProcedureCall> calls) throws IOException;

    /**
     * Subscribes to a call evaluated by the server every tick. Values arrive at the
     * {@link StreamListener} given to the builder.
     *
     * @return the stream id
     */
    long addStream(ProcedureCall call) throws IOException;

    void removeStream(long streamId) throws IOException;

    @Override
    void close();

    /**
     * Creates a new builder for connecting a client.
     * @return a new Builder instance
     */
    static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for connecting a {@link KrpcClient}.
     */
    final class Builder {
        private String host = "127.0.0.1";
        private int rpcPort = 50000;
        private int streamPort = 50001;
        private String name = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private StreamListener streamListener;

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder rpcPort(int rpcPort) {
            this.rpcPort = rpcPort;
            return this;
        }

        public Builder streamPort(int streamPort) {
            this.streamPort = streamPort;
            return this;
        }

        /** Sets the name presented to the server. Default: empty. */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * Opens the stream connection too and delivers stream values to {@code streamListener}.
         */
        public Builder streamListener(StreamListener streamListener) {
            this.streamListener = streamListener;
            return this;
        }

        /**
         * Connects and completes the handshake.
         *
         * @throws KrpcConnectionException if the server refuses the client
         * @throws IOException if a connection cannot be opened
         */
        public KrpcClient connect() throws IOException {
            return SocketKrpcClient.connect(host, rpcPort, streamPort, name, connectTimeout, streamListener);
        }
    }
}
