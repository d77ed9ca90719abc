package io.krpc.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Messages exchanged between clients and the server. Each one travels as a single
 * length-delimited frame; the receiver knows from context which {@link MessageType} to expect.
 */
public sealed interface ProtocolMessage permits
        ProtocolMessage.ConnectionRequest,
        ProtocolMessage.ConnectionResponse,
        ProtocolMessage.ProcedureCall,
        ProtocolMessage.Request,
        ProtocolMessage.Response,
        ProtocolMessage.StreamUpdate,
        ProtocolMessage.Status,
        ProtocolMessage.Services {

    MessageType type();

    enum ConnectionType {
        RPC,
        STREAM
    }

    enum ConnectionStatus {
        OK,
        MALFORMED_MESSAGE,
        TIMEOUT,
        WRONG_TYPE,
        REJECTED
    }

    enum ErrorKind {
        INVALID_HANDLE,
        UNKNOWN_PROCEDURE,
        ARGUMENT_ERROR,
        EXECUTION_FAULT
    }

    /**
     * First message on every connection. Stream connections present the identifier the
     * server issued to the matching RPC connection.
     */
    record ConnectionRequest(ConnectionType connectionType, String clientName, byte[] clientIdentifier)
            implements ProtocolMessage {
        public ConnectionRequest {
            Objects.requireNonNull(connectionType, "connectionType");
            Objects.requireNonNull(clientName, "clientName");
            clientIdentifier = clientIdentifier == null ? new byte[0] : clientIdentifier.clone();
        }

        public static ConnectionRequest rpc(String clientName) {
            return new ConnectionRequest(ConnectionType.RPC, clientName, null);
        }

        public static ConnectionRequest stream(byte[] clientIdentifier) {
            return new ConnectionRequest(ConnectionType.STREAM, "", clientIdentifier);
        }

        @Override
        public byte[] clientIdentifier() {
            return clientIdentifier.clone();
        }

        @Override
        public MessageType type() {
            return MessageType.CONNECTION_REQUEST;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ConnectionRequest other
                    && connectionType == other.connectionType
                    && clientName.equals(other.clientName)
                    && Arrays.equals(clientIdentifier, other.clientIdentifier);
        }

        @Override
        public int hashCode() {
            return Objects.hash(connectionType, clientName, Arrays.hashCode(clientIdentifier));
        }
    }

    record ConnectionResponse(ConnectionStatus status, String message, byte[] clientIdentifier)
            implements ProtocolMessage {
        public ConnectionResponse {
            Objects.requireNonNull(status, "status");
            Objects.requireNonNull(message, "message");
            clientIdentifier = clientIdentifier == null ? new byte[0] : clientIdentifier.clone();
        }

        public static ConnectionResponse ok(byte[] clientIdentifier) {
            return new ConnectionResponse(ConnectionStatus.OK, "", clientIdentifier);
        }

        public static ConnectionResponse failed(ConnectionStatus status, String message) {
            return new ConnectionResponse(status, message, null);
        }

        @Override
        public byte[] clientIdentifier() {
            return clientIdentifier.clone();
        }

        @Override
        public MessageType type() {
            return MessageType.CONNECTION_RESPONSE;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ConnectionResponse other
                    && status == other.status
                    && message.equals(other.message)
                    && Arrays.equals(clientIdentifier, other.clientIdentifier);
        }

        @Override
        public int hashCode() {
            return Objects.hash(status, message, Arrays.hashCode(clientIdentifier));
        }
    }

    /**
     * An encoded argument. Positions index into the procedure's parameter list, so optional
     * parameters can be left out.
     */
    record Argument(int position, byte[] value) {
        public Argument {
            if (position < 0) throw new IllegalArgumentException("position must be non-negative");
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Argument other && position == other.position && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return 31 * position + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Argument[position=" + position + ", length=" + value.length + "]";
        }
    }

    record ProcedureCall(String service, String procedure, List<Argument> arguments) implements ProtocolMessage {
        public ProcedureCall {
            Objects.requireNonNull(service, "service");
            Objects.requireNonNull(procedure, "procedure");
            arguments = List.copyOf(arguments);
        }

        /**
         * Builds a call whose arguments occupy positions 0..n-1.
         */
        public static ProcedureCall of(String service, String procedure, Value... arguments) {
            Argument[] encoded = new Argument[arguments.length];
            for (int i = 0; i < arguments.length; i++) {
                encoded[i] = new Argument(i, ValueCodec.encode(arguments[i]));
            }
            return new ProcedureCall(service, procedure, List.of(encoded));
        }

        @Override
        public MessageType type() {
            return MessageType.PROCEDURE_CALL;
        }
    }

    /**
     * One or more calls executed independently, answered by a {@link Response} with one
     * result per call in the same order.
     */
    record Request(List<ProcedureCall> calls) implements ProtocolMessage {
        public Request {
            calls = List.copyOf(calls);
            if (calls.isEmpty()) throw new IllegalArgumentException("request must contain at least one call");
        }

        public static Request of(ProcedureCall... calls) {
            return new Request(List.of(calls));
        }

        @Override
        public MessageType type() {
            return MessageType.REQUEST;
        }
    }

    record Response(List<ProcedureResult> results) implements ProtocolMessage {
        public Response {
            results = List.copyOf(results);
        }

        @Override
        public MessageType type() {
            return MessageType.RESPONSE;
        }
    }

    /**
     * Outcome of a single call: the encoded return value or a structured error.
     */
    sealed interface ProcedureResult permits ProcedureResult.Success, ProcedureResult.Failure {

        boolean isSuccess();

        record Success(byte[] value) implements ProcedureResult {
            public Success {
                value = Objects.requireNonNull(value, "value").clone();
            }

            @Override
            public byte[] value() {
                return value.clone();
            }

            @Override
            public boolean isSuccess() {
                return true;
            }

            @Override
            public boolean equals(Object o) {
                return o instanceof Success other && Arrays.equals(value, other.value);
            }

            @Override
            public int hashCode() {
                return Arrays.hashCode(value);
            }

            @Override
            public String toString() {
                return "Success[length=" + value.length + "]";
            }
        }

        record Failure(ProcedureError error) implements ProcedureResult {
            public Failure {
                Objects.requireNonNull(error, "error");
            }

            @Override
            public boolean isSuccess() {
                return false;
            }
        }
    }

    /**
     * @param kind error category
     * @param service service named by the failing call
     * @param procedure procedure named by the failing call
     * @param description human readable message
     * @param faultType exception type name for execution faults, empty otherwise
     */
    record ProcedureError(ErrorKind kind, String service, String procedure, String description, String faultType) {
        public ProcedureError {
            Objects.requireNonNull(kind, "kind");
            service = service == null ? "" : service;
            procedure = procedure == null ? "" : procedure;
            description = description == null ? "" : description;
            faultType = faultType == null ? "" : faultType;
        }
    }

    record StreamResult(long streamId, ProcedureResult result) {
        public StreamResult {
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Values pushed to one client in one tick, one entry per stream it subscribes to.
     */
    record StreamUpdate(List<StreamResult> results) implements ProtocolMessage {
        public StreamUpdate {
            results = List.copyOf(results);
        }

        @Override
        public MessageType type() {
            return MessageType.STREAM_UPDATE;
        }
    }

    /**
     * Server counters and scheduler settings. Durations are in microseconds, rates per second.
     */
    record Status(
            String version,
            long bytesRead,
            long bytesWritten,
            float bytesReadRate,
            float bytesWrittenRate,
            long rpcsExecuted,
            float rpcRate,
            int maxCallsPerTick,
            long maxTimePerTickMicros,
            boolean adaptiveRateControl,
            boolean blockingReceive,
            long receiveTimeoutMicros,
            float timePerRpcTickMicros,
            float execTimePerRpcTickMicros,
            int streamRpcs,
            long streamRpcsExecuted,
            float streamRpcRate,
            float timePerStreamTickMicros,
            int connectedClients
    ) implements ProtocolMessage {
        public Status {
            Objects.requireNonNull(version, "version");
        }

        @Override
        public MessageType type() {
            return MessageType.STATUS;
        }
    }

    record ServiceDescription(String name, List<ProcedureSignature> procedures) {
        public ServiceDescription {
            Objects.requireNonNull(name, "name");
            procedures = List.copyOf(procedures);
        }
    }

    record Services(List<ServiceDescription> services) implements ProtocolMessage {
        public Services {
            services = List.copyOf(services);
        }

        @Override
        public MessageType type() {
            return MessageType.SERVICES;
        }
    }
}
