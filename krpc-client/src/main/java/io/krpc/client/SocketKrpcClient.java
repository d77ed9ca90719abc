package io.krpc.client;

import io.krpc.core.DecodeException;
import io.krpc.core.ProtocolCodec;
import io.krpc.core.ProtocolMessage.ConnectionRequest;
import io.krpc.core.ProtocolMessage.ConnectionResponse;
import io.krpc.core.ProtocolMessage.ConnectionStatus;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.ProtocolMessage.Request;
import io.krpc.core.ProtocolMessage.Response;
import io.krpc.core.ProtocolMessage.StreamResult;
import io.krpc.core.ProtocolMessage.StreamUpdate;
import io.krpc.core.Value;
import io.krpc.core.ValueCodec;
import io.krpc.core.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.List;

/**
 * {@link KrpcClient} over blocking sockets. Calls are serialized: one request is in flight at a time.
 */
final class SocketKrpcClient implements KrpcClient {

    private static final Logger LOG = LoggerFactory.getLogger(SocketKrpcClient.class);
    private static final String KRPC = "KRPC";

    private final ProtocolCodec codec = new ProtocolCodec();
    private final Socket rpcSocket;
    private final InputStream rpcInput;
    private final OutputStream rpcOutput;
    private final byte[] clientId;
    private Socket streamSocket;
    private Thread streamReader;
    private volatile boolean closed;

    private SocketKrpcClient(Socket rpcSocket, byte[] clientId) throws IOException {
        this.rpcSocket = rpcSocket;
        this.rpcInput = new BufferedInputStream(rpcSocket.getInputStream());
        this.rpcOutput = rpcSocket.getOutputStream();
        this.clientId = clientId;
    }

    static KrpcClient connect(String host, int rpcPort, int streamPort, String name, Duration connectTimeout,
                              StreamListener listener) throws IOException {
        ProtocolCodec codec = new ProtocolCodec();
        Socket rpcSocket = open(host, rpcPort, connectTimeout);
        SocketKrpcClient client;
        try {
            byte[] clientId = handshake(codec, rpcSocket, ConnectionRequest.rpc(name));
            client = new SocketKrpcClient(rpcSocket, clientId);
        } catch (IOException | RuntimeException e) {
            rpcSocket.close();
            throw e;
        }
        if (listener != null) {
            try {
                client.openStream(host, streamPort, connectTimeout, listener);
            } catch (IOException | RuntimeException e) {
                client.close();
                throw e;
            }
        }
        LOG.debug("Connected to {}:{} as '{}'", host, rpcPort, name);
        return client;
    }

    @Override
    public byte[] clientId() {
        return clientId.clone();
    }

    @Override
    public Value invoke(String service, String procedure, ValueType returnType, Value... arguments) throws IOException {
        ProcedureResult result = invokeBatch(List.of(ProcedureCall.of(service, procedure, arguments))).get(0);
        if (result instanceof ProcedureResult.Failure failure) {
            throw new KrpcCallException(failure.error());
        }
        try {
            return ValueCodec.decode(((ProcedureResult.Success) result).value(), returnType);
        } catch (DecodeException e) {
            throw new IOException("Cannot decode result of " + service + "." + procedure + " as " + returnType, e);
        }
    }

    @Override
    public synchronized List<ProcedureResult> invokeBatch(List<ProcedureCall> calls) throws IOException {
        rpcOutput.write(codec.encodeFramed(new Request(calls)));
        rpcOutput.flush();
        Response response;
        try {
            response = codec.decodeResponse(FrameIO.requireFrame(rpcInput));
        } catch (DecodeException e) {
            throw new IOException("Malformed response", e);
        }
        if (response.results().size() != calls.size()) {
            throw new IOException("Expected " + calls.size() + " results, got " + response.results().size());
        }
        return response.results();
    }

    @Override
    public long addStream(ProcedureCall call) throws IOException {
        Value id = invoke(KRPC, "AddStream", ValueType.UINT64, Value.message(call));
        return ((Value.UInt64Value) id).value();
    }

    @Override
    public void removeStream(long streamId) throws IOException {
        invoke(KRPC, "RemoveStream", ValueType.NULL, Value.uint64(streamId));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly(rpcSocket);
        closeQuietly(streamSocket);
        if (streamReader != null && Thread.currentThread() != streamReader) {
            try {
                streamReader.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void openStream(String host, int port, Duration connectTimeout, StreamListener listener) throws IOException {
        streamSocket = open(host, port, connectTimeout);
        handshake(codec, streamSocket, ConnectionRequest.stream(clientId));
        InputStream input = new BufferedInputStream(streamSocket.getInputStream());
        streamReader = new Thread(() -> readStream(input, listener), "krpc-stream-reader");
        streamReader.setDaemon(true);
        streamReader.start();
    }

    private void readStream(InputStream input, StreamListener listener) {
        try {
            byte[] frame;
            while ((frame = FrameIO.readFrame(input)) != null) {
                StreamUpdate update = codec.decodeStreamUpdate(frame);
                for (StreamResult result : update.results()) {
                    deliver(listener, result);
                }
            }
            LOG.debug("Stream connection closed by server");
        } catch (IOException | DecodeException e) {
            if (!closed) {
                LOG.warn("Stream connection failed", e);
            }
        }
    }

    private static void deliver(StreamListener listener, StreamResult result) {
        try {
            listener.onResult(result);
        } catch (RuntimeException e) {
            LOG.warn("Stream listener failed on stream {}", result.streamId(), e);
        }
    }

    private static Socket open(String host, int port, Duration connectTimeout) throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        return socket;
    }

    private static byte[] handshake(ProtocolCodec codec, Socket socket, ConnectionRequest request) throws IOException {
        OutputStream output = socket.getOutputStream();
        output.write(codec.encodeFramed(request));
        output.flush();
        ConnectionResponse response;
        try {
            response = codec.decodeConnectionResponse(FrameIO.requireFrame(socket.getInputStream()));
        } catch (DecodeException e) {
            throw new IOException("Malformed connection response", e);
        }
        if (response.status() != ConnectionStatus.OK) {
            throw new KrpcConnectionException(response.status(), response.message());
        }
        return response.clientIdentifier();
    }

    private static void closeQuietly(Socket socket) {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error while closing socket", e);
        }
    }
}
