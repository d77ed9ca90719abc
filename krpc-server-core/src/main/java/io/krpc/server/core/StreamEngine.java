package io.krpc.server.core;

import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProtocolCodec;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.ProtocolMessage.StreamResult;
import io.krpc.core.ProtocolMessage.StreamUpdate;
import io.krpc.core.Value;
import io.krpc.server.spi.ClientInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Continuous queries: a call re-evaluated every tick and pushed to each subscribed client.
 *
 * <p>Identical calls share one stream, so each is executed once per tick however many clients
 * subscribe. Stream ids start at 1 and are never reused. Owned by the tick thread.
 */
public final class StreamEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StreamEngine.class);

    private final SessionManager sessions;
    private final CallExecutor executor;
    private final ProtocolCodec codec;
    private final ServerStatistics statistics;
    private final Ticker ticker;

    private final Map<StreamDescriptor, Stream> streamsByDescriptor = new HashMap<>();
    private final Map<Long, Stream> streamsById = new LinkedHashMap<>();
    private long nextStreamId = 1L;

    StreamEngine(SessionManager sessions, CallExecutor executor, ProtocolCodec codec,
                 ServerStatistics statistics, Ticker ticker) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    /**
     * The procedure and decoded arguments that identify a stream.
     */
    public record StreamDescriptor(String service, String procedure, List<Value> arguments) {
        public StreamDescriptor {
            Objects.requireNonNull(service, "service");
            Objects.requireNonNull(procedure, "procedure");
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Subscribes a client to the stream for {@code call}, creating it on first use.
     *
     * @return the stream id, the same for every client subscribing to an identical call
     * @throws io.krpc.core.KrpcException.UnknownProcedure if the call names an unknown procedure
     * @throws io.krpc.core.KrpcException.ArgumentError if the arguments do not match its signature
     */
    public long addStream(ClientInfo client, ProcedureCall call) {
        ProcedureSignature signature = executor.resolve(call.service(), call.procedure());
        List<Value> arguments = executor.decodeArguments(signature, call.arguments());
        StreamDescriptor descriptor = new StreamDescriptor(signature.service(), signature.name(), arguments);
        Stream stream = streamsByDescriptor.get(descriptor);
        if (stream == null) {
            stream = new Stream(nextStreamId++, descriptor, signature);
            streamsByDescriptor.put(descriptor, stream);
            streamsById.put(stream.id, stream);
            LOG.debug("Created stream {} for {}", stream.id, signature.fullName());
        }
        if (stream.subscribers.put(client.id(), client) == null) {
            LOG.debug("Client {} subscribed to stream {}", client.name(), stream.id);
        }
        return stream.id;
    }

    /**
     * Unsubscribes a client. The stream is dropped when its last subscriber leaves.
     *
     * @return true if the client was subscribed
     */
    public boolean removeStream(UUID clientId, long streamId) {
        Stream stream = streamsById.get(streamId);
        if (stream == null || stream.subscribers.remove(clientId) == null) {
            return false;
        }
        if (stream.subscribers.isEmpty()) {
            drop(stream);
        }
        return true;
    }

    /**
     * Removes every subscription of a client, dropping streams left without subscribers.
     */
    public void removeClient(UUID clientId) {
        Iterator<Stream> it = streamsById.values().iterator();
        while (it.hasNext()) {
            Stream stream = it.next();
            if (stream.subscribers.remove(clientId) != null && stream.subscribers.isEmpty()) {
                it.remove();
                streamsByDescriptor.remove(stream.descriptor);
                LOG.debug("Dropped stream {}", stream.id);
            }
        }
    }

    /**
     * Evaluates every stream once and sends each subscribed client one update holding the
     * results of all its streams.
     *
     * @return the number of streams evaluated
     */
    public int tick() {
        long start = ticker.nanoTime();
        Map<UUID, List<StreamResult>> updates = new LinkedHashMap<>();
        for (Stream stream : new ArrayList<>(streamsById.values())) {
            ClientInfo evaluator = stream.subscribers.values().iterator().next();
            ProcedureResult result = executor.invoke(evaluator, stream.signature, stream.descriptor.arguments());
            stream.lastResult = result;
            for (UUID subscriber : stream.subscribers.keySet()) {
                updates.computeIfAbsent(subscriber, id -> new ArrayList<>()).add(new StreamResult(stream.id, result));
            }
        }
        for (Map.Entry<UUID, List<StreamResult>> entry : updates.entrySet()) {
            sessions.find(entry.getKey())
                    .map(ClientSession::streamConnection)
                    .ifPresent(connection -> connection.send(codec.encodeFramed(new StreamUpdate(entry.getValue()))));
        }
        int evaluated = streamsById.size();
        statistics.recordStreamTick(evaluated, ticker.nanoTime() - start);
        return evaluated;
    }

    public int streamCount() {
        return streamsById.size();
    }

    /**
     * Result of the most recent evaluation of a stream, empty before its first tick.
     */
    public Optional<ProcedureResult> lastResult(long streamId) {
        Stream stream = streamsById.get(streamId);
        return stream == null ? Optional.empty() : Optional.ofNullable(stream.lastResult);
    }

    /**
     * Stream ids a client is subscribed to.
     */
    public Set<Long> subscriptions(UUID clientId) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Stream stream : streamsById.values()) {
            if (stream.subscribers.containsKey(clientId)) {
                ids.add(stream.id);
            }
        }
        return ids;
    }

    void clear() {
        streamsById.clear();
        streamsByDescriptor.clear();
    }

    private void drop(Stream stream) {
        streamsById.remove(stream.id);
        streamsByDescriptor.remove(stream.descriptor);
        LOG.debug("Dropped stream {}", stream.id);
    }

    private static final class Stream {
        private final long id;
        private final StreamDescriptor descriptor;
        private final ProcedureSignature signature;
        private final Map<UUID, ClientInfo> subscribers = new LinkedHashMap<>();
        private ProcedureResult lastResult;

        private Stream(long id, StreamDescriptor descriptor, ProcedureSignature signature) {
            this.id = id;
            this.descriptor = descriptor;
            this.signature = signature;
        }
    }
}
