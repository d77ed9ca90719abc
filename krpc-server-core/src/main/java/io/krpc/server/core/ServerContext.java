package io.krpc.server.core;

import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProtocolCodec;
import io.krpc.core.ProtocolMessage.ServiceDescription;
import io.krpc.core.ProtocolMessage.Services;
import io.krpc.core.ProtocolMessage.Status;
import io.krpc.server.spi.ConnectionApprover;
import io.krpc.server.spi.ObjectStore;
import io.krpc.server.spi.ProcedureDispatcher;
import io.krpc.server.spi.ServerListener;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wires the server components together. One instance per server, passed explicitly to
 * whatever needs shared state.
 */
public final class ServerContext {

    private final ServerConfig config;
    private final ProtocolCodec codec = new ProtocolCodec();
    private final ServerStatistics statistics;
    private final ReceiveSignal signal = new ReceiveSignal();
    private final ObjectStore objectStore;
    private final SessionManager sessions;
    private final ProcedureDispatcher dispatcher;
    private final CallExecutor executor;
    private final StreamEngine streams;
    private final RpcScheduler scheduler;

    ServerContext(ServerConfig config, ProcedureDispatcher hostDispatcher, ObjectStore objectStore,
                  ConnectionApprover approver, ServerListener listener, Ticker ticker) {
        this.config = Objects.requireNonNull(config, "config");
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
        this.statistics = new ServerStatistics(ticker);
        this.sessions = new SessionManager(config, codec, approver, listener, statistics, ticker, signal);
        this.dispatcher = new CompositeDispatcher(List.of(new KrpcService(this), hostDispatcher));
        this.executor = new CallExecutor(dispatcher, objectStore);
        this.streams = new StreamEngine(sessions, executor, codec, statistics, ticker);
        this.scheduler = new RpcScheduler(config, sessions, executor, codec, statistics, ticker, signal);
        sessions.addDisconnectHook(streams::removeClient);
    }

    public ServerConfig config() {
        return config;
    }

    public ObjectStore objectStore() {
        return objectStore;
    }

    public SessionManager sessions() {
        return sessions;
    }

    public RpcScheduler scheduler() {
        return scheduler;
    }

    public StreamEngine streams() {
        return streams;
    }

    public ServerStatistics statistics() {
        return statistics;
    }

    /**
     * The built-in service followed by the host's procedures.
     */
    public ProcedureDispatcher dispatcher() {
        return dispatcher;
    }

    CallExecutor executor() {
        return executor;
    }

    ProtocolCodec codec() {
        return codec;
    }

    Status status() {
        ServerStatistics.Snapshot sample = statistics.sample();
        return new Status(
                KrpcServer.VERSION,
                sample.bytesRead(),
                sample.bytesWritten(),
                sample.bytesReadRate(),
                sample.bytesWrittenRate(),
                sample.rpcsExecuted(),
                sample.rpcRate(),
                config.maxCallsPerTick(),
                scheduler.currentBudget().toNanos() / 1000,
                config.adaptiveRateControl(),
                config.blockingReceive(),
                config.receiveTimeout().toNanos() / 1000,
                sample.timePerRpcTickMicros(),
                sample.execTimePerRpcTickMicros(),
                streams.streamCount(),
                sample.streamRpcsExecuted(),
                sample.streamRpcRate(),
                sample.timePerStreamTickMicros(),
                sessions.connectedSessions().size());
    }

    Services services() {
        Map<String, List<ProcedureSignature>> byService = new LinkedHashMap<>();
        for (ProcedureSignature procedure : dispatcher.procedures()) {
            byService.computeIfAbsent(procedure.service(), name -> new ArrayList<>()).add(procedure);
        }
        List<ServiceDescription> services = new ArrayList<>(byService.size());
        for (Map.Entry<String, List<ProcedureSignature>> entry : byService.entrySet()) {
            services.add(new ServiceDescription(entry.getKey(), entry.getValue()));
        }
        return new Services(services);
    }
}
