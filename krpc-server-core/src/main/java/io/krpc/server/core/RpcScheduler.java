package io.krpc.server.core;

import io.krpc.core.ProtocolCodec;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.ProtocolMessage.Request;
import io.krpc.core.ProtocolMessage.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs queued requests on the tick thread within a per-tick budget.
 *
 * <p>Sessions are served round-robin, one request at a time, continuing after the session served
 * last in the previous tick. A tick stops starting requests once {@link ServerConfig#maxCallsPerTick()}
 * is reached or the time budget is spent; a request already started always runs to completion,
 * and at least one request runs per tick when any is queued.
 */
public final class RpcScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(RpcScheduler.class);

    private final ServerConfig config;
    private final SessionManager sessions;
    private final CallExecutor executor;
    private final ProtocolCodec codec;
    private final ServerStatistics statistics;
    private final Ticker ticker;
    private final ReceiveSignal signal;
    private final AdaptiveRateController rateController;
    private ClientSession lastServiced;

    RpcScheduler(ServerConfig config, SessionManager sessions, CallExecutor executor, ProtocolCodec codec,
                 ServerStatistics statistics, Ticker ticker, ReceiveSignal signal) {
        this.config = Objects.requireNonNull(config, "config");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.rateController = config.adaptiveRateControl()
                ? new AdaptiveRateController(config.maxTimePerTick(), config.minTimePerTick(), config.targetTickPeriod())
                : null;
    }

    /**
     * One scheduling pass with the configured budget.
     */
    public TickResult tick() {
        return tick(config.maxTimePerTick());
    }

    /**
     * One scheduling pass. With adaptive rate control the effective budget may be smaller than
     * {@code budget}.
     */
    public TickResult tick(Duration budget) {
        long tickStart = ticker.nanoTime();
        long budgetNanos = budget.toNanos();
        if (rateController != null) {
            budgetNanos = Math.min(budgetNanos, rateController.budgetForTick(tickStart));
        }

        sessions.update();
        if (config.blockingReceive() && !sessions.hasPendingRequest()) {
            awaitRequest();
        }

        long start = ticker.nanoTime();
        int maxRequests = config.maxCallsPerTick();
        int requests = 0;
        int calls = 0;
        long execNanos = 0L;
        while (maxRequests == ServerConfig.UNLIMITED_CALLS || requests < maxRequests) {
            if (requests > 0 && ticker.nanoTime() - start >= budgetNanos) {
                break;
            }
            ClientSession session = nextReady();
            if (session == null) {
                break;
            }
            Request request = sessions.takeRequest(session);
            if (request == null) {
                continue;
            }
            long execStart = ticker.nanoTime();
            List<ProcedureResult> results = new ArrayList<>(request.calls().size());
            for (ProcedureCall call : request.calls()) {
                results.add(executor.execute(session.info(), call));
            }
            execNanos += ticker.nanoTime() - execStart;
            session.rpcConnection().send(codec.encodeFramed(new Response(results)));
            requests++;
            calls += results.size();
        }

        long elapsed = ticker.nanoTime() - tickStart;
        statistics.recordRpcTick(calls, elapsed, execNanos);
        if (requests > 0) {
            LOG.debug("Executed {} requests ({} calls) in {} us", requests, calls, elapsed / 1000);
        }
        return new TickResult(requests, calls, elapsed);
    }

    /**
     * Current time budget per tick, after adaptive adjustment.
     */
    public Duration currentBudget() {
        return rateController != null
                ? Duration.ofNanos(rateController.currentBudgetNanos())
                : config.maxTimePerTick();
    }

    private ClientSession nextReady() {
        List<ClientSession> candidates = sessions.connectedSessions();
        int count = candidates.size();
        if (count == 0) {
            return null;
        }
        int first = lastServiced == null ? 0 : candidates.indexOf(lastServiced) + 1;
        for (int i = 0; i < count; i++) {
            ClientSession candidate = candidates.get((first + i) % count);
            if (candidate.rpcConnection().hasFrame()) {
                lastServiced = candidate;
                return candidate;
            }
        }
        return null;
    }

    private void awaitRequest() {
        try {
            signal.await(config.receiveTimeout(), sessions::hasPendingRequest);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Work done by one tick.
     *
     * @param requests request messages executed
     * @param calls procedure calls inside those requests
     * @param elapsedNanos wall time of the tick
     */
    public record TickResult(int requests, int calls, long elapsedNanos) {}
}
