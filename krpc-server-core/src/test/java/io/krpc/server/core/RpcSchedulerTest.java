package io.krpc.server.core;

import io.krpc.core.Framing;
import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.ProtocolMessage.Request;
import io.krpc.core.ProtocolMessage.Response;
import io.krpc.core.Value;
import io.krpc.core.ValueType;
import io.krpc.server.spi.CallContext;
import io.krpc.server.spi.ConnectionApprover;
import io.krpc.server.spi.DisconnectReason;
import io.krpc.server.spi.ProcedureDispatcher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RpcSchedulerTest {

    private final FakeTicker ticker = new FakeTicker();
    private final RecordingListener listener = new RecordingListener();
    private final AtomicReference<TestPeer> hangup = new AtomicReference<>();
    private final TestDispatcher dispatcher = new TestDispatcher()
            .register(ProcedureSignature.of("Test", "Ping", ValueType.NULL), (ctx, args) -> Value.nullValue())
            .register(ProcedureSignature.of("Test", "Fail", ValueType.NULL), (ctx, args) -> {
                throw new IllegalStateException("boom");
            })
            .register(ProcedureSignature.of("Test", "Slow", ValueType.NULL), (ctx, args) -> {
                ticker.advance(Duration.ofMillis(4));
                return Value.nullValue();
            })
            .register(ProcedureSignature.of("Test", "Hangup", ValueType.NULL), (ctx, args) -> {
                hangup.get().connection().close(DisconnectReason.CLIENT_CLOSED);
                return Value.nullValue();
            });

    private ServerContext context(ServerConfig.Builder config) {
        return new ServerContext(config.adaptiveRateControl(false).build(), dispatcher, new IdentityObjectStore(),
                ConnectionApprover.allowAll(), listener, ticker);
    }

    private static Request request(String procedure) {
        return Request.of(ProcedureCall.of("Test", procedure));
    }

    @Test
    void servesClientsRoundRobin() {
        ServerContext context = context(ServerConfig.builder().maxCallsPerTick(1));
        TestPeer a = TestPeer.connect(context.sessions(), "A");
        TestPeer b = TestPeer.connect(context.sessions(), "B");
        for (int i = 0; i < 10; i++) {
            a.send(request("Ping"));
            b.send(request("Ping"));
        }

        for (int tick = 0; tick < 20; tick++) {
            assertThat(context.scheduler().tick().requests()).isEqualTo(1);
        }

        List<String> log = dispatcher.callLog();
        assertThat(log).hasSize(20);
        for (int i = 0; i < log.size(); i++) {
            assertThat(log.get(i)).isEqualTo(i % 2 == 0 ? "A:Ping" : "B:Ping");
        }
        assertThat(a.pendingFrames()).isEqualTo(10);
        assertThat(b.pendingFrames()).isEqualTo(10);
    }

    @Test
    void lateClientIsNotStarvedByBusyOne() {
        ServerContext context = context(ServerConfig.builder().maxCallsPerTick(1));
        TestPeer busy = TestPeer.connect(context.sessions(), "busy");
        for (int i = 0; i < 5; i++) {
            busy.send(request("Ping"));
        }
        context.scheduler().tick();
        TestPeer late = TestPeer.connect(context.sessions(), "late");
        late.send(request("Ping"));

        context.scheduler().tick();

        assertThat(dispatcher.callLog()).containsExactly("busy:Ping", "late:Ping");
    }

    @Test
    void failingCallDoesNotAffectTheRestOfItsBatch() {
        ServerContext context = context(ServerConfig.builder());
        TestPeer peer = TestPeer.connect(context.sessions(), "batch");

        peer.send(Request.of(
                ProcedureCall.of("Test", "Ping"),
                ProcedureCall.of("Test", "Fail"),
                ProcedureCall.of("Test", "Ping")));
        context.scheduler().tick();

        Response response = peer.response();
        assertThat(response.results()).extracting(ProcedureResult::isSuccess).containsExactly(true, false, true);
        assertThat(dispatcher.invocations("Test.Ping")).isEqualTo(2);
    }

    @Test
    void failingLookupDoesNotEscapeTheTick() {
        ProcedureDispatcher partlyBroken = new ProcedureDispatcher() {
            @Override
            public Optional<ProcedureSignature> lookup(String service, String procedure) {
                if ("Boom".equals(procedure)) {
                    throw new IllegalStateException("catalog not loaded");
                }
                return dispatcher.lookup(service, procedure);
            }

            @Override
            public Value invoke(CallContext context, ProcedureSignature procedure, List<Value> arguments) throws Exception {
                return dispatcher.invoke(context, procedure, arguments);
            }
        };
        ServerContext context = new ServerContext(ServerConfig.builder().adaptiveRateControl(false).build(),
                partlyBroken, new IdentityObjectStore(), ConnectionApprover.allowAll(), listener, ticker);
        TestPeer peer = TestPeer.connect(context.sessions(), "batch");

        peer.send(Request.of(
                ProcedureCall.of("Test", "Ping"),
                ProcedureCall.of("Test", "Boom"),
                ProcedureCall.of("Test", "Ping")));

        assertThatCode(() -> context.scheduler().tick()).doesNotThrowAnyException();
        Response response = peer.response();
        assertThat(response.results()).extracting(ProcedureResult::isSuccess).containsExactly(true, false, true);
        assertThat(dispatcher.invocations("Test.Ping")).isEqualTo(2);
    }

    @Test
    void unlimitedCallsDrainEveryQueuedRequest() {
        ServerContext context = context(ServerConfig.builder());
        TestPeer peer = TestPeer.connect(context.sessions(), "eager");
        for (int i = 0; i < 5; i++) {
            peer.send(request("Ping"));
        }

        RpcScheduler.TickResult result = context.scheduler().tick();

        assertThat(result.requests()).isEqualTo(5);
        assertThat(result.calls()).isEqualTo(5);
        assertThat(peer.pendingFrames()).isEqualTo(5);
    }

    @Test
    void stopsStartingRequestsOnceBudgetIsSpent() {
        ServerContext context = context(ServerConfig.builder().maxTimePerTick(Duration.ofMillis(10)));
        TestPeer peer = TestPeer.connect(context.sessions(), "slow");
        for (int i = 0; i < 5; i++) {
            peer.send(request("Slow"));
        }

        assertThat(context.scheduler().tick().requests()).isEqualTo(3);
        assertThat(context.scheduler().tick().requests()).isEqualTo(2);
    }

    @Test
    void runsOneRequestEvenWithTinyBudget() {
        ServerContext context = context(ServerConfig.builder());
        TestPeer peer = TestPeer.connect(context.sessions(), "slow");
        peer.send(request("Slow"));
        peer.send(request("Slow"));

        assertThat(context.scheduler().tick(Duration.ofNanos(1)).requests()).isEqualTo(1);
    }

    @Test
    void malformedRequestDisconnectsOnlyItsClient() {
        ServerContext context = context(ServerConfig.builder());
        TestPeer bad = TestPeer.connect(context.sessions(), "bad");
        TestPeer empty = TestPeer.connect(context.sessions(), "empty");
        TestPeer good = TestPeer.connect(context.sessions(), "good");

        bad.sendRaw(Framing.encodeMessage(new byte[]{5}));
        empty.sendRaw(Framing.encodeMessage(new byte[]{0}));
        good.send(request("Ping"));
        context.scheduler().tick();

        assertThat(good.response().results()).hasSize(1);
        assertThat(bad.connection().closeReason()).isEqualTo(DisconnectReason.DECODE_ERROR);
        assertThat(empty.connection().closeReason()).isEqualTo(DisconnectReason.DECODE_ERROR);
        assertThat(context.sessions().connectedSessions()).extracting(ClientSession::name).containsExactly("good");
        assertThat(listener.disconnects).containsExactly(DisconnectReason.DECODE_ERROR, DisconnectReason.DECODE_ERROR);
    }

    @Test
    void responseToClientThatLeftMidTickIsDropped() {
        ServerContext context = context(ServerConfig.builder());
        TestPeer peer = TestPeer.connect(context.sessions(), "leaver");
        hangup.set(peer);

        peer.send(request("Hangup"));
        context.scheduler().tick();
        context.sessions().update();

        assertThat(peer.pendingFrames()).isZero();
        assertThat(listener.disconnects).containsExactly(DisconnectReason.CLIENT_CLOSED);
    }

    @Test
    void blockingReceiveWaitsForRequest() throws Exception {
        ServerContext context = context(ServerConfig.builder()
                .blockingReceive(true)
                .receiveTimeout(Duration.ofSeconds(5)));
        TestPeer peer = TestPeer.connect(context.sessions(), "late sender");
        Thread sender = new Thread(() -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            peer.send(request("Ping"));
        });

        sender.start();
        RpcScheduler.TickResult result = context.scheduler().tick();
        sender.join();

        assertThat(result.requests()).isEqualTo(1);
    }

    @Test
    void blockingReceiveGivesUpAfterTimeout() {
        ServerContext context = context(ServerConfig.builder()
                .blockingReceive(true)
                .receiveTimeout(Duration.ofMillis(5)));
        TestPeer.connect(context.sessions(), "idle");

        assertThat(context.scheduler().tick().requests()).isZero();
    }

    @Test
    void countsExecutedCalls() {
        ServerContext context = context(ServerConfig.builder());
        TestPeer peer = TestPeer.connect(context.sessions(), "counted");
        peer.send(Request.of(ProcedureCall.of("Test", "Ping"), ProcedureCall.of("Test", "Ping")));

        context.scheduler().tick();

        assertThat(context.statistics().rpcsExecuted()).isEqualTo(2);
    }
}
