package io.krpc.server.core;

import io.krpc.core.KrpcException;
import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProcedureSignature.Parameter;
import io.krpc.core.ProtocolMessage.ErrorKind;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.ProtocolMessage.StreamResult;
import io.krpc.core.ProtocolMessage.StreamUpdate;
import io.krpc.core.Value;
import io.krpc.core.ValueCodec;
import io.krpc.core.ValueType;
import io.krpc.server.spi.ClientInfo;
import io.krpc.server.spi.ConnectionApprover;
import io.krpc.server.spi.DisconnectReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamEngineTest {

    private static final ProcedureCall ALTITUDE = ProcedureCall.of("Flight", "Altitude");

    private int altitudeReads;
    private final TestDispatcher dispatcher = new TestDispatcher()
            .register(ProcedureSignature.of("Flight", "Altitude", ValueType.DOUBLE),
                    (ctx, args) -> Value.of(1000.0 + altitudeReads++))
            .register(ProcedureSignature.of("Flight", "Part", ValueType.STRING, Parameter.required("index", ValueType.INT32)),
                    (ctx, args) -> Value.of("part" + ((Value.Int32Value) args.get(0)).value()))
            .register(ProcedureSignature.of("Flight", "Broken", ValueType.DOUBLE),
                    (ctx, args) -> {
                        throw new UnsupportedOperationException("sensor offline");
                    });

    private ServerContext context;
    private TestPeer alice;
    private TestPeer aliceStream;
    private TestPeer bob;
    private TestPeer bobStream;

    @BeforeEach
    void connectClients() {
        context = new ServerContext(ServerConfig.defaults(), dispatcher, new IdentityObjectStore(),
                ConnectionApprover.allowAll(), new RecordingListener(), new FakeTicker());
        alice = TestPeer.connect(context.sessions(), "alice");
        aliceStream = alice.openStream(context.sessions());
        bob = TestPeer.connect(context.sessions(), "bob");
        bobStream = bob.openStream(context.sessions());
    }

    private ClientInfo info(String name) {
        return context.sessions().connectedSessions().stream()
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElseThrow()
                .info();
    }

    @Test
    void identicalCallsShareOneStreamEvaluatedOncePerTick() throws Exception {
        StreamEngine streams = context.streams();

        long first = streams.addStream(info("alice"), ALTITUDE);
        long second = streams.addStream(info("bob"), ALTITUDE);
        int evaluated = streams.tick();

        assertThat(first).isEqualTo(second).isEqualTo(1L);
        assertThat(evaluated).isEqualTo(1);
        assertThat(dispatcher.invocations("Flight.Altitude")).isEqualTo(1);
        for (TestPeer stream : new TestPeer[]{aliceStream, bobStream}) {
            StreamResult result = stream.streamUpdate().results().get(0);
            assertThat(result.streamId()).isEqualTo(first);
            assertThat(ValueCodec.decode(((ProcedureResult.Success) result.result()).value(), ValueType.DOUBLE))
                    .isEqualTo(Value.of(1000.0));
        }
    }

    @Test
    void differentArgumentsAreDifferentStreams() {
        StreamEngine streams = context.streams();

        long part1 = streams.addStream(info("alice"), ProcedureCall.of("Flight", "Part", Value.of(1)));
        long part2 = streams.addStream(info("alice"), ProcedureCall.of("Flight", "Part", Value.of(2)));
        long part1Again = streams.addStream(info("bob"), ProcedureCall.of("Flight", "Part", Value.of(1)));

        assertThat(part1).isNotEqualTo(part2).isEqualTo(part1Again);
        assertThat(streams.streamCount()).isEqualTo(2);
    }

    @Test
    void batchesAllOfAClientsStreamsIntoOneUpdate() {
        StreamEngine streams = context.streams();
        long altitude = streams.addStream(info("alice"), ALTITUDE);
        long part = streams.addStream(info("alice"), ProcedureCall.of("Flight", "Part", Value.of(7)));

        streams.tick();

        StreamUpdate update = aliceStream.streamUpdate();
        assertThat(update.results()).extracting(StreamResult::streamId).containsExactly(altitude, part);
        assertThat(aliceStream.pendingFrames()).isZero();
        assertThat(bobStream.pendingFrames()).isZero();
    }

    @Test
    void evaluationErrorIsDeliveredAsResult() {
        StreamEngine streams = context.streams();
        long id = streams.addStream(info("alice"), ProcedureCall.of("Flight", "Broken"));

        streams.tick();

        ProcedureResult result = aliceStream.streamUpdate().results().get(0).result();
        assertThat(result).isInstanceOf(ProcedureResult.Failure.class);
        assertThat(((ProcedureResult.Failure) result).error().kind()).isEqualTo(ErrorKind.EXECUTION_FAULT);
        assertThat(streams.lastResult(id)).contains(result);
    }

    @Test
    void removingLastSubscriberDropsStream() {
        StreamEngine streams = context.streams();
        long id = streams.addStream(info("alice"), ALTITUDE);
        streams.addStream(info("bob"), ALTITUDE);

        assertThat(streams.removeStream(info("alice").id(), id)).isTrue();
        assertThat(streams.removeStream(info("alice").id(), id)).isFalse();
        streams.tick();
        assertThat(aliceStream.pendingFrames()).isZero();
        assertThat(bobStream.pendingFrames()).isEqualTo(1);

        assertThat(streams.removeStream(info("bob").id(), id)).isTrue();
        assertThat(streams.streamCount()).isZero();
        assertThat(streams.lastResult(id)).isEmpty();
    }

    @Test
    void streamIdsAreNeverReused() {
        StreamEngine streams = context.streams();
        long id = streams.addStream(info("alice"), ALTITUDE);
        streams.removeStream(info("alice").id(), id);

        assertThat(streams.addStream(info("alice"), ALTITUDE)).isGreaterThan(id);
    }

    @Test
    void disconnectDropsSubscriptions() {
        StreamEngine streams = context.streams();
        streams.addStream(info("alice"), ALTITUDE);
        streams.addStream(info("bob"), ProcedureCall.of("Flight", "Part", Value.of(3)));

        alice.connection().close(DisconnectReason.CLIENT_CLOSED);
        context.sessions().update();

        assertThat(streams.streamCount()).isEqualTo(1);
        assertThat(streams.subscriptions(info("bob").id())).hasSize(1);
    }

    @Test
    void subscriberWithoutStreamConnectionIsSkipped() {
        TestPeer carol = TestPeer.connect(context.sessions(), "carol");
        StreamEngine streams = context.streams();
        streams.addStream(info("carol"), ALTITUDE);

        assertThat(streams.tick()).isEqualTo(1);
        assertThat(carol.pendingFrames()).isZero();
    }

    @Test
    void rejectsUnknownProcedureAndBadArguments() {
        StreamEngine streams = context.streams();

        assertThatThrownBy(() -> streams.addStream(info("alice"), ProcedureCall.of("Flight", "Nope")))
                .isInstanceOf(KrpcException.UnknownProcedure.class);
        assertThatThrownBy(() -> streams.addStream(info("alice"), ProcedureCall.of("Flight", "Part")))
                .isInstanceOf(KrpcException.ArgumentError.class);
        assertThat(streams.streamCount()).isZero();
    }
}
