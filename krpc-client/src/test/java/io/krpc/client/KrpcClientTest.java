package io.krpc.client;

import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProcedureSignature.Parameter;
import io.krpc.core.ProtocolMessage.ConnectionStatus;
import io.krpc.core.ProtocolMessage.ErrorKind;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.ProtocolMessage.StreamResult;
import io.krpc.core.Value;
import io.krpc.core.ValueCodec;
import io.krpc.core.ValueType;
import io.krpc.server.core.KrpcServer;
import io.krpc.server.core.ServerConfig;
import io.krpc.server.spi.CallContext;
import io.krpc.server.spi.ConnectionApprover;
import io.krpc.server.spi.ProcedureDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KrpcClientTest {

    private static final ValueType CLIENTS =
            ValueType.list(ValueType.tuple(ValueType.BYTES, ValueType.STRING, ValueType.STRING));

    private final AtomicReference<Double> altitude = new AtomicReference<>(100.0);
    private final List<AutoCloseable> clients = new ArrayList<>();
    private KrpcServer server;
    private Thread ticker;
    private volatile boolean ticking;

    @BeforeEach
    void startServer() {
        Vessels vessels = new Vessels();
        vessels.register(ProcedureSignature.of("Vessels", "Add", ValueType.INT32,
                        Parameter.required("a", ValueType.INT32),
                        Parameter.optional("b", ValueType.INT32, Value.of(1))),
                (context, args) -> Value.of(((Value.Int32Value) args.get(0)).value() + ((Value.Int32Value) args.get(1)).value()));
        vessels.register(ProcedureSignature.of("Vessels", "Explode", ValueType.NULL),
                (context, args) -> {
                    throw new IllegalStateException("Engine failure");
                });
        vessels.register(ProcedureSignature.of("Vessels", "Active", ValueType.OBJECT_HANDLE),
                (context, args) -> Value.handle(context.objectStore().addInstance(new StringBuilder("Kerbal X"))));
        vessels.register(ProcedureSignature.of("Vessels", "Name", ValueType.STRING,
                        Parameter.required("vessel", ValueType.OBJECT_HANDLE)),
                (context, args) -> Value.of(context.objectStore()
                        .getInstance(((Value.HandleValue) args.get(0)).handle(), StringBuilder.class).toString()));
        vessels.register(ProcedureSignature.of("Vessels", "Altitude", ValueType.DOUBLE),
                (context, args) -> Value.of(altitude.get()));

        ConnectionApprover approver = client -> "intruder".equals(client.name())
                ? new ConnectionApprover.Decision.Deny("Not on the crew list")
                : ConnectionApprover.Decision.ALLOW;
        server = KrpcServer.builder(vessels)
                .config(ServerConfig.builder().rpcPort(0).streamPort(0).build())
                .approver(approver)
                .build();
        server.start();

        ticking = true;
        ticker = new Thread(() -> {
            while (ticking) {
                server.tick();
                try {
                    Thread.sleep(1);
                } catch (InterruptedException e) {
                    return;
                }
            }
        }, "test-ticker");
        ticker.start();
    }

    @AfterEach
    void stopServer() throws Exception {
        for (AutoCloseable client : clients) {
            client.close();
        }
        stopTicking();
        server.stop();
    }

    @Test
    void handshakeIssuesTheIdReportedByGetClientId() throws IOException {
        KrpcClient client = connect("Flight");

        Value id = client.invoke("KRPC", "GetClientID", ValueType.BYTES);
        Value name = client.invoke("KRPC", "GetClientName", ValueType.STRING);

        assertThat(client.clientId()).hasSize(16);
        assertThat(((Value.BytesValue) id).value()).isEqualTo(client.clientId());
        assertThat(name).isEqualTo(Value.of("Flight"));
    }

    @Test
    void invokeAppliesDefaultArguments() throws IOException {
        KrpcClient client = connect("Flight");

        assertThat(client.invoke("Vessels", "Add", ValueType.INT32, Value.of(2), Value.of(40))).isEqualTo(Value.of(42));
        assertThat(client.invoke("Vessels", "Add", ValueType.INT32, Value.of(41))).isEqualTo(Value.of(42));
    }

    @Test
    void failingCallInBatchDoesNotAffectOthers() throws IOException {
        KrpcClient client = connect("Flight");

        List<ProcedureResult> results = client.invokeBatch(List.of(
                ProcedureCall.of("Vessels", "Add", Value.of(1), Value.of(2)),
                ProcedureCall.of("Vessels", "Warp"),
                ProcedureCall.of("Vessels", "Add", Value.of(3), Value.of(4))));

        assertThat(results).hasSize(3);
        assertThat(decode(results.get(0), ValueType.INT32)).isEqualTo(Value.of(3));
        assertThat(((ProcedureResult.Failure) results.get(1)).error().kind()).isEqualTo(ErrorKind.UNKNOWN_PROCEDURE);
        assertThat(decode(results.get(2), ValueType.INT32)).isEqualTo(Value.of(7));
    }

    @Test
    void errorResultsRaiseCallException() throws IOException {
        KrpcClient client = connect("Flight");

        assertThatThrownBy(() -> client.invoke("Vessels", "Explode", ValueType.NULL))
                .isInstanceOfSatisfying(KrpcCallException.class, e -> {
                    assertThat(e.error().kind()).isEqualTo(ErrorKind.EXECUTION_FAULT);
                    assertThat(e.error().description()).isEqualTo("Engine failure");
                    assertThat(e.error().faultType()).isEqualTo(IllegalStateException.class.getName());
                });
        assertThatThrownBy(() -> client.invoke("Vessels", "Name", ValueType.STRING, Value.handle(999)))
                .isInstanceOfSatisfying(KrpcCallException.class,
                        e -> assertThat(e.error().kind()).isEqualTo(ErrorKind.INVALID_HANDLE));
        assertThatThrownBy(() -> client.invoke("Vessels", "Add", ValueType.INT32))
                .isInstanceOfSatisfying(KrpcCallException.class,
                        e -> assertThat(e.error().kind()).isEqualTo(ErrorKind.ARGUMENT_ERROR));
    }

    @Test
    void handlesResolveToTheSameInstance() throws IOException {
        KrpcClient client = connect("Flight");

        Value.HandleValue vessel = (Value.HandleValue) client.invoke("Vessels", "Active", ValueType.OBJECT_HANDLE);

        assertThat(vessel.handle()).isPositive();
        assertThat(client.invoke("Vessels", "Name", ValueType.STRING, vessel)).isEqualTo(Value.of("Kerbal X"));
    }

    @Test
    void streamDeliversValuesUntilRemoved() throws Exception {
        BlockingQueue<StreamResult> updates = new LinkedBlockingQueue<>();
        KrpcClient client = connect("Telemetry", updates::add);

        long id = client.addStream(ProcedureCall.of("Vessels", "Altitude"));
        assertThat(id).isPositive();
        assertThat(awaitValue(updates, id, Value.of(100.0))).isTrue();

        altitude.set(250.5);
        assertThat(awaitValue(updates, id, Value.of(250.5))).isTrue();

        client.removeStream(id);
        Thread.sleep(100);
        updates.clear();
        assertThat(updates.poll(200, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void failingListenerKeepsReceivingLaterUpdates() throws Exception {
        BlockingQueue<StreamResult> updates = new LinkedBlockingQueue<>();
        AtomicInteger delivered = new AtomicInteger();
        KrpcClient client = connect("Telemetry", result -> {
            if (delivered.incrementAndGet() == 1) {
                throw new IllegalStateException("display not ready");
            }
            updates.add(result);
        });

        long id = client.addStream(ProcedureCall.of("Vessels", "Altitude"));

        assertThat(awaitValue(updates, id, Value.of(100.0))).isTrue();
        assertThat(delivered.get()).isGreaterThan(1);
    }

    @Test
    void identicalStreamsShareTheirId() throws IOException {
        KrpcClient first = connect("First", result -> {});
        KrpcClient second = connect("Second", result -> {});

        long a = first.addStream(ProcedureCall.of("Vessels", "Altitude"));
        long b = second.addStream(ProcedureCall.of("Vessels", "Altitude"));

        assertThat(b).isEqualTo(a);
    }

    @Test
    void getClientsListsConnectedClients() throws IOException {
        KrpcClient first = connect("First");
        connect("Second");

        Value.ListValue list = (Value.ListValue) first.invoke("KRPC", "GetClients", CLIENTS);

        List<Value> names = new ArrayList<>();
        for (Value item : list.items()) {
            names.add(((Value.TupleValue) item).items().get(1));
        }
        assertThat(names).containsExactlyInAnyOrder(Value.of("First"), Value.of("Second"));
    }

    @Test
    void deniedClientIsRejected() {
        assertThatThrownBy(() -> connect("intruder"))
                .isInstanceOfSatisfying(KrpcConnectionException.class,
                        e -> assertThat(e.status()).isEqualTo(ConnectionStatus.REJECTED))
                .hasMessageContaining("Not on the crew list");
    }

    @Test
    void callsFailOnceServerStops() throws Exception {
        KrpcClient client = connect("Flight");
        stopTicking();
        server.stop();

        assertThatThrownBy(() -> client.invoke("Vessels", "Add", ValueType.INT32, Value.of(1)))
                .isInstanceOf(IOException.class);
    }

    private KrpcClient connect(String name) throws IOException {
        return connect(name, null);
    }

    private KrpcClient connect(String name, StreamListener listener) throws IOException {
        KrpcClient client = KrpcClient.builder()
                .rpcPort(server.rpcPort())
                .streamPort(server.streamPort())
                .name(name)
                .streamListener(listener)
                .connect();
        clients.add(client);
        return client;
    }

    private void stopTicking() throws InterruptedException {
        ticking = false;
        ticker.join(5000);
    }

    private static Value decode(ProcedureResult result, ValueType type) {
        try {
            return ValueCodec.decode(((ProcedureResult.Success) result).value(), type);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    private static boolean awaitValue(BlockingQueue<StreamResult> updates, long id, Value expected)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            StreamResult update = updates.poll(100, TimeUnit.MILLISECONDS);
            if (update != null && update.streamId() == id && update.result().isSuccess()
                    && decode(update.result(), ValueType.DOUBLE).equals(expected)) {
                return true;
            }
        }
        return false;
    }

    private static final class Vessels implements ProcedureDispatcher {

        interface Body {
            Value call(CallContext context, List<Value> arguments) throws Exception;
        }

        private final Map<String, ProcedureSignature> signatures = new LinkedHashMap<>();
        private final Map<String, Body> bodies = new LinkedHashMap<>();

        void register(ProcedureSignature signature, Body body) {
            signatures.put(signature.name(), signature);
            bodies.put(signature.name(), body);
        }

        @Override
        public Optional<ProcedureSignature> lookup(String service, String procedure) {
            return "Vessels".equals(service) ? Optional.ofNullable(signatures.get(procedure)) : Optional.empty();
        }

        @Override
        public Value invoke(CallContext context, ProcedureSignature procedure, List<Value> arguments) throws Exception {
            return bodies.get(procedure.name()).call(context, arguments);
        }

        @Override
        public List<ProcedureSignature> procedures() {
            return List.copyOf(signatures.values());
        }
    }
}
