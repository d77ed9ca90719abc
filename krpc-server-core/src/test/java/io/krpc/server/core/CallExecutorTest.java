package io.krpc.server.core;

import io.krpc.core.ProcedureSignature;
import io.krpc.core.ProcedureSignature.Parameter;
import io.krpc.core.ProtocolMessage.Argument;
import io.krpc.core.ProtocolMessage.ErrorKind;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureError;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import io.krpc.core.Value;
import io.krpc.core.ValueCodec;
import io.krpc.core.ValueType;
import io.krpc.server.spi.CallContext;
import io.krpc.server.spi.ClientInfo;
import io.krpc.server.spi.ProcedureDispatcher;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CallExecutorTest {

    private static final ClientInfo CLIENT = new ClientInfo(UUID.randomUUID(), "tester", "127.0.0.1:1");

    private final IdentityObjectStore store = new IdentityObjectStore();
    private final TestDispatcher dispatcher = new TestDispatcher()
            .register(ProcedureSignature.of("SpaceCenter", "Add", ValueType.INT32,
                            Parameter.required("a", ValueType.INT32),
                            Parameter.optional("b", ValueType.INT32, Value.of(10))),
                    (ctx, args) -> Value.of(((Value.Int32Value) args.get(0)).value() + ((Value.Int32Value) args.get(1)).value()))
            .register(ProcedureSignature.of("SpaceCenter", "Fail", ValueType.NULL),
                    (ctx, args) -> {
                        throw new IllegalStateException("engine flameout");
                    })
            .register(ProcedureSignature.of("SpaceCenter", "VesselName", ValueType.STRING,
                            Parameter.required("vessel", ValueType.OBJECT_HANDLE)),
                    (ctx, args) -> Value.of(ctx.objectStore().getInstance(((Value.HandleValue) args.get(0)).handle(), String.class)))
            .register(ProcedureSignature.of("SpaceCenter", "Wrong", ValueType.INT32),
                    (ctx, args) -> Value.of("not a number"))
            .register(ProcedureSignature.of("SpaceCenter", "Recurse", ValueType.NULL),
                    (ctx, args) -> {
                        throw new StackOverflowError();
                    })
            .register(ProcedureSignature.of("SpaceCenter", "Crew", ValueType.list(ValueType.OBJECT_HANDLE)),
                    (ctx, args) -> Value.list(Value.nullValue(), Value.handle(3)));
    private final CallExecutor executor = new CallExecutor(dispatcher, store);

    @Test
    void executesAndEncodesResult() throws Exception {
        ProcedureResult result = executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "Add", Value.of(2), Value.of(3)));

        assertThat(decodeInt(result)).isEqualTo(5);
    }

    @Test
    void omittedOptionalArgumentTakesDefault() throws Exception {
        ProcedureResult result = executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "Add", Value.of(2)));

        assertThat(decodeInt(result)).isEqualTo(12);
    }

    @Test
    void positionsNeedNotBeInOrder() throws Exception {
        ProcedureCall call = new ProcedureCall("SpaceCenter", "Add", List.of(
                new Argument(1, ValueCodec.encode(Value.of(1))),
                new Argument(0, ValueCodec.encode(Value.of(100)))));

        assertThat(decodeInt(executor.execute(CLIENT, call))).isEqualTo(101);
    }

    @Test
    void unknownProcedure() {
        ProcedureError error = error(executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "Launch")));

        assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN_PROCEDURE);
        assertThat(error.service()).isEqualTo("SpaceCenter");
        assertThat(error.procedure()).isEqualTo("Launch");
    }

    @Test
    void argumentProblemsAreArgumentErrors() {
        byte[] one = ValueCodec.encode(Value.of(1));
        List<ProcedureCall> bad = List.of(
                ProcedureCall.of("SpaceCenter", "Add"),
                new ProcedureCall("SpaceCenter", "Add", List.of(new Argument(0, one), new Argument(0, one))),
                new ProcedureCall("SpaceCenter", "Add", List.of(new Argument(0, one), new Argument(2, one))),
                new ProcedureCall("SpaceCenter", "Add", List.of(new Argument(0, new byte[]{(byte) 0x80}))),
                ProcedureCall.of("SpaceCenter", "Add", Value.of("two")));

        for (ProcedureCall call : bad) {
            assertThat(error(executor.execute(CLIENT, call)).kind()).as(call.toString()).isEqualTo(ErrorKind.ARGUMENT_ERROR);
        }
        assertThat(dispatcher.invocations("SpaceCenter.Add")).isZero();
    }

    @Test
    void thrownExceptionBecomesExecutionFault() {
        ProcedureError error = error(executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "Fail")));

        assertThat(error.kind()).isEqualTo(ErrorKind.EXECUTION_FAULT);
        assertThat(error.description()).isEqualTo("engine flameout");
        assertThat(error.faultType()).isEqualTo(IllegalStateException.class.getName());
    }

    @Test
    void handlesResolveThroughObjectStore() throws Exception {
        long handle = store.addInstance("Kerbal X");

        ProcedureResult ok = executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "VesselName", Value.handle(handle)));
        ProcedureResult stale = executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "VesselName", Value.handle(999L)));

        assertThat(ValueCodec.decode(((ProcedureResult.Success) ok).value(), ValueType.STRING)).isEqualTo(Value.of("Kerbal X"));
        assertThat(error(stale).kind()).isEqualTo(ErrorKind.INVALID_HANDLE);
    }

    @Test
    void resultOfWrongShapeIsExecutionFault() {
        ProcedureError error = error(executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "Wrong")));

        assertThat(error.kind()).isEqualTo(ErrorKind.EXECUTION_FAULT);
        assertThat(error.description()).contains("int32");
    }

    @Test
    void stackOverflowInProcedureIsExecutionFault() {
        ProcedureError error = error(executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "Recurse")));

        assertThat(error.kind()).isEqualTo(ErrorKind.EXECUTION_FAULT);
        assertThat(error.faultType()).isEqualTo(StackOverflowError.class.getName());
    }

    @Test
    void failingLookupBecomesCallResult() {
        ProcedureDispatcher broken = new ProcedureDispatcher() {
            @Override
            public Optional<ProcedureSignature> lookup(String service, String procedure) {
                throw new IllegalStateException("catalog not loaded");
            }

            @Override
            public Value invoke(CallContext context, ProcedureSignature procedure, List<Value> arguments) {
                throw new AssertionError("not resolved");
            }
        };

        ProcedureError error = error(new CallExecutor(broken, store)
                .execute(CLIENT, ProcedureCall.of("SpaceCenter", "Add", Value.of(1))));

        assertThat(error.kind()).isEqualTo(ErrorKind.EXECUTION_FAULT);
        assertThat(error.description()).isEqualTo("catalog not loaded");
        assertThat(error.faultType()).isEqualTo(IllegalStateException.class.getName());
    }

    @Test
    void nullInHandleResultIsSentAsNullHandle() throws Exception {
        ProcedureResult result = executor.execute(CLIENT, ProcedureCall.of("SpaceCenter", "Crew"));

        assertThat(ValueCodec.decode(((ProcedureResult.Success) result).value(), ValueType.list(ValueType.OBJECT_HANDLE)))
                .isEqualTo(Value.list(Value.handle(0), Value.handle(3)));
    }

    private static int decodeInt(ProcedureResult result) throws Exception {
        assertThat(result).isInstanceOf(ProcedureResult.Success.class);
        return ((Value.Int32Value) ValueCodec.decode(((ProcedureResult.Success) result).value(), ValueType.INT32)).value();
    }

    private static ProcedureError error(ProcedureResult result) {
        assertThat(result).isInstanceOf(ProcedureResult.Failure.class);
        return ((ProcedureResult.Failure) result).error();
    }
}
