package io.krpc.core;

import io.krpc.core.ProtocolMessage.ErrorKind;
import io.krpc.core.ProtocolMessage.ProcedureCall;
import io.krpc.core.ProtocolMessage.ProcedureError;
import io.krpc.core.ProtocolMessage.ProcedureResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtocolCodecTest {

    private final ProtocolCodec codec = new ProtocolCodec();

    @Test
    void roundtripConnectionHandshake() throws Exception {
        var request = ProtocolMessage.ConnectionRequest.rpc("flight-computer");
        var response = ProtocolMessage.ConnectionResponse.ok(new byte[] {1, 2, 3, 4});

        assertThat(codec.decodeConnectionRequest(codec.encode(request))).isEqualTo(request);
        assertThat(codec.decodeConnectionResponse(codec.encode(response))).isEqualTo(response);
    }

    @Test
    void roundtripBatchRequest() throws Exception {
        var request = ProtocolMessage.Request.of(
                ProcedureCall.of("KRPC", "GetStatus"),
                new ProcedureCall("SpaceCenter", "Node_set_Prograde", List.of(
                        new ProtocolMessage.Argument(0, ValueCodec.encode(Value.handle(3))),
                        new ProtocolMessage.Argument(1, ValueCodec.encode(Value.of(12.5f))))));

        assertThat(codec.decodeRequest(codec.encode(request))).isEqualTo(request);
    }

    @Test
    void roundtripResponseWithMixedResults() throws Exception {
        var response = new ProtocolMessage.Response(List.of(
                new ProcedureResult.Success(ValueCodec.encode(Value.of(1.0))),
                new ProcedureResult.Failure(new ProcedureError(
                        ErrorKind.EXECUTION_FAULT, "SpaceCenter", "Thruster_get_ThrustPosition",
                        "engine destroyed", "java.lang.IllegalStateException")),
                new ProcedureResult.Success(new byte[0])));

        assertThat(codec.decodeResponse(codec.encode(response))).isEqualTo(response);
    }

    @Test
    void roundtripServicesWithOptionalParameters() throws Exception {
        var signature = ProcedureSignature.of("SpaceCenter", "Orbit_get_Apoapsis", ValueType.DOUBLE,
                ProcedureSignature.Parameter.required("this", ValueType.OBJECT_HANDLE),
                ProcedureSignature.Parameter.optional("frames",
                        ValueType.list(ValueType.tuple(ValueType.DOUBLE, ValueType.DOUBLE)),
                        Value.list()));
        var services = new ProtocolMessage.Services(List.of(
                new ProtocolMessage.ServiceDescription("SpaceCenter", List.of(signature))));

        assertThat(codec.decode(codec.encode(services), MessageType.SERVICES)).isEqualTo(services);
    }

    @Test
    void rejectsEmptyRequest() {
        BinaryWriter writer = new BinaryWriter();
        writer.writeCount(0);

        assertThatThrownBy(() -> codec.decodeRequest(writer.toByteArray()))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("no calls");
    }

    @Test
    void rejectsUnknownResultTag() {
        BinaryWriter writer = new BinaryWriter();
        writer.writeCount(1);
        writer.writeByte(9);

        assertThatThrownBy(() -> codec.decodeResponse(writer.toByteArray()))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("result tag");
    }

    @Test
    void rejectsOutOfRangeConnectionType() {
        BinaryWriter writer = new BinaryWriter();
        writer.writeVarInt(7);
        writer.writeString("client");
        writer.writeBytes(new byte[0]);

        assertThatThrownBy(() -> codec.decodeConnectionRequest(writer.toByteArray()))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void framedEncodingPrefixesLength() throws Exception {
        byte[] framed = codec.encodeFramed(ProtocolMessage.Request.of(ProcedureCall.of("KRPC", "GetClientID")));

        Framing.Frame frame = (Framing.Frame) Framing.decodeMessage(framed, 0, framed.length);
        assertThat(codec.decodeRequest(frame.payload()).calls()).hasSize(1);
    }
}
