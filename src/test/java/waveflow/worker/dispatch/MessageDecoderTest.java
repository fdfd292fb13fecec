package waveflow.worker.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import waveflow.worker.config.WorkerConfig;
import waveflow.worker.model.TaskInvocation;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageDecoderTest {

    private final MessageDecoder decoder = new MessageDecoder(WorkerConfig.DEFAULT_TASK);

    @Test
    @DisplayName("Empty and degenerate bodies are malformed, never dispatched")
    void degenerateBodiesAreMalformed() {
        assertMalformed("", MalformedReason.EMPTY);
        assertMalformed("   \n", MalformedReason.EMPTY);
        assertMalformed("{}", MalformedReason.DEGENERATE);
        assertMalformed("null", MalformedReason.DEGENERATE);
        assertMalformed("\"\"", MalformedReason.DEGENERATE);
        assertMalformed("[]", MalformedReason.DEGENERATE);
    }

    @Test
    void invalidJsonIsMalformed() {
        assertMalformed("{not json", MalformedReason.INVALID_JSON);
    }

    @Test
    void nonObjectJsonIsInvalidEnvelope() {
        assertMalformed("[1, 2]", MalformedReason.INVALID_ENVELOPE);
        assertMalformed("42", MalformedReason.INVALID_ENVELOPE);
    }

    @Test
    void bareDomainFieldsBecomeArgsOfDefaultKind() {
        TaskInvocation inv = decoded("{\"userId\":\"u1\",\"filepath\":\"a.wav\"}");

        assertEquals(WorkerConfig.DEFAULT_TASK, inv.kindName());
        assertEquals(Map.of("userId", "u1", "filepath", "a.wav"), inv.args().asMap());
        assertEquals(TaskInvocation.UNKNOWN_ID, inv.id());
        assertEquals(0, inv.attempt());
    }

    @Test
    void messageWithoutIdTakesTheBrokerMessageId() {
        DecodeResult result = decoder.decode("{\"userId\":\"u1\",\"filepath\":\"a.wav\"}", 1, "msg-42");

        assertEquals("msg-42", assertInstanceOf(DecodeResult.Decoded.class, result).invocation().id());
    }

    @Test
    void envelopeIdWinsOverBrokerMessageId() {
        DecodeResult direct = decoder.decode("{\"task\":\"X\",\"id\":\"t1\",\"kwargs\":{}}", 1, "msg-42");
        DecodeResult wrapped = decoder.decode("{\"headers\":{\"task\":\"X\",\"id\":\" \"}}", 1, "msg-43");

        assertEquals("t1", assertInstanceOf(DecodeResult.Decoded.class, direct).invocation().id());
        assertEquals("msg-43", assertInstanceOf(DecodeResult.Decoded.class, wrapped).invocation().id());
    }

    @Test
    void wrappedEnvelopeUsesHeadersAndKwargs() {
        TaskInvocation inv = decoded("{\"headers\":{\"task\":\"X\",\"id\":\"t1\"},\"body\":\"[[], {\\\"a\\\":1}]\"}");

        assertEquals("X", inv.kindName());
        assertEquals("t1", inv.id());
        assertEquals(Map.of("a", 1), inv.args().asMap());
    }

    @Test
    void wrappedEnvelopeCarriesRetries() {
        TaskInvocation inv = decoded("""
                {"headers":{"task":"app.tasks.process_audio_analysis","id":"t2","retries":2},
                 "body":"[[], {\\"filepath\\":\\"x.wav\\"}]"}
                """);

        assertEquals(2, inv.attempt());
        assertEquals("x.wav", inv.args().stringOrNull("filepath"));
    }

    @Test
    void wrappedBodyThatIsNotAnArrayIsInvalid() {
        assertMalformed("{\"headers\":{\"task\":\"X\"},\"body\":\"{}\"}", MalformedReason.INVALID_ENVELOPE);
        assertMalformed("{\"headers\":{\"task\":\"X\"},\"body\":\"[[\"}", MalformedReason.INVALID_ENVELOPE);
    }

    @Test
    void directEnvelopeWithKwargs() {
        TaskInvocation inv = decoded("""
                {"task":"app.tasks.mix_stems_and_upload","id":"m1","retries":1,
                 "kwargs":{"stageId":"s1","stem_paths":["a.wav","b.wav"]}}
                """);

        assertEquals("app.tasks.mix_stems_and_upload", inv.kindName());
        assertEquals("m1", inv.id());
        assertEquals(1, inv.attempt());
        assertEquals(List.of("a.wav", "b.wav"), inv.args().stringList("stem_paths"));
        assertFalse(inv.args().asMap().containsKey("task"));
    }

    @Test
    void directEnvelopeWithoutKwargsDropsTaskAndId() {
        TaskInvocation inv = decoded("{\"task\":\"health_check\",\"id\":\"h1\",\"probe\":true}");

        assertEquals("health_check", inv.kindName());
        assertEquals("h1", inv.id());
        assertEquals(Map.of("probe", true), inv.args().asMap());
    }

    @Test
    void redeliveryRaisesAttempt() {
        DecodeResult result = decoder.decode("{\"task\":\"health_check\",\"id\":\"h1\"}", 3);

        TaskInvocation inv = ((DecodeResult.Decoded) result).invocation();
        assertEquals(2, inv.attempt());
    }

    @Test
    void envelopeRetriesWinOverLowerReceiveCount() {
        DecodeResult result = decoder.decode(
                "{\"headers\":{\"task\":\"X\",\"id\":\"t\",\"retries\":3},\"body\":\"[[],{}]\"}", 2);

        assertEquals(3, ((DecodeResult.Decoded) result).invocation().attempt());
    }

    private TaskInvocation decoded(String body) {
        DecodeResult result = decoder.decode(body);
        DecodeResult.Decoded decoded = assertInstanceOf(DecodeResult.Decoded.class, result, "body: " + body);
        return decoded.invocation();
    }

    private void assertMalformed(String body, MalformedReason reason) {
        DecodeResult result = decoder.decode(body);
        DecodeResult.Malformed malformed = assertInstanceOf(DecodeResult.Malformed.class, result, "body: " + body);
        assertEquals(reason, malformed.reason(), "body: " + body);
    }
}
