package waveflow.worker.tasks;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import waveflow.worker.audio.ContentHasher;
import waveflow.worker.executor.TaskOutcome;
import waveflow.worker.executor.TempResources;
import waveflow.worker.executor.WorkArea;
import waveflow.worker.model.TaskArgs;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;
import waveflow.worker.notify.WebhookEndpoint;
import waveflow.worker.notify.WebhookEnvelope;
import waveflow.worker.support.InMemoryObjectStore;
import waveflow.worker.support.RecordingNotifier;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HashAndNotifyHandlerTest {

    private static final byte[] CONTENT = "pretend-this-is-audio".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private InMemoryObjectStore store;
    private RecordingNotifier notifier;
    private HashAndNotifyHandler handler;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore().put("uploads/u1/vocals.mp3", CONTENT);
        notifier = new RecordingNotifier();
        handler = new HashAndNotifyHandler(store, new ContentHasher(), notifier);
    }

    private TaskOutcome run(Map<String, Object> args) throws Exception {
        TaskInvocation inv = TaskInvocation.builder()
                .kind(TaskKind.HASH_AND_NOTIFY)
                .id("h-1")
                .args(TaskArgs.of(args))
                .build();
        try (TempResources temp = new WorkArea(tempDir).open(inv)) {
            return handler.handle(inv, temp);
        }
    }

    @Test
    void hashesAndReportsToHashCheck() throws Exception {
        TaskOutcome outcome = run(Map.of("file_path", "uploads/u1/vocals.mp3", "stem_id", "s-1", "stageId", "st-1"));

        TaskOutcome.Success success = assertInstanceOf(TaskOutcome.Success.class, outcome);
        String expected = new ContentHasher().hash(CONTENT);
        assertEquals(expected, success.result().result().get("audio_hash"));
        assertEquals("hash_sent_to_webhook", success.result().result().get("status"));

        WebhookEnvelope sent = notifier.sentTo(WebhookEndpoint.HASH_CHECK).get(0).envelope();
        assertEquals("s-1", sent.jobId());
        assertEquals(expected, sent.result().get("audio_hash"));
        assertEquals("st-1", sent.result().get("stageId"));
        assertEquals("hash_generated", sent.result().get("status"));
    }

    @Test
    void undeliveredHashIsRetryable() throws Exception {
        notifier.failing.add(WebhookEndpoint.HASH_CHECK);

        TaskOutcome.Retryable retry = assertInstanceOf(TaskOutcome.Retryable.class,
                run(Map.of("filepath", "uploads/u1/vocals.mp3", "stemId", "s-1")));

        assertEquals("WEBHOOK_FAILED", retry.error().code());
    }

    @Test
    void missingObjectIsRetryable() throws Exception {
        TaskOutcome.Retryable retry = assertInstanceOf(TaskOutcome.Retryable.class,
                run(Map.of("filepath", "uploads/u1/gone.mp3", "stemId", "s-1")));

        assertEquals("STORAGE_ERROR", retry.error().code());
        assertTrue(notifier.sent().isEmpty());
    }

    @Test
    void missingFilepathIsInvalid() throws Exception {
        TaskOutcome.Fatal fatal = assertInstanceOf(TaskOutcome.Fatal.class, run(Map.of("stemId", "s-1")));

        assertEquals("INVALID_ARGUMENTS", fatal.error().code());
        assertTrue(fatal.error().getMessage().contains("filepath"));
    }
}
