package waveflow.worker.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import waveflow.worker.audio.AudioFormatSniffer;
import waveflow.worker.audio.ContentHasher;
import waveflow.worker.audio.WaveformEngine;
import waveflow.worker.config.WorkerConfig;
import waveflow.worker.executor.TaskOutcome;
import waveflow.worker.executor.TempResources;
import waveflow.worker.executor.WorkArea;
import waveflow.worker.model.TaskArgs;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;
import waveflow.worker.notify.WebhookEndpoint;
import waveflow.worker.support.InMemoryObjectStore;
import waveflow.worker.support.RecordingNotifier;
import waveflow.worker.support.TestAudio;
import waveflow.worker.util.Json;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzeAudioHandlerTest {

    @TempDir
    Path tempDir;

    private InMemoryObjectStore store;
    private RecordingNotifier notifier;
    private byte[] wav;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryObjectStore();
        notifier = new RecordingNotifier();
        wav = TestAudio.monoWavBytes(tempDir.resolve("fixture.wav"), 8000, TestAudio.sine(220, 8000, 1.0, 0.8));
        store.put("uploads/take.wav", wav);
    }

    private AnalyzeAudioHandler handler(WorkerConfig config) {
        return new AnalyzeAudioHandler(store, WaveformEngine.standard(), new AudioFormatSniffer(), notifier, config);
    }

    private static WorkerConfig config() {
        return WorkerConfig.defaults().withDefaultPeaks(64);
    }

    private TaskOutcome run(AnalyzeAudioHandler handler, Map<String, Object> args) throws Exception {
        TaskInvocation inv = TaskInvocation.builder()
                .kind(TaskKind.ANALYZE_AUDIO)
                .id("inv-1")
                .args(TaskArgs.of(args))
                .build();
        try (TempResources temp = new WorkArea(tempDir.resolve("work")).open(inv)) {
            return handler.handle(inv, temp);
        }
    }

    private static Map<String, Object> args() {
        Map<String, Object> args = new HashMap<>();
        args.put("filepath", "uploads/take.wav");
        args.put("stemId", "stem-7");
        args.put("userId", "u-1");
        args.put("original_filename", "take.wav");
        return args;
    }

    @Test
    void analyzesAndUploadsWaveform() throws Exception {
        TaskOutcome outcome = run(handler(config()), args());

        TaskOutcome.Success success = assertInstanceOf(TaskOutcome.Success.class, outcome);
        Map<String, Object> result = success.result().result();
        String key = "waveforms/stem-7_waveform_inv-1.json";
        assertEquals(key, result.get("waveform_data_path"));
        assertEquals("memory://" + key, result.get("waveform_url"));
        assertEquals(new ContentHasher().hash(wav), result.get("audio_data_hash"));
        assertEquals("audio/wav", result.get("mime_type"));
        assertEquals(64, result.get("num_peaks"));
        assertEquals(8000, result.get("sample_rate"));
        assertEquals(1.0, (Double) result.get("duration"), 1e-9);
        assertEquals((long) wav.length, result.get("file_size"));
        assertEquals("take.wav", result.get("original_filename"));

        JsonNode waveform = Json.mapper().readTree(store.get(key));
        assertEquals(64, waveform.get("peaks").size());
        assertEquals(1.0, waveform.get("peaks").get(0).asDouble(), 0.05);

        assertEquals(1, notifier.sentTo(WebhookEndpoint.WAVEFORM_UPDATE).size());
        assertEquals(1, notifier.sentTo(WebhookEndpoint.COMPLETION).size());
        assertEquals("stem-7", notifier.sentTo(WebhookEndpoint.COMPLETION).get(0).envelope().jobId());
        assertTrue(store.contains("uploads/take.wav"), "source object is kept");
    }

    @Test
    void requestedPeakCountWins() throws Exception {
        Map<String, Object> args = args();
        args.put("num_peaks", "16");

        TaskOutcome.Success success = assertInstanceOf(TaskOutcome.Success.class, run(handler(config()), args));

        assertEquals(16, success.result().result().get("num_peaks"));
    }

    @Test
    void rejectsNonAudioWithoutRetry() throws Exception {
        store.put("uploads/take.wav", "this is a text file, not audio".getBytes(StandardCharsets.UTF_8));

        TaskOutcome.Fatal fatal = assertInstanceOf(TaskOutcome.Fatal.class, run(handler(config()), args()));

        assertEquals("UNSUPPORTED_AUDIO", fatal.error().code());
        assertTrue(notifier.sent().isEmpty());
    }

    @Test
    void rejectsFilesOverTheSizeLimit() throws Exception {
        TaskOutcome.Fatal fatal = assertInstanceOf(TaskOutcome.Fatal.class,
                run(handler(config().withMaxFileSizeMb(0)), args()));

        assertEquals("UNSUPPORTED_AUDIO", fatal.error().code());
    }

    @Test
    void missingStemIdIsInvalid() throws Exception {
        Map<String, Object> args = args();
        args.remove("stemId");

        TaskOutcome.Fatal fatal = assertInstanceOf(TaskOutcome.Fatal.class, run(handler(config()), args));

        assertEquals("INVALID_ARGUMENTS", fatal.error().code());
    }

    @Test
    void storageProblemsAreRetryable() throws Exception {
        store.failJsonUploads = true;
        TaskOutcome.Retryable upload = assertInstanceOf(TaskOutcome.Retryable.class,
                run(handler(config()), args()));
        assertEquals("STORAGE_ERROR", upload.error().code());

        store.failJsonUploads = false;
        store.failDownloads = true;
        TaskOutcome.Retryable download = assertInstanceOf(TaskOutcome.Retryable.class,
                run(handler(config()), args()));
        assertEquals("STORAGE_ERROR", download.error().code());
    }

    @Test
    void undeliveredWebhooksDoNotFailTheAnalysis() throws Exception {
        notifier.failing.add(WebhookEndpoint.COMPLETION);
        notifier.failing.add(WebhookEndpoint.WAVEFORM_UPDATE);

        assertInstanceOf(TaskOutcome.Success.class, run(handler(config()), args()));
        assertTrue(store.contains("waveforms/stem-7_waveform_inv-1.json"));
    }

    @Test
    void peakCountAboveConfiguredMaximumIsRejectedBeforeDownload() throws Exception {
        Map<String, Object> args = args();
        args.put("num_peaks", Integer.MAX_VALUE);

        TaskOutcome.Fatal fatal = assertInstanceOf(TaskOutcome.Fatal.class,
                run(handler(config().withMaxPeaks(500)), args));

        assertEquals("INVALID_ARGUMENTS", fatal.error().code());
        assertTrue(fatal.error().getMessage().contains("between 1 and 500"), fatal.error().getMessage());
        assertFalse(store.contains("waveforms/stem-7_waveform_inv-1.json"));
    }

    @Test
    void peakCountThatOverflowsAnIntIsRejected() throws Exception {
        Map<String, Object> args = args();
        args.put("num_peaks", 4294967297L);

        TaskOutcome.Fatal fatal = assertInstanceOf(TaskOutcome.Fatal.class, run(handler(config()), args));

        assertEquals("INVALID_ARGUMENTS", fatal.error().code());
    }
}
