package waveflow.worker.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerConfigTest {

    private static Map<String, String> required() {
        Map<String, String> env = new HashMap<>();
        env.put("SQS_QUEUE_URL", "https://sqs.ap-northeast-2.amazonaws.com/123/audio");
        env.put("S3_BUCKET_NAME", "stems");
        env.put("WEBHOOK_URL", "https://api.example.com/webhooks");
        return env;
    }

    @Test
    void defaultsApplyWhenOnlyRequiredSettingsAreGiven() {
        WorkerConfig config = WorkerConfig.fromMap(required());

        assertEquals("stems", config.bucketName());
        assertEquals("ap-northeast-2", config.region());
        assertEquals(1, config.pollers());
        assertEquals(3, config.maxRetries());
        assertEquals(Duration.ofSeconds(60), config.retryBaseDelay());
        assertEquals(Duration.ofSeconds(300), config.retryMaxDelay());
        assertTrue(config.retryFatalErrors());
        assertEquals(1024, config.defaultPeaks());
        assertEquals(100_000, config.maxPeaks());
        assertEquals(100L * 1024 * 1024, config.maxFileSizeBytes());
        assertEquals(WorkerConfig.DEFAULT_TASK, config.defaultTask());
        assertEquals(Duration.ofSeconds(20), config.pollWait());
        assertNull(config.endpointOverride());
    }

    @Test
    void reportsEveryMissingVariable() {
        Map<String, String> env = required();
        env.remove("S3_BUCKET_NAME");
        env.put("WEBHOOK_URL", "  ");

        MissingConfigurationException e = assertThrows(MissingConfigurationException.class,
                () -> WorkerConfig.fromMap(env));

        assertEquals(List.of("S3_BUCKET_NAME", "WEBHOOK_URL"), e.missing());
    }

    @Test
    void readsOverrides() {
        Map<String, String> env = required();
        env.put("WORKER_POLLERS", "4");
        env.put("MAX_RETRIES", "5");
        env.put("RETRY_DELAY", "10");
        env.put("RETRY_FATAL_ERRORS", "false");
        env.put("ALLOWED_MIME_TYPES", "audio/wav, audio/flac");
        env.put("WORKER_TEMP_DIR", "/var/tmp/wf");
        env.put("AWS_ENDPOINT_URL", "http://localhost:4566");
        env.put("HEALTH_PORT", "0");

        WorkerConfig config = WorkerConfig.fromMap(env);

        assertEquals(4, config.pollers());
        assertEquals(5, config.maxRetries());
        assertEquals(Duration.ofSeconds(10), config.retryBaseDelay());
        assertFalse(config.retryFatalErrors());
        assertEquals(List.of("audio/wav", "audio/flac"), config.allowedMimeTypes());
        assertEquals(Path.of("/var/tmp/wf"), config.tempDir());
        assertEquals("http://localhost:4566", config.endpointOverride());
        assertEquals(0, config.healthPort());
    }

    @Test
    void clampsBrokerAndWebhookLimits() {
        Map<String, String> env = required();
        env.put("SQS_VISIBILITY_TIMEOUT", "7200");
        env.put("WEBHOOK_TIMEOUT", "2");

        WorkerConfig config = WorkerConfig.fromMap(env);

        assertEquals(Duration.ofHours(1), config.visibilityTimeout());
        assertEquals(Duration.ofSeconds(10), config.webhookTimeout());
    }

    @Test
    void rejectsNonNumericAndOutOfRangeValues() {
        Map<String, String> env = required();
        env.put("MAX_RETRIES", "three");
        assertThrows(IllegalArgumentException.class, () -> WorkerConfig.fromMap(env));

        env.put("MAX_RETRIES", "-1");
        assertThrows(IllegalArgumentException.class, () -> WorkerConfig.fromMap(env));

        env.remove("MAX_RETRIES");
        env.put("WORKER_POLLERS", "0");
        assertThrows(IllegalArgumentException.class, () -> WorkerConfig.fromMap(env));
    }

    @Test
    void defaultPeakCountMustFitUnderTheMaximum() {
        Map<String, String> env = required();
        env.put("MAX_WAVEFORM_PEAKS", "512");
        assertThrows(IllegalArgumentException.class, () -> WorkerConfig.fromMap(env));

        env.put("DEFAULT_WAVEFORM_PEAKS", "256");
        assertEquals(512, WorkerConfig.fromMap(env).maxPeaks());
    }
}
