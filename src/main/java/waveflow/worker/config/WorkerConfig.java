package waveflow.worker.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for the audio worker.
 * Built once at process entry and handed to every component through {@link Dependencies}.
 * All optional settings have sensible defaults.
 */
public final class WorkerConfig {

    public static final String DEFAULT_TASK = "app.tasks.process_audio_analysis";

    // Queue settings
    private String queueUrl;
    private int pollers = 1;
    private Duration pollWait = Duration.ofSeconds(20);
    private Duration visibilityTimeout = Duration.ofSeconds(300);
    private Duration pollErrorBackoff = Duration.ofSeconds(5);
    private String defaultTask = DEFAULT_TASK;

    // AWS settings
    private String region = "ap-northeast-2";
    private String endpointOverride;
    private String bucketName;

    // Webhook settings
    private String webhookUrl;
    private Duration webhookTimeout = Duration.ofSeconds(10);

    // Retry settings
    private int maxRetries = 3;
    private Duration retryBaseDelay = Duration.ofSeconds(60);
    private Duration retryMaxDelay = Duration.ofSeconds(300);
    private boolean retryFatalErrors = true;

    // Audio settings
    private int defaultPeaks = 1024;
    private int maxPeaks = 100_000;
    private long maxFileSizeMb = 100;
    private List<String> allowedMimeTypes = List.of(
            "audio/wav", "audio/mpeg", "audio/mp3", "audio/flac", "audio/ogg");

    // Temp area settings
    private Path tempDir = Path.of(System.getProperty("java.io.tmpdir"), "waveflow");
    private Duration cleanupMaxAge = Duration.ofSeconds(1800);
    private Duration cleanupAggressiveAge = Duration.ofSeconds(7200);
    private Duration cleanupInterval = Duration.ofSeconds(600);
    private Duration statsInterval = Duration.ofSeconds(60);

    // Status server
    private int healthPort = 8080;

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Build config from an environment-like map and validate required settings.
     *
     * @throws MissingConfigurationException if a required variable is absent
     */
    public static WorkerConfig fromMap(Map<String, String> env) {
        WorkerConfig config = new WorkerConfig();

        config.queueUrl = get(env, "SQS_QUEUE_URL", null);
        config.bucketName = get(env, "S3_BUCKET_NAME", null);
        config.webhookUrl = get(env, "WEBHOOK_URL", null);
        config.region = get(env, "AWS_REGION", config.region);
        config.endpointOverride = get(env, "AWS_ENDPOINT_URL", null);
        config.defaultTask = get(env, "WORKER_DEFAULT_TASK", config.defaultTask);

        config.pollers = getInt(env, "WORKER_POLLERS", config.pollers);
        config.pollWait = getSeconds(env, "SQS_WAIT_TIME_SECONDS", config.pollWait);
        config.visibilityTimeout = getSeconds(env, "SQS_VISIBILITY_TIMEOUT", config.visibilityTimeout);
        config.pollErrorBackoff = getSeconds(env, "POLL_ERROR_BACKOFF", config.pollErrorBackoff);
        config.webhookTimeout = getSeconds(env, "WEBHOOK_TIMEOUT", config.webhookTimeout);

        config.maxRetries = getInt(env, "MAX_RETRIES", config.maxRetries);
        config.retryBaseDelay = getSeconds(env, "RETRY_DELAY", config.retryBaseDelay);
        config.retryMaxDelay = getSeconds(env, "RETRY_MAX_DELAY", config.retryMaxDelay);
        config.retryFatalErrors = Boolean.parseBoolean(
                get(env, "RETRY_FATAL_ERRORS", String.valueOf(config.retryFatalErrors)));

        config.defaultPeaks = getInt(env, "DEFAULT_WAVEFORM_PEAKS", config.defaultPeaks);
        config.maxPeaks = getInt(env, "MAX_WAVEFORM_PEAKS", config.maxPeaks);
        config.maxFileSizeMb = getInt(env, "MAX_FILE_SIZE_MB", (int) config.maxFileSizeMb);
        String mimeTypes = get(env, "ALLOWED_MIME_TYPES", null);
        if (mimeTypes != null) {
            config.allowedMimeTypes = List.of(mimeTypes.trim().split("\\s*,\\s*"));
        }

        String tempDir = get(env, "WORKER_TEMP_DIR", null);
        if (tempDir != null) {
            config.tempDir = Path.of(tempDir);
        }
        config.cleanupMaxAge = getSeconds(env, "CLEANUP_MAX_AGE", config.cleanupMaxAge);
        config.cleanupAggressiveAge = getSeconds(env, "CLEANUP_AGGRESSIVE_AGE", config.cleanupAggressiveAge);
        config.cleanupInterval = getSeconds(env, "CLEANUP_INTERVAL", config.cleanupInterval);
        config.healthPort = getInt(env, "HEALTH_PORT", config.healthPort);

        config.validate();
        return config;
    }

    /**
     * Check that every required setting is present and numeric settings are in range.
     */
    public WorkerConfig validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(queueUrl)) {
            missing.add("SQS_QUEUE_URL");
        }
        if (isBlank(bucketName)) {
            missing.add("S3_BUCKET_NAME");
        }
        if (isBlank(webhookUrl)) {
            missing.add("WEBHOOK_URL");
        }
        if (!missing.isEmpty()) {
            throw new MissingConfigurationException(missing);
        }
        if (pollers < 1) {
            throw new IllegalArgumentException("WORKER_POLLERS must be at least 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("MAX_RETRIES must not be negative");
        }
        if (defaultPeaks < 1) {
            throw new IllegalArgumentException("DEFAULT_WAVEFORM_PEAKS must be positive");
        }
        if (defaultPeaks > maxPeaks) {
            throw new IllegalArgumentException("DEFAULT_WAVEFORM_PEAKS must not exceed MAX_WAVEFORM_PEAKS (" + maxPeaks + ")");
        }
        return this;
    }

    private static String get(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int getInt(Map<String, String> env, String key, int fallback) {
        String value = get(env, key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Duration getSeconds(Map<String, String> env, String key, Duration fallback) {
        String value = get(env, key, null);
        return value == null ? fallback : Duration.ofSeconds(getInt(env, key, 0));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // Getters
    public String queueUrl() {
        return queueUrl;
    }

    public int pollers() {
        return pollers;
    }

    public Duration pollWait() {
        return pollWait;
    }

    /** Lease requested on receive, clamped to the broker maximum of one hour. */
    public Duration visibilityTimeout() {
        return visibilityTimeout.compareTo(Duration.ofHours(1)) > 0 ? Duration.ofHours(1) : visibilityTimeout;
    }

    public Duration pollErrorBackoff() {
        return pollErrorBackoff;
    }

    public String defaultTask() {
        return defaultTask;
    }

    public String region() {
        return region;
    }

    public String endpointOverride() {
        return endpointOverride;
    }

    public String bucketName() {
        return bucketName;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    /** Webhook request timeout, kept within 10-30 seconds. */
    public Duration webhookTimeout() {
        long seconds = Math.max(10, Math.min(30, webhookTimeout.toSeconds()));
        return Duration.ofSeconds(seconds);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public boolean retryFatalErrors() {
        return retryFatalErrors;
    }

    public int defaultPeaks() {
        return defaultPeaks;
    }

    /** Upper bound on the number of peaks a single request may ask for. */
    public int maxPeaks() {
        return maxPeaks;
    }

    public long maxFileSizeBytes() {
        return maxFileSizeMb * 1024 * 1024;
    }

    public long maxFileSizeMb() {
        return maxFileSizeMb;
    }

    public List<String> allowedMimeTypes() {
        return allowedMimeTypes;
    }

    public Path tempDir() {
        return tempDir;
    }

    public Duration cleanupMaxAge() {
        return cleanupMaxAge;
    }

    public Duration cleanupAggressiveAge() {
        return cleanupAggressiveAge;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    public Duration statsInterval() {
        return statsInterval;
    }

    public int healthPort() {
        return healthPort;
    }

    // Fluent setters for testing/customization
    public WorkerConfig withQueueUrl(String url) {
        this.queueUrl = url;
        return this;
    }

    public WorkerConfig withBucketName(String bucket) {
        this.bucketName = bucket;
        return this;
    }

    public WorkerConfig withWebhookUrl(String url) {
        this.webhookUrl = url;
        return this;
    }

    public WorkerConfig withPollers(int pollers) {
        this.pollers = pollers;
        return this;
    }

    public WorkerConfig withPollWait(Duration wait) {
        this.pollWait = wait;
        return this;
    }

    public WorkerConfig withPollErrorBackoff(Duration backoff) {
        this.pollErrorBackoff = backoff;
        return this;
    }

    public WorkerConfig withDefaultTask(String task) {
        this.defaultTask = task;
        return this;
    }

    public WorkerConfig withMaxRetries(int retries) {
        this.maxRetries = retries;
        return this;
    }

    public WorkerConfig withRetryDelays(Duration base, Duration cap) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = cap;
        return this;
    }

    public WorkerConfig withRetryFatalErrors(boolean retry) {
        this.retryFatalErrors = retry;
        return this;
    }

    public WorkerConfig withDefaultPeaks(int peaks) {
        this.defaultPeaks = peaks;
        return this;
    }

    public WorkerConfig withMaxPeaks(int peaks) {
        this.maxPeaks = peaks;
        return this;
    }

    public WorkerConfig withMaxFileSizeMb(long mb) {
        this.maxFileSizeMb = mb;
        return this;
    }

    public WorkerConfig withTempDir(Path dir) {
        this.tempDir = dir;
        return this;
    }

    public WorkerConfig withCleanupAges(Duration maxAge, Duration aggressiveAge) {
        this.cleanupMaxAge = maxAge;
        this.cleanupAggressiveAge = aggressiveAge;
        return this;
    }

    public WorkerConfig withCleanupInterval(Duration interval) {
        this.cleanupInterval = interval;
        return this;
    }

    public WorkerConfig withHealthPort(int port) {
        this.healthPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "queueUrl='" + queueUrl + '\'' +
                ", bucket='" + bucketName + '\'' +
                ", region='" + region + '\'' +
                ", pollers=" + pollers +
                ", maxRetries=" + maxRetries +
                ", retryDelay=" + retryBaseDelay.toSeconds() + "s/" + retryMaxDelay.toSeconds() + "s" +
                ", peaks=" + defaultPeaks + "/" + maxPeaks +
                ", tempDir=" + tempDir +
                ", healthPort=" + healthPort +
                '}';
    }
}
