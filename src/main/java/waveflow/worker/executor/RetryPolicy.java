package waveflow.worker.executor;

import waveflow.worker.config.WorkerConfig;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code k} (0-based) waits
 * {@code min(base * 2^k, cap)} before attempt {@code k + 1}.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryPolicy from(WorkerConfig config) {
        return new RetryPolicy(config.maxRetries(), config.retryBaseDelay(), config.retryMaxDelay());
    }

    public int maxRetries() {
        return maxRetries;
    }

    /** Whether a failure on {@code attempt} may be followed by another attempt. */
    public boolean canRetry(int attempt) {
        return attempt < maxRetries;
    }

    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        // 2^31 seconds exceeds any sane cap
        if (attempt >= 31) {
            return maxDelay;
        }
        long seconds = baseDelay.toSeconds() * (1L << attempt);
        return seconds >= maxDelay.toSeconds() ? maxDelay : Duration.ofSeconds(seconds);
    }
}
