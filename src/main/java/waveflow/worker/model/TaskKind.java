package waveflow.worker.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of task kinds this worker can execute.
 * Each kind is addressed on the wire by the producer's task name.
 */
public enum TaskKind {
    /** Download, hash, report the hash. */
    HASH_AND_NOTIFY("app.tasks.generate_hash_and_webhook", true),
    /** Delete a duplicate object from storage. */
    DELETE_DUPLICATE("app.tasks.process_duplicate_file", true),
    /** Full analysis: hash, waveform peaks, duration. */
    ANALYZE_AUDIO("app.tasks.process_audio_analysis", true),
    /** Mix several stems into one WAV. */
    MIX_STEMS("app.tasks.mix_stems_and_upload", true),
    /** Connectivity and resource probe. */
    HEALTH_CHECK("health_check", false),
    /** Sweep abandoned files from the work area. */
    CLEANUP_TEMP("cleanup_temp_files", false);

    private final String wireName;
    private final boolean retryable;

    TaskKind(String wireName, boolean retryable) {
        this.wireName = wireName;
        this.retryable = retryable;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether a failed invocation of this kind may be scheduled for another attempt. */
    public boolean retryable() {
        return retryable;
    }

    /**
     * Resolve a wire task name. Accepts the full producer name, its last
     * dotted segment, or the enum constant name (any case).
     */
    public static Optional<TaskKind> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        String suffix = trimmed.substring(trimmed.lastIndexOf('.') + 1);
        for (TaskKind kind : values()) {
            if (kind.wireName.equals(trimmed)
                    || kind.wireName.substring(kind.wireName.lastIndexOf('.') + 1).equals(suffix)
                    || kind.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
