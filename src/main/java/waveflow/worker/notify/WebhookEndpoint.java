package waveflow.worker.notify;

/**
 * Named webhook callbacks, each posted to {@code {baseUrl}/{suffix}}.
 */
public enum WebhookEndpoint {
    HASH_CHECK("hash-check", true),
    COMPLETION("completion", true),
    MIXING_COMPLETE("mixing-complete", false),
    DUPLICATE_DELETE_COMPLETE("duplicate-delete-complete", false),
    WAVEFORM_UPDATE("waveform-update", false);

    private final String suffix;
    private final boolean critical;

    WebhookEndpoint(String suffix, boolean critical) {
        this.suffix = suffix;
        this.critical = critical;
    }

    public String suffix() {
        return suffix;
    }

    /** Delivery failure on a critical endpoint is reported to the caller instead of only logged. */
    public boolean critical() {
        return critical;
    }
}
