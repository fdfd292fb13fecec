package waveflow.worker.dispatch;

/**
 * Why a message body could not be turned into a task invocation.
 */
public enum MalformedReason {
    /** Empty or whitespace-only body. */
    EMPTY,
    /** Not parseable as JSON. */
    INVALID_JSON,
    /** {@code {}}, {@code null}, {@code ""} or {@code []}. */
    DEGENERATE,
    /** Valid JSON that matches neither envelope shape. */
    INVALID_ENVELOPE
}
