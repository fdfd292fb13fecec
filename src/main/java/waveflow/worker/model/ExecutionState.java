package waveflow.worker.model;

/**
 * Lifecycle of one invocation inside the executor.
 */
public enum ExecutionState {
    /** Decoded, handler not yet invoked */
    PENDING,
    /** Handler running */
    RUNNING,
    /** Handler returned a result */
    SUCCEEDED,
    /** Handler failed, another attempt was scheduled */
    RETRY_SCHEDULED,
    /** Handler failed and no attempts remain */
    EXHAUSTED;

    /** Terminal states remove the message from the queue. */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
