package waveflow.worker.executor;

import waveflow.worker.model.ExecutionState;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskInvocation;

import java.time.Duration;

/**
 * Final state of one executed attempt.
 *
 * @param retryDelay backoff handed to the scheduler; null unless {@code RETRY_SCHEDULED}
 */
public record ExecutionReport(
        TaskInvocation invocation,
        ExecutionState state,
        ProcessingResult result,
        Duration retryDelay,
        Duration elapsed) {

    /** Succeeded or exhausted: the message must be acknowledged. */
    public boolean terminal() {
        return state.isTerminal();
    }
}
