package waveflow.worker.executor;

import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;
import waveflow.worker.notify.WebhookEndpoint;

import java.util.Optional;

/**
 * Executes one task kind. Implementations must be safe to re-run for the same invocation.
 */
public interface TaskHandler {

    TaskKind kind();

    /**
     * Run one attempt. Must not throw: every failure is reported as an outcome.
     * Local files must be allocated from {@code temp}; the executor releases them afterwards.
     */
    TaskOutcome handle(TaskInvocation invocation, TempResources temp);

    /**
     * Endpoint that receives the FAILURE envelope once the invocation is exhausted.
     */
    default Optional<WebhookEndpoint> failureEndpoint() {
        return Optional.empty();
    }

    /**
     * Identifier the webhook consumer correlates on ({@code job_id}).
     */
    default String jobId(TaskInvocation invocation) {
        return invocation.id();
    }
}
