package waveflow.worker.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.error.TaskException;
import waveflow.worker.error.UnexpectedTaskException;
import waveflow.worker.model.ExecutionState;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;
import waveflow.worker.notify.Notifier;
import waveflow.worker.notify.WebhookEndpoint;
import waveflow.worker.notify.WebhookEnvelope;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs one attempt of an invocation and decides what happens next.
 * <p>
 * PENDING -> RUNNING -> SUCCEEDED | RETRY_SCHEDULED | EXHAUSTED.
 * Temp files of the attempt are released on every path, before any retry is scheduled.
 * Never throws.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final RetryPolicy retryPolicy;
    private final boolean retryFatalErrors;
    private final WorkArea workArea;
    private final Notifier notifier;

    public TaskExecutor(RetryPolicy retryPolicy, boolean retryFatalErrors, WorkArea workArea, Notifier notifier) {
        this.retryPolicy = retryPolicy;
        this.retryFatalErrors = retryFatalErrors;
        this.workArea = workArea;
        this.notifier = notifier;
    }

    public ExecutionReport execute(TaskHandler handler, TaskInvocation invocation, RetryScheduler scheduler) {
        long startNanos = System.nanoTime();
        TaskKind kind = handler.kind();
        log.info("Running {} id={} attempt={}/{}", kind, invocation.id(), invocation.attempt(),
                retryPolicy.maxRetries());

        TaskOutcome outcome = runAttempt(handler, invocation);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        if (outcome instanceof TaskOutcome.Success success) {
            log.info("{} id={} succeeded in {}ms", kind, invocation.id(), elapsed.toMillis());
            return new ExecutionReport(invocation, ExecutionState.SUCCEEDED, success.result(), null, elapsed);
        }

        TaskException error = errorOf(outcome);
        boolean fatal = outcome instanceof TaskOutcome.Fatal;

        if (kind.retryable() && (!fatal || retryFatalErrors) && retryPolicy.canRetry(invocation.attempt())) {
            Duration delay = retryPolicy.delayFor(invocation.attempt());
            TaskInvocation next = invocation.nextAttempt();
            scheduler.schedule(next, delay);
            log.warn("{} id={} attempt {} failed [{}], retry {} of {} in {}s", kind, invocation.id(),
                    invocation.attempt(), error.code(), next.attempt(), retryPolicy.maxRetries(), delay.toSeconds());
            ProcessingResult result = ProcessingResult.failure(invocation.id(), kind, error.code(), error.getMessage());
            return new ExecutionReport(invocation, ExecutionState.RETRY_SCHEDULED, result, delay, elapsed);
        }

        log.error("{} id={} exhausted after attempt {} [{}]: {}", kind, invocation.id(), invocation.attempt(),
                error.code(), error.getMessage());
        notifyFailure(handler, invocation, error);
        ProcessingResult result = ProcessingResult.failure(invocation.id(), kind, error.code(), error.getMessage());
        return new ExecutionReport(invocation, ExecutionState.EXHAUSTED, result, null, elapsed);
    }

    private TaskOutcome runAttempt(TaskHandler handler, TaskInvocation invocation) {
        try (TempResources temp = workArea.open(invocation)) {
            return handler.handle(invocation, temp);
        } catch (IOException e) {
            log.error("Cannot prepare work area {}", workArea.root(), e);
            return new TaskOutcome.Retryable(UnexpectedTaskException.io(e));
        } catch (RuntimeException e) {
            log.error("{} id={} escaped its handler", handler.kind(), invocation.id(), e);
            return new TaskOutcome.Retryable(UnexpectedTaskException.internal(e));
        }
    }

    private void notifyFailure(TaskHandler handler, TaskInvocation invocation, TaskException error) {
        Optional<WebhookEndpoint> endpoint = handler.failureEndpoint();
        if (endpoint.isEmpty()) {
            return;
        }
        WebhookEnvelope envelope = WebhookEnvelope.failure(handler.jobId(invocation), invocation, error.code(),
                error.getMessage());
        if (!notifier.send(endpoint.get(), envelope)) {
            log.warn("FAILURE webhook for {} id={} was not delivered", handler.kind(), invocation.id());
        }
    }

    private static TaskException errorOf(TaskOutcome outcome) {
        if (outcome instanceof TaskOutcome.Retryable retryable) {
            return retryable.error();
        }
        return ((TaskOutcome.Fatal) outcome).error();
    }
}
