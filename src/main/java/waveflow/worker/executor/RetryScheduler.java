package waveflow.worker.executor;

import waveflow.worker.model.TaskInvocation;

import java.time.Duration;

/**
 * Arranges for {@code next} to be executed again after {@code delay}.
 */
@FunctionalInterface
public interface RetryScheduler {

    void schedule(TaskInvocation next, Duration delay);
}
