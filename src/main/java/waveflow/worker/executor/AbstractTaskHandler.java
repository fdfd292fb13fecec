package waveflow.worker.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.error.TaskException;
import waveflow.worker.error.UnexpectedTaskException;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskInvocation;

import java.io.IOException;

/**
 * Base for handlers written in plain exception style. Classifies whatever
 * {@link #execute} throws into a {@link TaskOutcome} and logs heap usage around it.
 */
public abstract class AbstractTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractTaskHandler.class);

    @Override
    public final TaskOutcome handle(TaskInvocation invocation, TempResources temp) {
        logMemory(invocation, "start");
        try {
            return new TaskOutcome.Success(execute(invocation, temp));
        } catch (TaskException e) {
            log.error("{} {} failed [{}]: {}", kind(), invocation.id(), e.code(), e.getMessage());
            return TaskOutcome.failed(e);
        } catch (IOException e) {
            log.error("{} {} failed with I/O error", kind(), invocation.id(), e);
            return new TaskOutcome.Retryable(UnexpectedTaskException.io(e));
        } catch (RuntimeException e) {
            log.error("{} {} failed unexpectedly", kind(), invocation.id(), e);
            return new TaskOutcome.Retryable(UnexpectedTaskException.internal(e));
        } finally {
            logMemory(invocation, "end");
        }
    }

    protected abstract ProcessingResult execute(TaskInvocation invocation, TempResources temp)
            throws TaskException, IOException;

    private void logMemory(TaskInvocation invocation, String stage) {
        if (!log.isDebugEnabled()) {
            return;
        }
        Runtime rt = Runtime.getRuntime();
        long usedMb = (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024);
        long maxMb = rt.maxMemory() / (1024 * 1024);
        log.debug("{} {} {}: heap {}MB / {}MB", kind(), invocation.id(), stage, usedMb, maxMb);
    }
}
