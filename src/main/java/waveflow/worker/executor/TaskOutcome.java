package waveflow.worker.executor;

import waveflow.worker.error.TaskException;
import waveflow.worker.model.ProcessingResult;

/**
 * What a handler reports back to the executor. The retry decision reads the variant.
 */
public sealed interface TaskOutcome {

    record Success(ProcessingResult result) implements TaskOutcome {
    }

    /** Another attempt could succeed (network, storage, webhook). */
    record Retryable(TaskException error) implements TaskOutcome {
    }

    /** Another attempt will fail the same way (bad arguments, corrupt audio). */
    record Fatal(TaskException error) implements TaskOutcome {
    }

    static TaskOutcome failed(TaskException error) {
        return error.retryable() ? new Retryable(error) : new Fatal(error);
    }
}
