package waveflow.worker.tasks;

import waveflow.worker.cleanup.SweepResult;
import waveflow.worker.cleanup.TempFileSweeper;
import waveflow.worker.executor.AbstractTaskHandler;
import waveflow.worker.executor.TempResources;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue-triggered sweep of the work area.
 */
public class CleanupTempHandler extends AbstractTaskHandler {

    private final TempFileSweeper sweeper;

    public CleanupTempHandler(TempFileSweeper sweeper) {
        this.sweeper = sweeper;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CLEANUP_TEMP;
    }

    @Override
    protected ProcessingResult execute(TaskInvocation invocation, TempResources temp) throws IOException {
        SweepResult sweep = sweeper.sweep();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("directory", sweeper.dir().toString());
        result.put("scanned", sweep.scanned());
        result.put("cleaned_files", sweep.deleted());
        result.put("bytes_reclaimed", sweep.bytesReclaimed());
        result.put("failures", sweep.failures());
        return ProcessingResult.success(invocation.id(), kind(), result);
    }
}
