package waveflow.worker.tasks;

import waveflow.worker.executor.AbstractTaskHandler;
import waveflow.worker.executor.TempResources;
import waveflow.worker.health.HealthProbe;
import waveflow.worker.health.HealthReport;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;
import waveflow.worker.util.Json;

import java.util.Map;

/**
 * Queue-triggered health probe. Reports sub-probe failures as fields, never fails itself.
 */
public class HealthCheckHandler extends AbstractTaskHandler {

    private final HealthProbe probe;

    public HealthCheckHandler(HealthProbe probe) {
        this.probe = probe;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.HEALTH_CHECK;
    }

    @Override
    protected ProcessingResult execute(TaskInvocation invocation, TempResources temp) {
        HealthReport report = probe.check();
        Map<String, Object> result = Json.mapper().convertValue(report, Json.MAP_TYPE);
        return ProcessingResult.success(invocation.id(), kind(), result);
    }
}
