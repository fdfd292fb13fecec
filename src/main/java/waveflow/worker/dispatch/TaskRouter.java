package waveflow.worker.dispatch;

import waveflow.worker.executor.TaskHandler;
import waveflow.worker.model.TaskKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps task kinds to their handlers. Every kind must have a handler.
 */
public class TaskRouter {

    private final Map<TaskKind, TaskHandler> handlers = new EnumMap<>(TaskKind.class);

    public TaskRouter(TaskHandler hashAndNotify, TaskHandler deleteDuplicate, TaskHandler analyzeAudio,
            TaskHandler mixStems, TaskHandler healthCheck, TaskHandler cleanupTemp) {
        for (TaskKind kind : TaskKind.values()) {
            TaskHandler handler = switch (kind) {
                case HASH_AND_NOTIFY -> hashAndNotify;
                case DELETE_DUPLICATE -> deleteDuplicate;
                case ANALYZE_AUDIO -> analyzeAudio;
                case MIX_STEMS -> mixStems;
                case HEALTH_CHECK -> healthCheck;
                case CLEANUP_TEMP -> cleanupTemp;
            };
            if (handler == null || handler.kind() != kind) {
                throw new IllegalArgumentException("handler for " + kind + " is missing or of the wrong kind");
            }
            handlers.put(kind, handler);
        }
    }

    public TaskHandler handlerFor(TaskKind kind) {
        return handlers.get(kind);
    }

    /**
     * Resolve a wire task name. Empty for a name no kind answers to.
     */
    public Optional<TaskHandler> resolve(String kindName) {
        return TaskKind.fromWireName(kindName).map(this::handlerFor);
    }
}
