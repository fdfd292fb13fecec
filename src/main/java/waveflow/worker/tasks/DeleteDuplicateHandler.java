package waveflow.worker.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.error.StorageException;
import waveflow.worker.error.TaskException;
import waveflow.worker.error.WebhookDeliveryException;
import waveflow.worker.executor.AbstractTaskHandler;
import waveflow.worker.executor.TempResources;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskArgs;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;
import waveflow.worker.notify.Notifier;
import waveflow.worker.notify.WebhookEndpoint;
import waveflow.worker.notify.WebhookEnvelope;
import waveflow.worker.storage.ObjectStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Removes an upload that downstream identified as a duplicate. No download.
 */
public class DeleteDuplicateHandler extends AbstractTaskHandler {

    private static final Logger log = LoggerFactory.getLogger(DeleteDuplicateHandler.class);

    private final ObjectStore store;
    private final Notifier notifier;

    public DeleteDuplicateHandler(ObjectStore store, Notifier notifier) {
        this.store = store;
        this.notifier = notifier;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.DELETE_DUPLICATE;
    }

    @Override
    public Optional<WebhookEndpoint> failureEndpoint() {
        return Optional.of(WebhookEndpoint.DUPLICATE_DELETE_COMPLETE);
    }

    @Override
    public String jobId(TaskInvocation invocation) {
        return invocation.args().string("stemId", "stem_id").orElse(invocation.id());
    }

    @Override
    protected ProcessingResult execute(TaskInvocation invocation, TempResources temp) throws TaskException {
        TaskArgs args = invocation.args();
        String filepath = args.requireString("filepath", "filePath", "file_path");
        String stemId = args.requireString("stemId", "stem_id");

        if (!store.delete(filepath)) {
            throw new StorageException("delete failed: " + filepath);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("stemId", stemId);
        result.put("userId", args.stringOrNull("userId", "user_id"));
        result.put("trackId", args.stringOrNull("trackId", "track_id"));
        result.put("audio_hash", args.stringOrNull("audio_hash", "audioHash"));
        result.put("filepath", filepath);
        result.put("status", "duplicate_file_deleted");

        try {
            notifier.deliver(WebhookEndpoint.DUPLICATE_DELETE_COMPLETE,
                    WebhookEnvelope.success(stemId, invocation, result));
        } catch (WebhookDeliveryException e) {
            log.warn("Duplicate delete for stem {} done, webhook not delivered: {}", stemId, e.getMessage());
        }

        log.info("Duplicate {} deleted for stem {}", filepath, stemId);
        return ProcessingResult.success(invocation.id(), kind(), result);
    }
}
