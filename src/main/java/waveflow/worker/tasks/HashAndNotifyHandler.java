package waveflow.worker.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.audio.ContentHasher;
import waveflow.worker.error.StorageException;
import waveflow.worker.error.TaskException;
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

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Downloads an upload, hashes it and reports the hash. Duplicate detection happens
 * downstream; the webhook is this task's only visible effect, so its failure fails the task.
 */
public class HashAndNotifyHandler extends AbstractTaskHandler {

    private static final Logger log = LoggerFactory.getLogger(HashAndNotifyHandler.class);

    private final ObjectStore store;
    private final ContentHasher hasher;
    private final Notifier notifier;

    public HashAndNotifyHandler(ObjectStore store, ContentHasher hasher, Notifier notifier) {
        this.store = store;
        this.hasher = hasher;
        this.notifier = notifier;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.HASH_AND_NOTIFY;
    }

    @Override
    public Optional<WebhookEndpoint> failureEndpoint() {
        return Optional.of(WebhookEndpoint.HASH_CHECK);
    }

    @Override
    public String jobId(TaskInvocation invocation) {
        return invocation.args().string("stemId", "stem_id").orElse(invocation.id());
    }

    @Override
    protected ProcessingResult execute(TaskInvocation invocation, TempResources temp)
            throws TaskException, IOException {
        TaskArgs args = invocation.args();
        String filepath = args.requireString("filepath", "filePath", "file_path");
        String stemId = args.requireString("stemId", "stem_id");

        Path local = temp.newFile("hash-source", StorageKeys.extension(filepath));
        if (!store.download(filepath, local)) {
            throw new StorageException("download failed: " + filepath);
        }

        String audioHash = hasher.hash(local);
        log.info("Hash for stem {}: {}", stemId, audioHash);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", invocation.id());
        payload.put("stemId", stemId);
        payload.put("userId", args.stringOrNull("userId", "user_id"));
        payload.put("trackId", args.stringOrNull("trackId", "track_id"));
        payload.put("stageId", args.stringOrNull("stageId", "stage_id"));
        payload.put("filepath", filepath);
        payload.put("audio_hash", audioHash);
        payload.put("timestamp", args.stringOrNull("timestamp"));
        payload.put("original_filename", args.stringOrNull("original_filename", "originalFilename"));
        payload.put("status", "hash_generated");

        notifier.deliver(WebhookEndpoint.HASH_CHECK, WebhookEnvelope.success(stemId, invocation, payload));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("stemId", stemId);
        result.put("stageId", payload.get("stageId"));
        result.put("audio_hash", audioHash);
        result.put("filepath", filepath);
        result.put("status", "hash_sent_to_webhook");
        return ProcessingResult.success(invocation.id(), kind(), result);
    }
}
