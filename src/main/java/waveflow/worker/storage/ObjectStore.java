package waveflow.worker.storage;

import java.nio.file.Path;

/**
 * Blocking gateway to the object store.
 * Transfer operations report success instead of throwing; callers decide whether
 * a {@code false} is worth another attempt.
 */
public interface ObjectStore {

    /**
     * Download {@code key} into {@code target}, replacing any existing file.
     */
    boolean download(String key, Path target);

    /**
     * Upload a local file under {@code key}, overwriting any existing object.
     */
    boolean upload(Path source, String key);

    /**
     * Delete {@code key}. Deleting a key that does not exist counts as success.
     */
    boolean delete(String key);

    /**
     * Serialize {@code value} as JSON and store it under {@code key}.
     *
     * @return object URL, or null on failure
     */
    String uploadJson(Object value, String key);

    /**
     * Connectivity check without data transfer.
     *
     * @throws StorageUnavailableException if the bucket cannot be reached
     */
    void probe() throws StorageUnavailableException;
}
