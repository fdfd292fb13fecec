package waveflow.worker.error;

/**
 * An object-store transfer did not complete.
 */
public class StorageException extends TaskException {

    public StorageException(String message) {
        super("STORAGE_ERROR", true, message);
    }
}
