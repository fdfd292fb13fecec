package waveflow.worker.storage;

/**
 * Raised by {@link ObjectStore#probe()} when the bucket is unreachable.
 */
public class StorageUnavailableException extends Exception {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
