package waveflow.worker.queue;

/**
 * Broker-level failure: poll, acknowledge or lease change could not be completed.
 */
public class QueueException extends Exception {

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
