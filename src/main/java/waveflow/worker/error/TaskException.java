package waveflow.worker.error;

/**
 * Base class of failures raised while executing a task handler.
 * Carries a machine-readable code for the FAILURE webhook and whether
 * another attempt could plausibly succeed.
 */
public abstract class TaskException extends Exception {

    private final String code;
    private final boolean retryable;

    protected TaskException(String code, boolean retryable, String message) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    protected TaskException(String code, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    public boolean retryable() {
        return retryable;
    }
}
