package waveflow.worker.error;

/**
 * Wraps an I/O or runtime failure that escaped a handler. Always retryable.
 */
public class UnexpectedTaskException extends TaskException {

    public static final String IO_ERROR = "IO_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private UnexpectedTaskException(String code, Throwable cause) {
        super(code, true, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    public static UnexpectedTaskException io(Throwable cause) {
        return new UnexpectedTaskException(IO_ERROR, cause);
    }

    public static UnexpectedTaskException internal(Throwable cause) {
        return new UnexpectedTaskException(INTERNAL_ERROR, cause);
    }
}
