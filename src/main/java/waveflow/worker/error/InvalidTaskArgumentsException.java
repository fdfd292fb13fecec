package waveflow.worker.error;

/**
 * A required argument is missing or malformed. Re-running cannot fix it.
 */
public class InvalidTaskArgumentsException extends TaskException {

    public InvalidTaskArgumentsException(String message) {
        super("INVALID_ARGUMENTS", false, message);
    }
}
