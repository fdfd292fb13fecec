package waveflow.worker.error;

/**
 * The file is too large or not in an accepted container format.
 */
public class UnsupportedAudioException extends TaskException {

    public UnsupportedAudioException(String message) {
        super("UNSUPPORTED_AUDIO", false, message);
    }
}
