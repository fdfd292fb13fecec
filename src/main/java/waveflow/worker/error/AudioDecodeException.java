package waveflow.worker.error;

/**
 * Every decode strategy failed for a file.
 */
public class AudioDecodeException extends TaskException {

    public AudioDecodeException(String message) {
        super("AUDIO_DECODE_FAILED", false, message);
    }

    public AudioDecodeException(String message, Throwable cause) {
        super("AUDIO_DECODE_FAILED", false, message, cause);
    }
}
