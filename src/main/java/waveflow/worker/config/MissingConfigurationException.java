package waveflow.worker.config;

import java.util.List;

/**
 * Thrown at startup when required environment variables are not set.
 */
public class MissingConfigurationException extends RuntimeException {

    private final List<String> missing;

    public MissingConfigurationException(List<String> missing) {
        super("Required environment variables are not set: " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
