package waveflow.worker.model;

/**
 * Mono PCM samples in [-1.0, 1.0] at the source's native sample rate.
 */
public record DecodedAudio(float[] samples, int sampleRate) {

    public DecodedAudio {
        if (samples == null) {
            throw new IllegalArgumentException("samples must not be null");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got " + sampleRate);
        }
    }

    public int length() {
        return samples.length;
    }

    public double durationSeconds() {
        return (double) samples.length / sampleRate;
    }
}
