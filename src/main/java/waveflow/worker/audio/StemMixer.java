package waveflow.worker.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.model.DecodedAudio;

import java.util.ArrayList;
import java.util.List;

/**
 * Mixes mono stems by per-sample mean and soft-limits the result.
 */
public final class StemMixer {

    private static final Logger log = LoggerFactory.getLogger(StemMixer.class);

    /** Post-mix peak ceiling. */
    public static final double PEAK_LIMIT = 0.95;

    /**
     * Mix stems sharing the first stem's sample rate; stems at another rate are
     * skipped. Shorter stems are zero-padded to the longest included stem.
     */
    public MixResult mix(List<Stem> stems) {
        if (stems.isEmpty()) {
            throw new IllegalArgumentException("at least one stem is required");
        }

        int sampleRate = stems.get(0).audio().sampleRate();
        List<Stem> included = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Stem stem : stems) {
            if (stem.audio().sampleRate() != sampleRate) {
                log.warn("Skipping stem {}: sample rate {} Hz differs from {} Hz",
                        stem.key(), stem.audio().sampleRate(), sampleRate);
                skipped.add(stem.key());
                continue;
            }
            included.add(stem);
        }

        int length = 0;
        for (Stem stem : included) {
            length = Math.max(length, stem.audio().length());
        }

        double[] sum = new double[length];
        for (Stem stem : included) {
            float[] samples = stem.audio().samples();
            for (int i = 0; i < samples.length; i++) {
                sum[i] += samples[i];
            }
        }

        int count = included.size();
        double peak = 0.0;
        for (int i = 0; i < length; i++) {
            sum[i] /= count;
            peak = Math.max(peak, Math.abs(sum[i]));
        }

        double scale = peak > PEAK_LIMIT ? PEAK_LIMIT / peak : 1.0;
        float[] mixed = new float[length];
        for (int i = 0; i < length; i++) {
            mixed[i] = (float) (sum[i] * scale);
        }

        log.info("Mixed {} stems ({} skipped): {} samples at {} Hz, peak {} -> {}",
                count, skipped.size(), length, sampleRate,
                String.format("%.4f", peak), String.format("%.4f", peak * scale));

        List<String> includedKeys = included.stream().map(Stem::key).toList();
        return new MixResult(new DecodedAudio(mixed, sampleRate), includedKeys, List.copyOf(skipped), peak);
    }

    /**
     * One decoded stem and the storage key it came from.
     */
    public record Stem(String key, DecodedAudio audio) {
    }

    /**
     * Mixed signal plus bookkeeping for the result payload.
     */
    public record MixResult(DecodedAudio audio, List<String> included, List<String> skipped, double peakBeforeLimit) {
    }
}
