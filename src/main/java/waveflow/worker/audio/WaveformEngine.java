package waveflow.worker.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.error.AudioDecodeException;
import waveflow.worker.model.DecodedAudio;
import waveflow.worker.model.WaveformSummary;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Content hash, duration and peak envelope of an audio file.
 * Pure computation: no shared state, safe to call from any poller thread.
 */
public final class WaveformEngine {

    private static final Logger log = LoggerFactory.getLogger(WaveformEngine.class);

    private final ContentHasher hasher;
    private final AudioLoader loader;

    public WaveformEngine(ContentHasher hasher, AudioLoader loader) {
        this.hasher = hasher;
        this.loader = loader;
    }

    public static WaveformEngine standard() {
        return new WaveformEngine(new ContentHasher(), AudioLoader.standard());
    }

    /**
     * Full analysis: hash the raw bytes, then decode and summarize.
     */
    public AudioAnalysis analyze(Path file, int numPeaks) throws IOException, AudioDecodeException {
        long size = Files.size(file);
        String hash = hasher.hash(file);
        DecodedAudio audio = loader.load(file);
        WaveformSummary summary = summarize(audio, numPeaks);
        log.info("Analyzed {}: {} bytes, {}s at {} Hz, {} peaks",
                file.getFileName(), size, String.format("%.2f", summary.durationSeconds()),
                summary.sampleRate(), summary.numPeaks());
        return new AudioAnalysis(hash, size, summary);
    }

    public String hash(Path file) throws IOException {
        return hasher.hash(file);
    }

    public DecodedAudio decode(Path file) throws IOException, AudioDecodeException {
        return loader.load(file);
    }

    public WaveformSummary summarize(DecodedAudio audio, int numPeaks) {
        List<Double> peaks = peaks(audio.samples(), numPeaks);
        return new WaveformSummary(peaks, audio.durationSeconds(), audio.sampleRate(), numPeaks, Instant.now());
    }

    /**
     * Normalized peak envelope with exactly {@code numPeaks} entries in [0, 1],
     * rounded to 4 decimals.
     * <p>
     * Samples are split into {@code numPeaks} equal windows, the integer-division
     * remainder going to the last window; each peak is its window's maximum
     * absolute amplitude. With fewer samples than peaks, the raw absolute values
     * are used and zero-padded. Silence stays all zeros.
     */
    public static List<Double> peaks(float[] samples, int numPeaks) {
        if (numPeaks < 1) {
            throw new IllegalArgumentException("numPeaks must be positive, got " + numPeaks);
        }
        int total = samples.length;
        double[] raw = new double[numPeaks];

        if (total < numPeaks) {
            for (int i = 0; i < total; i++) {
                raw[i] = Math.abs(samples[i]);
            }
        } else {
            int window = total / numPeaks;
            for (int p = 0; p < numPeaks; p++) {
                int start = p * window;
                int end = p == numPeaks - 1 ? total : start + window;
                double max = 0.0;
                for (int i = start; i < end; i++) {
                    double v = Math.abs(samples[i]);
                    if (v > max) {
                        max = v;
                    }
                }
                raw[p] = max;
            }
        }

        double globalMax = 0.0;
        for (double v : raw) {
            globalMax = Math.max(globalMax, v);
        }

        List<Double> peaks = new ArrayList<>(numPeaks);
        for (double v : raw) {
            double normalized = globalMax > 0 ? v / globalMax : v;
            peaks.add(Math.round(normalized * 10_000.0) / 10_000.0);
        }
        return peaks;
    }

    /**
     * Result of {@link #analyze(Path, int)}.
     */
    public record AudioAnalysis(String hash, long fileSize, WaveformSummary waveform) {
    }
}
