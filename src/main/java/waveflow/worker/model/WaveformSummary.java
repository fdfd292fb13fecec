package waveflow.worker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Downsampled amplitude envelope of one audio file.
 * {@code peaks.size()} always equals the requested peak count.
 */
public record WaveformSummary(
        @JsonProperty("peaks") List<Double> peaks,
        @JsonProperty("duration") double durationSeconds,
        @JsonProperty("sample_rate") int sampleRate,
        @JsonProperty("num_peaks") int numPeaks,
        @JsonProperty("created_at") Instant createdAt) {

    public WaveformSummary {
        peaks = List.copyOf(peaks);
        if (peaks.size() != numPeaks) {
            throw new IllegalArgumentException("expected " + numPeaks + " peaks, got " + peaks.size());
        }
    }
}
