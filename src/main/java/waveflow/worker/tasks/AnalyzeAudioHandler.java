package waveflow.worker.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.audio.AudioFormatSniffer;
import waveflow.worker.audio.WaveformEngine;
import waveflow.worker.audio.WaveformEngine.AudioAnalysis;
import waveflow.worker.config.WorkerConfig;
import waveflow.worker.error.StorageException;
import waveflow.worker.error.TaskException;
import waveflow.worker.error.UnsupportedAudioException;
import waveflow.worker.error.WebhookDeliveryException;
import waveflow.worker.executor.AbstractTaskHandler;
import waveflow.worker.executor.TempResources;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskArgs;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;
import waveflow.worker.model.WaveformSummary;
import waveflow.worker.notify.Notifier;
import waveflow.worker.notify.WebhookEndpoint;
import waveflow.worker.notify.WebhookEnvelope;
import waveflow.worker.storage.ObjectStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Full analysis of one upload: hash, duration, waveform peaks.
 * The waveform JSON goes to a derived key; the source object is left in place.
 */
public class AnalyzeAudioHandler extends AbstractTaskHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeAudioHandler.class);

    private final ObjectStore store;
    private final WaveformEngine engine;
    private final AudioFormatSniffer sniffer;
    private final Notifier notifier;
    private final int defaultPeaks;
    private final int maxPeaks;
    private final long maxFileSizeBytes;
    private final List<String> allowedMimeTypes;

    public AnalyzeAudioHandler(ObjectStore store, WaveformEngine engine, AudioFormatSniffer sniffer,
            Notifier notifier, WorkerConfig config) {
        this.store = store;
        this.engine = engine;
        this.sniffer = sniffer;
        this.notifier = notifier;
        this.defaultPeaks = config.defaultPeaks();
        this.maxPeaks = config.maxPeaks();
        this.maxFileSizeBytes = config.maxFileSizeBytes();
        this.allowedMimeTypes = config.allowedMimeTypes().stream().map(AudioFormatSniffer::normalize).toList();
    }

    @Override
    public TaskKind kind() {
        return TaskKind.ANALYZE_AUDIO;
    }

    @Override
    public Optional<WebhookEndpoint> failureEndpoint() {
        return Optional.of(WebhookEndpoint.COMPLETION);
    }

    @Override
    public String jobId(TaskInvocation invocation) {
        return invocation.args().string("stemId", "stem_id").orElse(invocation.id());
    }

    @Override
    protected ProcessingResult execute(TaskInvocation invocation, TempResources temp)
            throws TaskException, IOException {
        TaskArgs args = invocation.args();
        String filepath = args.requireString("filepath", "filePath", "file_path");
        String stemId = args.requireString("stemId", "stem_id");
        int numPeaks = args.intInRange(defaultPeaks, 1, maxPeaks, "num_peaks", "numPeaks");

        Path local = temp.newFile("audio-source", StorageKeys.extension(filepath));
        if (!store.download(filepath, local)) {
            throw new StorageException("download failed: " + filepath);
        }

        String mimeType = validate(local, filepath);
        AudioAnalysis analysis = engine.analyze(local, numPeaks);
        WaveformSummary waveform = analysis.waveform();

        String waveformKey = StorageKeys.waveform(stemId, invocation);
        String waveformUrl = store.uploadJson(waveform, waveformKey);
        if (waveformUrl == null) {
            throw new StorageException("waveform upload failed: " + waveformKey);
        }

        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("stemId", stemId);
        progress.put("waveform_data_path", waveformKey);
        progress.put("status", "waveform_uploaded");
        notifier.deliver(WebhookEndpoint.WAVEFORM_UPDATE, WebhookEnvelope.success(stemId, invocation, progress));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("stemId", stemId);
        result.put("userId", args.stringOrNull("userId", "user_id"));
        result.put("trackId", args.stringOrNull("trackId", "track_id"));
        result.put("upstreamId", args.stringOrNull("upstreamId", "upstream_id"));
        result.put("audio_data_hash", analysis.hash());
        result.put("waveform_data_path", waveformKey);
        result.put("waveform_url", waveformUrl);
        result.put("file_size", analysis.fileSize());
        result.put("mime_type", mimeType);
        result.put("duration", waveform.durationSeconds());
        result.put("sample_rate", waveform.sampleRate());
        result.put("num_peaks", waveform.numPeaks());
        result.put("original_filename", args.stringOrNull("original_filename", "originalFilename"));
        result.put("timestamp", args.stringOrNull("timestamp"));

        try {
            notifier.deliver(WebhookEndpoint.COMPLETION, WebhookEnvelope.success(stemId, invocation, result));
        } catch (WebhookDeliveryException e) {
            log.warn("Analysis of stem {} done, completion webhook not delivered: {}", stemId, e.getMessage());
        }

        log.info("Analysis complete for stem {}: {}s, {} peaks -> {}", stemId,
                String.format("%.2f", waveform.durationSeconds()), numPeaks, waveformKey);
        return ProcessingResult.success(invocation.id(), kind(), result);
    }

    private String validate(Path local, String key) throws IOException, UnsupportedAudioException {
        long size = Files.size(local);
        if (size > maxFileSizeBytes) {
            throw new UnsupportedAudioException(key + " is " + size + " bytes, limit is " + maxFileSizeBytes);
        }
        String mimeType = sniffer.sniff(local)
                .orElseThrow(() -> new UnsupportedAudioException(key + " is not a recognized audio container"));
        if (!allowedMimeTypes.contains(mimeType)) {
            throw new UnsupportedAudioException(key + " has disallowed type " + mimeType);
        }
        return mimeType;
    }
}
