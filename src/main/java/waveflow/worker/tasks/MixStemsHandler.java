package waveflow.worker.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.audio.StemMixer;
import waveflow.worker.audio.StemMixer.MixResult;
import waveflow.worker.audio.StemMixer.Stem;
import waveflow.worker.audio.WavEncoder;
import waveflow.worker.audio.WaveformEngine;
import waveflow.worker.error.InvalidTaskArgumentsException;
import waveflow.worker.error.StorageException;
import waveflow.worker.error.TaskException;
import waveflow.worker.executor.AbstractTaskHandler;
import waveflow.worker.executor.TempResources;
import waveflow.worker.model.DecodedAudio;
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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mixes stems into one mono WAV and uploads it with a companion waveform.
 * Any stem that cannot be downloaded or decoded aborts the whole mix.
 */
public class MixStemsHandler extends AbstractTaskHandler {

    private static final Logger log = LoggerFactory.getLogger(MixStemsHandler.class);

    /** Peak count of the mix waveform unless the message asks otherwise. */
    public static final int MIX_WAVEFORM_PEAKS = 4000;

    private final ObjectStore store;
    private final WaveformEngine engine;
    private final StemMixer mixer;
    private final WavEncoder encoder;
    private final Notifier notifier;
    private final int maxPeaks;

    public MixStemsHandler(ObjectStore store, WaveformEngine engine, StemMixer mixer, WavEncoder encoder,
            Notifier notifier, int maxPeaks) {
        this.store = store;
        this.engine = engine;
        this.mixer = mixer;
        this.encoder = encoder;
        this.notifier = notifier;
        this.maxPeaks = maxPeaks;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.MIX_STEMS;
    }

    @Override
    public Optional<WebhookEndpoint> failureEndpoint() {
        return Optional.of(WebhookEndpoint.MIXING_COMPLETE);
    }

    @Override
    public String jobId(TaskInvocation invocation) {
        return invocation.args().string("stageId", "stage_id").orElse(invocation.id());
    }

    @Override
    protected ProcessingResult execute(TaskInvocation invocation, TempResources temp)
            throws TaskException, IOException {
        TaskArgs args = invocation.args();
        List<String> stemPaths = args.stringList("stem_paths", "stemPaths");
        if (stemPaths.isEmpty()) {
            throw new InvalidTaskArgumentsException("stem_paths is required");
        }
        Optional<String> stageId = args.string("stageId", "stage_id");
        String keyBase = stageId.orElse(invocation.id());
        int numPeaks = args.intInRange(Math.min(MIX_WAVEFORM_PEAKS, maxPeaks), 1, maxPeaks, "num_peaks", "numPeaks");

        List<Stem> stems = new ArrayList<>(stemPaths.size());
        for (String stemPath : stemPaths) {
            Path local = temp.newFile("stem", StorageKeys.extension(stemPath));
            if (!store.download(stemPath, local)) {
                throw new StorageException("stem download failed: " + stemPath);
            }
            DecodedAudio audio = engine.decode(local);
            log.debug("Stem {}: {} samples at {} Hz", stemPath, audio.length(), audio.sampleRate());
            stems.add(new Stem(stemPath, audio));
        }

        MixResult mix = mixer.mix(stems);
        DecodedAudio mixed = mix.audio();

        Path mixedFile = temp.newFile("mixed", ".wav");
        encoder.write(mixed.samples(), mixed.sampleRate(), mixedFile);

        String mixedKey = StorageKeys.mixed(keyBase, invocation);
        if (!store.upload(mixedFile, mixedKey)) {
            throw new StorageException("mix upload failed: " + mixedKey);
        }

        String waveformKey = uploadCompanionWaveform(mixed, numPeaks, StorageKeys.mixedWaveform(keyBase, invocation));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("stageId", stageId.orElse(null));
        result.put("upstreamId", args.stringOrNull("upstreamId", "upstream_id"));
        result.put("mixed_file_path", mixedKey);
        result.put("waveform_data_path", waveformKey);
        result.put("stem_count", stemPaths.size());
        result.put("stem_paths", stemPaths);
        result.put("mixed_stems", mix.included());
        result.put("skipped_stems", mix.skipped());
        result.put("duration", mixed.durationSeconds());
        result.put("sample_rate", mixed.sampleRate());

        if (stageId.isPresent()) {
            notifier.deliver(WebhookEndpoint.MIXING_COMPLETE,
                    WebhookEnvelope.success(stageId.get(), invocation, result));
        }

        log.info("Mix of {} stems uploaded to {}", mix.included().size(), mixedKey);
        return ProcessingResult.success(invocation.id(), kind(), result);
    }

    /**
     * @return the waveform key, or null when the upload failed; the mix stands either way
     */
    private String uploadCompanionWaveform(DecodedAudio mixed, int numPeaks, String key) {
        if (mixed.length() == 0) {
            log.warn("Mix is empty, skipping waveform {}", key);
            return null;
        }
        WaveformSummary summary = engine.summarize(mixed, numPeaks);
        if (store.uploadJson(summary, key) == null) {
            log.warn("Mix waveform upload failed for {}", key);
            return null;
        }
        return key;
    }
}
