package waveflow.worker.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.error.AudioDecodeException;
import waveflow.worker.model.DecodedAudio;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Tries each decoder in order and returns the first success.
 */
public final class AudioLoader {

    private static final Logger log = LoggerFactory.getLogger(AudioLoader.class);

    private final List<AudioDecoder> decoders;

    public AudioLoader(List<AudioDecoder> decoders) {
        if (decoders.isEmpty()) {
            throw new IllegalArgumentException("at least one decoder is required");
        }
        this.decoders = List.copyOf(decoders);
    }

    /** Java Sound first, raw WAV frames as fallback. */
    public static AudioLoader standard() {
        return new AudioLoader(List.of(new JavaSoundDecoder(), new WavFrameReader()));
    }

    /**
     * @throws IOException           if the file does not exist or is not readable
     * @throws AudioDecodeException  if every decoder rejected the file
     */
    public DecodedAudio load(Path file) throws IOException, AudioDecodeException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        if (!Files.isReadable(file)) {
            throw new IOException("File is not readable: " + file);
        }

        Exception last = null;
        for (AudioDecoder decoder : decoders) {
            try {
                DecodedAudio audio = decoder.decode(file);
                log.debug("Decoded {} with {}: {} samples at {} Hz",
                        file.getFileName(), decoder.name(), audio.length(), audio.sampleRate());
                return audio;
            } catch (IOException | RuntimeException e) {
                log.warn("Decoder {} failed for {}: {}", decoder.name(), file.getFileName(), e.getMessage());
                last = e;
            }
        }
        throw new AudioDecodeException("All decode strategies failed for " + file.getFileName(), last);
    }
}
