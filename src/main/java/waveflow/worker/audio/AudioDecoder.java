package waveflow.worker.audio;

import waveflow.worker.model.DecodedAudio;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One strategy for turning an audio file into mono PCM samples.
 */
public interface AudioDecoder {

    /**
     * @return short name used in logs
     */
    String name();

    /**
     * Decode the whole file, downmixing to mono.
     *
     * @throws IOException if the file cannot be read or this strategy does not understand it
     */
    DecodedAudio decode(Path file) throws IOException;
}
