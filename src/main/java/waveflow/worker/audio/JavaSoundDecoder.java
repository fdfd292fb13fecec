package waveflow.worker.audio;

import waveflow.worker.model.DecodedAudio;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Primary decoder backed by the Java Sound API.
 * Reads uncompressed WAV/AIFF/AU out of the box; compressed containers
 * (MP3, FLAC, OGG) decode when a matching Java Sound provider is on the classpath.
 */
public final class JavaSoundDecoder implements AudioDecoder {

    @Override
    public String name() {
        return "javasound";
    }

    @Override
    public DecodedAudio decode(Path file) throws IOException {
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(file));
                AudioInputStream source = AudioSystem.getAudioInputStream(raw)) {
            AudioFormat format = source.getFormat();

            if (isLinearPcm(format)) {
                return toDecoded(source, format);
            }

            // compressed source: ask an installed provider for 16-bit PCM
            float rate = format.getSampleRate();
            int channels = Math.max(1, format.getChannels());
            AudioFormat target = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, rate, 16, channels,
                    channels * 2, rate, false);
            try (AudioInputStream pcm = AudioSystem.getAudioInputStream(target, source)) {
                return toDecoded(pcm, pcm.getFormat());
            } catch (IllegalArgumentException e) {
                throw new IOException("No PCM conversion available for " + format.getEncoding(), e);
            }
        } catch (UnsupportedAudioFileException e) {
            throw new IOException("Unsupported audio file: " + file.getFileName(), e);
        }
    }

    private static boolean isLinearPcm(AudioFormat format) {
        AudioFormat.Encoding encoding = format.getEncoding();
        return AudioFormat.Encoding.PCM_SIGNED.equals(encoding)
                || AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)
                || AudioFormat.Encoding.PCM_FLOAT.equals(encoding);
    }

    private static DecodedAudio toDecoded(AudioInputStream stream, AudioFormat format) throws IOException {
        int sampleRate = Math.round(format.getSampleRate());
        if (sampleRate <= 0) {
            throw new IOException("Decoder did not report a sample rate");
        }
        byte[] data = stream.readAllBytes();
        float[] mono = Pcm.toMono(data, data.length,
                Math.max(1, format.getChannels()),
                format.getSampleSizeInBits(),
                !AudioFormat.Encoding.PCM_UNSIGNED.equals(format.getEncoding()),
                format.isBigEndian(),
                AudioFormat.Encoding.PCM_FLOAT.equals(format.getEncoding()));
        return new DecodedAudio(mono, sampleRate);
    }
}
