package waveflow.worker.support;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Synthesizes WAV fixtures.
 */
public final class TestAudio {

    private TestAudio() {
    }

    public static float[] sine(double frequency, int sampleRate, double seconds, double amplitude) {
        int n = (int) Math.round(sampleRate * seconds);
        float[] samples = new float[n];
        for (int i = 0; i < n; i++) {
            samples[i] = (float) (amplitude * Math.sin(2 * Math.PI * frequency * i / sampleRate));
        }
        return samples;
    }

    public static float[] constant(int n, float value) {
        float[] samples = new float[n];
        java.util.Arrays.fill(samples, value);
        return samples;
    }

    /** 16-bit little-endian PCM; {@code channels[c][i]} is sample i of channel c. */
    public static Path writePcm16(Path target, int sampleRate, float[]... channels) throws IOException {
        int frames = channels[0].length;
        int numChannels = channels.length;
        byte[] pcm = new byte[frames * numChannels * 2];
        int pos = 0;
        for (int i = 0; i < frames; i++) {
            for (float[] channel : channels) {
                int v = Math.round(Math.max(-1f, Math.min(1f, channel[i])) * 32767f);
                pcm[pos++] = (byte) v;
                pcm[pos++] = (byte) (v >> 8);
            }
        }
        AudioFormat format = new AudioFormat(sampleRate, 16, numChannels, true, false);
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, frames)) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, target.toFile());
        }
        return target;
    }

    public static Path writeMono(Path target, int sampleRate, float[] samples) throws IOException {
        return writePcm16(target, sampleRate, samples);
    }

    public static byte[] monoWavBytes(Path scratch, int sampleRate, float[] samples) throws IOException {
        return Files.readAllBytes(writeMono(scratch, sampleRate, samples));
    }

    /** Hand-built RIFF file with 32-bit IEEE float samples (format tag 3). */
    public static Path writeFloat32(Path target, int sampleRate, int channels, float[] interleaved)
            throws IOException {
        int dataLength = interleaved.length * 4;
        ByteBuffer buf = ByteBuffer.allocate(44 + dataLength).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(36 + dataLength);
        buf.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        buf.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(16);
        buf.putShort((short) 3);
        buf.putShort((short) channels);
        buf.putInt(sampleRate);
        buf.putInt(sampleRate * channels * 4);
        buf.putShort((short) (channels * 4));
        buf.putShort((short) 32);
        buf.put("data".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(dataLength);
        for (float f : interleaved) {
            buf.putFloat(f);
        }
        return Files.write(target, buf.array());
    }
}
