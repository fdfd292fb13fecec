package waveflow.worker.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import waveflow.worker.error.AudioDecodeException;
import waveflow.worker.model.DecodedAudio;
import waveflow.worker.support.TestAudio;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AudioLoaderTest {

    @TempDir
    Path dir;

    @Test
    void downmixesStereoByAveraging() throws Exception {
        Path wav = TestAudio.writePcm16(dir.resolve("stereo.wav"), 22050,
                TestAudio.constant(100, 0.5f), TestAudio.constant(100, 0.25f));

        DecodedAudio audio = AudioLoader.standard().load(wav);

        assertEquals(22050, audio.sampleRate());
        assertEquals(100, audio.length());
        for (float s : audio.samples()) {
            assertEquals(0.375, s, 1e-3);
        }
    }

    @Test
    void frameReaderHandlesFloatWav() throws Exception {
        // stereo frames: (1.0, 0.0), (-0.5, -0.5)
        Path wav = TestAudio.writeFloat32(dir.resolve("float.wav"), 48000, 2,
                new float[] { 1.0f, 0.0f, -0.5f, -0.5f });

        DecodedAudio audio = new WavFrameReader().decode(wav);

        assertEquals(48000, audio.sampleRate());
        assertArrayEquals(new float[] { 0.5f, -0.5f }, audio.samples(), 1e-6f);
    }

    @Test
    void frameReaderMatchesJavaSoundOnPcm() throws Exception {
        float[] sine = TestAudio.sine(220, 8000, 0.1, 0.6);
        Path wav = TestAudio.writeMono(dir.resolve("pcm.wav"), 8000, sine);

        DecodedAudio viaJavaSound = new JavaSoundDecoder().decode(wav);
        DecodedAudio viaFrames = new WavFrameReader().decode(wav);

        assertEquals(viaJavaSound.length(), viaFrames.length());
        assertArrayEquals(viaJavaSound.samples(), viaFrames.samples(), 1e-6f);
    }

    @Test
    void fallsBackWhenPrimaryDecoderFails() throws Exception {
        Path wav = TestAudio.writeMono(dir.resolve("fallback.wav"), 16000, TestAudio.constant(50, 0.5f));
        AudioDecoder broken = new AudioDecoder() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public DecodedAudio decode(Path file) throws IOException {
                throw new IOException("no codec");
            }
        };

        DecodedAudio audio = new AudioLoader(List.of(broken, new WavFrameReader())).load(wav);

        assertEquals(50, audio.length());
    }

    @Test
    void corruptFileIsDecodeError() throws Exception {
        Path junk = Files.writeString(dir.resolve("junk.wav"), "definitely not audio", StandardCharsets.UTF_8);

        AudioDecodeException e = assertThrows(AudioDecodeException.class, () -> AudioLoader.standard().load(junk));
        assertEquals("AUDIO_DECODE_FAILED", e.code());
        assertFalse(e.retryable());
    }

    @Test
    void missingFileIsIoError() {
        assertThrows(NoSuchFileException.class, () -> AudioLoader.standard().load(dir.resolve("absent.wav")));
    }
}
