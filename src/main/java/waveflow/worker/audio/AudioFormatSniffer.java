package waveflow.worker.audio;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Detects the audio container from leading magic bytes.
 */
public final class AudioFormatSniffer {

    public static final String WAV = "audio/wav";
    public static final String MPEG = "audio/mpeg";
    public static final String FLAC = "audio/flac";
    public static final String OGG = "audio/ogg";

    public Optional<String> sniff(Path file) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(12);
        }
        return sniff(head);
    }

    public Optional<String> sniff(byte[] head) {
        if (head.length >= 12 && ascii(head, 0, 4).equals("RIFF") && ascii(head, 8, 4).equals("WAVE")) {
            return Optional.of(WAV);
        }
        if (head.length >= 4 && ascii(head, 0, 4).equals("fLaC")) {
            return Optional.of(FLAC);
        }
        if (head.length >= 4 && ascii(head, 0, 4).equals("OggS")) {
            return Optional.of(OGG);
        }
        if (head.length >= 3 && ascii(head, 0, 3).equals("ID3")) {
            return Optional.of(MPEG);
        }
        // bare MPEG audio frame sync
        if (head.length >= 2 && (head[0] & 0xFF) == 0xFF && (head[1] & 0xE0) == 0xE0) {
            return Optional.of(MPEG);
        }
        return Optional.empty();
    }

    /** audio/mp3 is reported by some producers for audio/mpeg. */
    public static String normalize(String mimeType) {
        return "audio/mp3".equalsIgnoreCase(mimeType) ? MPEG : mimeType.toLowerCase();
    }

    private static String ascii(byte[] bytes, int offset, int length) {
        return new String(bytes, offset, length, StandardCharsets.US_ASCII);
    }
}
