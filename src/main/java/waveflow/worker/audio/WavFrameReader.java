package waveflow.worker.audio;

import waveflow.worker.model.DecodedAudio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fallback decoder that walks RIFF chunks by hand.
 * Tolerates headers the Java Sound reader rejects (WAVE_FORMAT_EXTENSIBLE,
 * oversized data chunk lengths from streaming writers).
 */
public final class WavFrameReader implements AudioDecoder {

    private static final int FORMAT_PCM = 1;
    private static final int FORMAT_FLOAT = 3;
    private static final int FORMAT_EXTENSIBLE = 0xFFFE;

    @Override
    public String name() {
        return "wav-frames";
    }

    @Override
    public DecodedAudio decode(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        if (bytes.length < 12 || !"RIFF".equals(fourCc(buf, 0)) || !"WAVE".equals(fourCc(buf, 8))) {
            throw new IOException("Not a RIFF/WAVE file: " + file.getFileName());
        }

        int formatTag = -1;
        int channels = 0;
        int sampleRate = 0;
        int bits = 0;
        int dataOffset = -1;
        int dataLength = 0;

        int pos = 12;
        while (pos + 8 <= bytes.length) {
            String id = fourCc(buf, pos);
            long size = Integer.toUnsignedLong(buf.getInt(pos + 4));
            int body = pos + 8;
            if ("fmt ".equals(id)) {
                formatTag = Short.toUnsignedInt(buf.getShort(body));
                channels = Short.toUnsignedInt(buf.getShort(body + 2));
                sampleRate = buf.getInt(body + 4);
                bits = Short.toUnsignedInt(buf.getShort(body + 14));
                if (formatTag == FORMAT_EXTENSIBLE && size >= 26) {
                    // sub-format GUID starts with the real format tag
                    formatTag = Short.toUnsignedInt(buf.getShort(body + 24));
                }
            } else if ("data".equals(id)) {
                dataOffset = body;
                dataLength = (int) Math.min(size, bytes.length - (long) body);
                break;
            }
            pos = (int) Math.min((long) body + size + (size & 1), bytes.length);
        }

        if (formatTag != FORMAT_PCM && formatTag != FORMAT_FLOAT) {
            throw new IOException("Unsupported WAV format tag: " + formatTag);
        }
        if (dataOffset < 0) {
            throw new IOException("WAV file has no data chunk");
        }
        if (sampleRate <= 0 || channels <= 0) {
            throw new IOException("Invalid WAV header: rate=" + sampleRate + ", channels=" + channels);
        }

        byte[] data = new byte[dataLength];
        System.arraycopy(bytes, dataOffset, data, 0, dataLength);
        float[] mono;
        try {
            mono = Pcm.toMono(data, dataLength, channels, bits, bits != 8, false, formatTag == FORMAT_FLOAT);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        return new DecodedAudio(mono, sampleRate);
    }

    private static String fourCc(ByteBuffer buf, int offset) {
        byte[] id = new byte[4];
        for (int i = 0; i < 4; i++) {
            id[i] = buf.get(offset + i);
        }
        return new String(id, StandardCharsets.US_ASCII);
    }
}
