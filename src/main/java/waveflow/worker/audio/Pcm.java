package waveflow.worker.audio;

/**
 * Interleaved PCM frame conversion shared by the decoders.
 */
final class Pcm {

    private Pcm() {
    }

    /**
     * Convert interleaved integer or float PCM to mono floats by averaging channels.
     *
     * @param bits      bits per sample: 8, 16, 24, 32 or 64 (float only)
     * @param signed    false only for 8-bit WAV-style unsigned samples
     * @param isFloat   IEEE float samples (32 or 64 bit)
     */
    static float[] toMono(byte[] data, int length, int channels, int bits, boolean signed,
            boolean bigEndian, boolean isFloat) {
        if (channels < 1) {
            throw new IllegalArgumentException("channels must be positive");
        }
        int bytesPerSample = bits / 8;
        if (bytesPerSample < 1 || bytesPerSample > 8 || bits % 8 != 0) {
            throw new IllegalArgumentException("unsupported sample width: " + bits + " bits");
        }
        if (isFloat && bits != 32 && bits != 64) {
            throw new IllegalArgumentException("unsupported float width: " + bits + " bits");
        }
        int frameSize = bytesPerSample * channels;
        int frames = length / frameSize;
        float[] mono = new float[frames];

        for (int f = 0; f < frames; f++) {
            double sum = 0;
            int base = f * frameSize;
            for (int c = 0; c < channels; c++) {
                sum += sample(data, base + c * bytesPerSample, bits, signed, bigEndian, isFloat);
            }
            mono[f] = (float) (sum / channels);
        }
        return mono;
    }

    private static double sample(byte[] data, int offset, int bits, boolean signed, boolean bigEndian,
            boolean isFloat) {
        int bytes = bits / 8;
        long raw = 0;
        for (int i = 0; i < bytes; i++) {
            int b = data[offset + (bigEndian ? i : bytes - 1 - i)] & 0xFF;
            raw = (raw << 8) | b;
        }

        if (isFloat) {
            return bits == 32 ? Float.intBitsToFloat((int) raw) : Double.longBitsToDouble(raw);
        }

        double scale = Math.pow(2, bits - 1);
        if (!signed) {
            return (raw - scale) / scale;
        }

        // sign-extend
        int shift = 64 - bits;
        long value = (raw << shift) >> shift;
        return value / scale;
    }
}
