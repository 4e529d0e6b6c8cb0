package io.github.cobfuscator.strings;

/**
 * ChaCha20 stream cipher (RFC 8439 block function, 96-bit nonce). Encryption and
 * decryption are the same operation.
 */
public final class ChaCha20 {

    public static final int KEY_LENGTH = 32;
    public static final int NONCE_LENGTH = 12;

    private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

    private ChaCha20() {
    }

    private static void quarterRound(int[] x, int a, int b, int c, int d) {
        x[a] += x[b]; x[d] = Integer.rotateLeft(x[d] ^ x[a], 16);
        x[c] += x[d]; x[b] = Integer.rotateLeft(x[b] ^ x[c], 12);
        x[a] += x[b]; x[d] = Integer.rotateLeft(x[d] ^ x[a], 8);
        x[c] += x[d]; x[b] = Integer.rotateLeft(x[b] ^ x[c], 7);
    }

    public static byte[] crypt(byte[] key, byte[] nonce, int counter, byte[] data) {
        if (key.length != KEY_LENGTH || nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("ChaCha20 needs a 32-byte key and a 12-byte nonce");
        }
        int[] input = new int[16];
        System.arraycopy(SIGMA, 0, input, 0, 4);
        for (int i = 0; i < 8; i++) {
            input[4 + i] = readLittleEndian(key, i * 4);
        }
        for (int i = 0; i < 3; i++) {
            input[13 + i] = readLittleEndian(nonce, i * 4);
        }

        byte[] out = new byte[data.length];
        int[] x = new int[16];
        for (int offset = 0; offset < data.length; offset += 64, counter++) {
            input[12] = counter;
            System.arraycopy(input, 0, x, 0, 16);
            for (int round = 0; round < 10; round++) {
                quarterRound(x, 0, 4, 8, 12);
                quarterRound(x, 1, 5, 9, 13);
                quarterRound(x, 2, 6, 10, 14);
                quarterRound(x, 3, 7, 11, 15);
                quarterRound(x, 0, 5, 10, 15);
                quarterRound(x, 1, 6, 11, 12);
                quarterRound(x, 2, 7, 8, 13);
                quarterRound(x, 3, 4, 9, 14);
            }
            int end = Math.min(64, data.length - offset);
            for (int i = 0; i < end; i++) {
                int word = x[i >>> 2] + input[i >>> 2];
                out[offset + i] = (byte) (data[offset + i] ^ (word >>> ((i & 3) * 8)));
            }
        }
        return out;
    }

    private static int readLittleEndian(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFF)
                | (bytes[offset + 1] & 0xFF) << 8
                | (bytes[offset + 2] & 0xFF) << 16
                | (bytes[offset + 3] & 0xFF) << 24;
    }
}
