package io.github.cobfuscator.strings;

/**
 * One encrypted string literal and the names of the C objects that carry it.
 */
public class EncryptedLiteral {

    private final byte[] plaintext;
    private final byte[] key;
    private final byte[] nonce;
    private final int seed;
    private final byte[] cipher;
    private final String cipherName;
    private final String keyName;
    private final String bufferName;

    public EncryptedLiteral(byte[] plaintext, byte[] key, byte[] nonce, int seed,
                            String cipherName, String keyName, String bufferName) {
        this.plaintext = plaintext.clone();
        this.key = key.clone();
        this.nonce = nonce.clone();
        this.seed = seed;
        this.cipher = ChaCha20.crypt(key, nonce, 0, plaintext);
        this.cipherName = cipherName;
        this.keyName = keyName;
        this.bufferName = bufferName;
    }

    public byte[] getPlaintext() {
        return plaintext.clone();
    }

    public byte[] getCipher() {
        return cipher.clone();
    }

    public int getLength() {
        return plaintext.length;
    }

    public int getSeed() {
        return seed;
    }

    public String getCipherName() {
        return cipherName;
    }

    public String getKeyName() {
        return keyName;
    }

    /** Null when the literal decrypts straight into a char array. */
    public String getBufferName() {
        return bufferName;
    }

    /**
     * Key followed by nonce, each byte xored with a byte of the seed as the emitted
     * decrypt routine expects.
     */
    public byte[] getMaskedKeyMaterial() {
        byte[] material = new byte[key.length + nonce.length];
        System.arraycopy(key, 0, material, 0, key.length);
        System.arraycopy(nonce, 0, material, key.length, nonce.length);
        return encode(material, seed);
    }

    public byte[] decrypt() {
        return ChaCha20.crypt(key, nonce, 0, cipher);
    }

    static byte[] encode(byte[] arr, int seed) {
        byte[] out = new byte[arr.length];
        for (int i = 0; i < arr.length; i++) {
            out[i] = (byte) (arr[i] ^ (seed >>> ((i & 3) * 8)));
        }
        return out;
    }
}
