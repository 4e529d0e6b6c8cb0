package io.github.cobfuscator.strings;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ChaCha20Test {

    private static byte[] sequentialKey() {
        byte[] key = new byte[32];
        for (int i = 0; i < key.length; i++) {
            key[i] = (byte) i;
        }
        return key;
    }

    private static byte[] hex(String text) {
        String clean = text.replace(" ", "");
        byte[] out = new byte[clean.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) Integer.parseInt(clean.substring(i * 2, i * 2 + 2), 16);
        }
        return out;
    }

    @Test
    public void testKeystreamBlock() {
        byte[] nonce = hex("000000090000004a00000000");
        byte[] keystream = ChaCha20.crypt(sequentialKey(), nonce, 1, new byte[64]);
        assertArrayEquals(hex("10f1e7e4d13b5915500fdd1fa32071c4"), Arrays.copyOf(keystream, 16));
    }

    @Test
    public void testEncryption() {
        byte[] nonce = hex("000000000000004a00000000");
        byte[] plaintext = ("Ladies and Gentlemen of the class of '99: If I could offer you only one tip for "
                + "the future, sunscreen would be it.").getBytes(StandardCharsets.US_ASCII);
        byte[] cipher = ChaCha20.crypt(sequentialKey(), nonce, 1, plaintext);
        assertEquals(plaintext.length, cipher.length);
        assertArrayEquals(hex("6e2e359a2568f98041ba0728dd0d6981"), Arrays.copyOf(cipher, 16));
        assertArrayEquals(plaintext, ChaCha20.crypt(sequentialKey(), nonce, 1, cipher));
    }

    @Test
    public void testMultipleBlocksAndEmptyInput() {
        byte[] nonce = new byte[12];
        byte[] data = new byte[200];
        Arrays.fill(data, (byte) 'x');
        byte[] cipher = ChaCha20.crypt(sequentialKey(), nonce, 0, data);
        assertFalse(Arrays.equals(data, cipher));
        assertArrayEquals(data, ChaCha20.crypt(sequentialKey(), nonce, 0, cipher));
        assertEquals(0, ChaCha20.crypt(sequentialKey(), nonce, 0, new byte[0]).length);
    }

    @Test
    public void testBadKeyLength() {
        assertThrows(IllegalArgumentException.class, () -> ChaCha20.crypt(new byte[16], new byte[12], 0, new byte[1]));
    }
}
