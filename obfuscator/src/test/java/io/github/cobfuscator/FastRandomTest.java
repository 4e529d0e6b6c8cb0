package io.github.cobfuscator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FastRandomTest {

    @Test
    public void testSeededStreamsAreReproducible() {
        FastRandom a = FastRandom.forFunction(7L, 3);
        FastRandom b = FastRandom.forFunction(7L, 3);
        for (int i = 0; i < 32; i++) {
            assertEquals(a.nextLong(), b.nextLong());
        }
    }

    @Test
    public void testFunctionsGetDifferentStreams() {
        assertNotEquals(FastRandom.forFunction(7L, 0).nextLong(), FastRandom.forFunction(7L, 1).nextLong());
        assertNotEquals(FastRandom.forFunction(7L, 0).nextLong(), FastRandom.forFunction(8L, 0).nextLong());
    }

    @Test
    public void testBoundedValues() {
        FastRandom random = new FastRandom(1);
        for (int i = 0; i < 1000; i++) {
            int value = random.nextInt(7);
            assertTrue(value >= 0 && value < 7);
        }
        byte[] bytes = new byte[13];
        random.nextBytes(bytes);
        boolean nonZero = false;
        for (byte b : bytes) {
            nonZero |= b != 0;
        }
        assertTrue(nonZero);
    }
}
