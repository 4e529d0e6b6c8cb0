package io.github.cobfuscator;

import java.security.SecureRandom;

/**
 * Lightweight non-cryptographic random generator (SplitMix64). Each function job owns
 * one instance, so a fixed seed reproduces the same output regardless of thread
 * scheduling.
 */
public final class FastRandom {

    private static final long GAMMA = 0x9E3779B97F4A7C15L;

    private long state;

    public FastRandom(long seed) {
        this.state = seed;
    }

    /**
     * Generator for one function: derived from {@code seed} and the function's declaration
     * index, or freshly seeded from {@link SecureRandom} when no seed is configured.
     */
    public static FastRandom forFunction(Long seed, int functionIndex) {
        if (seed == null) {
            return new FastRandom(new SecureRandom().nextLong());
        }
        return new FastRandom(mix(seed ^ mix((functionIndex + 1L) * GAMMA)));
    }

    private static long mix(long x) {
        x ^= x >>> 30;
        x *= 0xBF58476D1CE4E5B9L;
        x ^= x >>> 27;
        x *= 0x94D049BB133111EBL;
        x ^= x >>> 31;
        return x;
    }

    private long nextRaw() {
        state += GAMMA;
        return mix(state);
    }

    public long nextLong() {
        return nextRaw();
    }

    public int nextInt() {
        return (int) nextRaw();
    }

    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive");
        }
        long r = Long.remainderUnsigned(nextRaw(), bound);
        return (int) r;
    }

    public void nextBytes(byte[] bytes) {
        for (int i = 0; i < bytes.length; ) {
            long r = nextRaw();
            for (int n = 0; n < 8 && i < bytes.length; n++, r >>>= 8) {
                bytes[i++] = (byte) r;
            }
        }
    }
}
