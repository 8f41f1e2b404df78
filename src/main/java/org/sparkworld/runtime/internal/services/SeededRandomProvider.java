package org.sparkworld.runtime.internal.services;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.sparkworld.runtime.spi.IRandomProvider;

/**
 * Default {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Derived providers hash the root seed, the scope name and the key into a fresh seed, so
 * derivation is stable across JVM runs and independent of how much the parent has drawn.
 * The engine derives one stream per tick, which makes a restored world draw exactly what an
 * uninterrupted run would without persisting generator state.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    /**
     * Creates a provider for the given root seed.
     *
     * @param seed The root seed.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public Random asJavaRandom() {
        // shares this provider's stream
        return new RandomAdaptor(rng);
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    @Override
    public long getSeed() {
        return seed;
    }

    /**
     * FNV-1a 64-bit hash of the UTF-8 bytes of {@code s}.
     */
    private static long hashString(String s) {
        if (s == null) {
            return 0L;
        }
        long h = 0xcbf29ce484222325L;
        for (byte value : s.getBytes(StandardCharsets.UTF_8)) {
            h ^= (value & 0xFF);
            h *= 0x100000001b3L;
        }
        return h;
    }

    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
