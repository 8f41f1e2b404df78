package org.sparkworld.runtime.spi;

import java.util.Random;

/**
 * Source of randomness for the world engine and its collaborators.
 * <p>
 * All random decisions (spark distribution, raid outcomes, default oracle behavior)
 * must go through a provider so that a simulation started from the same seed produces
 * the same history. Use {@code rng.asJavaRandom()} for a {@link Random} instance.
 */
public interface IRandomProvider {

    /**
     * Returns a uniformly distributed int in {@code [0, bound)}.
     *
     * @param bound The exclusive upper bound, must be positive.
     * @return The next random int.
     */
    int nextInt(int bound);

    /**
     * Returns a uniformly distributed double in {@code [0.0, 1.0)}.
     *
     * @return The next random double.
     */
    double nextDouble();

    /**
     * Returns a {@link Random} view backed by this provider.
     *
     * @return A Java random instance.
     */
    Random asJavaRandom();

    /**
     * Derives an independent, reproducible provider for a named purpose.
     * <p>
     * The derived stream depends only on the root seed, the scope name and the key, so a
     * simulation resumed at tick {@code T} draws exactly what an uninterrupted run would.
     *
     * @param scope A name for the purpose (e.g. {@code "tick"}).
     * @param key A discriminator within the scope (e.g. the tick number).
     * @return A new provider.
     */
    IRandomProvider deriveFor(String scope, long key);

    /**
     * Returns the root seed this provider was created from.
     *
     * @return The seed.
     */
    long getSeed();
}
