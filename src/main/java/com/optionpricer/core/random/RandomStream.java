package com.optionpricer.core.random;

import java.security.SecureRandom;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Source of standard normal variates owned by exactly one pricing call.
 *
 * <p>The algorithm is fixed so seeded runs stay bit-for-bit reproducible across releases:
 * MT19937 ({@link MersenneTwister}) seeded with the 64-bit seed, normals from
 * {@link org.apache.commons.math3.random.BitsStreamGenerator#nextGaussian()} (polar
 * Box-Muller, second variate cached). Changing either invalidates every seeded fixture.
 *
 * <p>Not thread-safe. Never share an instance across calls or threads.
 */
public final class RandomStream {

    private static final SecureRandom ENTROPY = new SecureRandom();

    private final RandomGenerator generator;

    private RandomStream(RandomGenerator generator) {
        this.generator = generator;
    }

    /** Reproducible stream: the same seed always yields the same sequence of draws. */
    public static RandomStream seeded(long seed) {
        return new RandomStream(new MersenneTwister(seed));
    }

    /** Non-reproducible stream seeded from system entropy. */
    public static RandomStream fromEntropy() {
        return new RandomStream(new MersenneTwister(ENTROPY.nextLong()));
    }

    /** Seeded when {@code seed} is non-null, entropy-seeded otherwise. */
    public static RandomStream of(Long seed) {
        return seed != null ? seeded(seed) : fromEntropy();
    }

    public double nextStandardNormal() {
        return generator.nextGaussian();
    }
}
