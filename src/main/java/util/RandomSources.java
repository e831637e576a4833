package util;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * Seeded random providers and the small draws the generators need.
 * XO_SHI_RO_256_PP is fast with good statistical properties, and identical seeds replay identical streams.
 */
public final class RandomSources {

    public static final RandomSource ALGORITHM = RandomSource.XO_SHI_RO_256_PP;

    private RandomSources() {
    }

    public static UniformRandomProvider create(long seed) {
        return ALGORITHM.create(seed);
    }

    public static long newSeed() {
        return RandomSource.createLong();
    }

    /** Uniform integer in [min, max], both inclusive. */
    public static int between(UniformRandomProvider rng, int min, int max) {
        if (max <= min) return min;
        return min + rng.nextInt(max - min + 1);
    }

    public static <T> T pick(UniformRandomProvider rng, List<T> items) {
        return items.get(rng.nextInt(items.size()));
    }

    public static <T> T pick(UniformRandomProvider rng, T[] items) {
        return items[rng.nextInt(items.length)];
    }

    public static boolean chance(UniformRandomProvider rng, double probability) {
        return rng.nextDouble() < probability;
    }
}
