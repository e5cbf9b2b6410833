package edu.brandeis.cosi103a.dilemma.strategy;

import java.util.Random;

/**
 * Uniform draws in [0, 1), shared by the probabilistic strategies of a run.
 */
@FunctionalInterface
public interface RandomSource {

    double nextDouble();

    /**
     * A source backed by an unseeded {@link Random}.
     */
    static RandomSource create() {
        Random random = new Random();
        return random::nextDouble;
    }

    /**
     * A reproducible source; the same seed replays the same draws.
     */
    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextDouble;
    }
}
