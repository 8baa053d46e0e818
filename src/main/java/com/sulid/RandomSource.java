package com.sulid;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Supply of uniformly distributed random bits for the 70-bit random component.
 *
 * <p>Implementations need not be thread safe. A {@link SulidGenerator} in shared
 * mode serializes its own draws.</p>
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Returns 64 random bits.
     *
     * @return the next random value
     */
    long nextLong();

    /**
     * A source backed by a freshly seeded {@link SecureRandom}.
     *
     * @return a new source
     */
    static RandomSource secure() {
        return of(new SecureRandom());
    }

    /**
     * Adapts a {@link Random}, e.g. a seeded one for deterministic tests.
     *
     * @param random the underlying generator
     * @return a source drawing from it
     */
    static RandomSource of(Random random) {
        return random::nextLong;
    }
}
