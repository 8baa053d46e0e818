package com.sulid;

import java.math.BigInteger;

/**
 * Produces Sulids stamped with a fixed worker identity.
 *
 * <p>Two profiles implement it. {@link PureSulidFactory} is pure computation: the
 * caller supplies time and randomness. {@link SulidGenerator} adds a clock and a
 * random source on top. Applications pick one by wiring the class they need.</p>
 */
public interface SulidFactory {

    /**
     * Returns the identity stamped on every Sulid this factory creates.
     *
     * @return the worker identity
     */
    WorkerIdentity identity();

    /**
     * Creates a Sulid from caller-supplied time and randomness.
     *
     * @param timestampMs milliseconds since the Unix epoch
     * @param random random component (70 bits)
     * @return the identifier
     */
    Sulid generate(long timestampMs, BigInteger random);
}
