package com.sulid;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Clock-free, randomness-free {@link SulidFactory}.
 *
 * <p>Holds only the worker identity; stateless and safe to share between threads.</p>
 */
public final class PureSulidFactory implements SulidFactory {

    private final WorkerIdentity identity;

    public PureSulidFactory(WorkerIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    /**
     * @throws IllegalArgumentException if either value is outside 0-31
     */
    public static PureSulidFactory v1(int dataCenterId, int machineId) {
        return new PureSulidFactory(WorkerIdentity.v1(dataCenterId, machineId));
    }

    /**
     * @throws IllegalArgumentException if the value is outside 0-1023
     */
    public static PureSulidFactory v2(int workerId) {
        return new PureSulidFactory(WorkerIdentity.v2(workerId));
    }

    @Override
    public WorkerIdentity identity() {
        return identity;
    }

    @Override
    public Sulid generate(long timestampMs, BigInteger random) {
        return Sulid.fromParts(timestampMs, random, identity);
    }
}
