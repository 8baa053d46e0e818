package com.sulid;

import java.math.BigInteger;

import static com.sulid.DefaultValue.MACHINE_ID_BITS;
import static com.sulid.DefaultValue.MAX_DATA_CENTER_ID;
import static com.sulid.DefaultValue.MAX_MACHINE_ID;
import static com.sulid.DefaultValue.MAX_TIMESTAMP_MS;
import static com.sulid.DefaultValue.MAX_WORKER_ID;
import static com.sulid.DefaultValue.RANDOM_BITS;

/**
 * How {@link Sulid#fromParts} treats caller-supplied fields wider than their slot.
 *
 * <p>{@link #MASK} silently drops the overflow bits. {@link #STRICT} rejects any
 * out-of-range value with an {@link IllegalArgumentException}. The policy used by
 * the plain {@code Sulid.fromParts} overloads is {@link #configured()}, fixed at
 * startup through {@code SULID_STRICT} / {@code -Dsulid.strict=true}.</p>
 */
public enum FieldPolicy {

    /** Discard bits beyond each field's width; timestamps before the epoch become zero */
    MASK {
        @Override
        long timestamp(long timestampMs) {
            return timestampMs < 0 ? 0L : timestampMs & MAX_TIMESTAMP_MS;
        }

        @Override
        BigInteger random(BigInteger random) {
            return random.and(Sulid.MAX_RANDOM);
        }

        @Override
        int field(String name, int value, int max) {
            return value & max;
        }
    },

    /** Reject any field outside its declared range */
    STRICT {
        @Override
        long timestamp(long timestampMs) {
            if (timestampMs < 0 || timestampMs > MAX_TIMESTAMP_MS)
                throw new IllegalArgumentException("timestampMs must be in the range 0-" + MAX_TIMESTAMP_MS);
            return timestampMs;
        }

        @Override
        BigInteger random(BigInteger random) {
            if (random.signum() < 0 || random.bitLength() > RANDOM_BITS)
                throw new IllegalArgumentException("random must be in the range 0-" + Sulid.MAX_RANDOM);
            return random;
        }

        @Override
        int field(String name, int value, int max) {
            if (value < 0 || value > max)
                throw new IllegalArgumentException(name + " must be in the range 0-" + max);
            return value;
        }
    };

    /**
     * Returns the policy selected at startup.
     *
     * @return {@link #STRICT} when strict checks are enabled, otherwise {@link #MASK}
     */
    public static FieldPolicy configured() {
        return DefaultValue.DEFAULT_STRICT ? STRICT : MASK;
    }

    /**
     * Packs a V1 identifier under this policy.
     *
     * @param timestampMs milliseconds since the Unix epoch
     * @param random random component (70 bits)
     * @param dataCenterId data center ID (5 bits)
     * @param machineId machine ID (5 bits)
     * @return the packed identifier
     * @throws IllegalArgumentException in strict mode, if a field is out of range
     */
    public Sulid v1(long timestampMs, BigInteger random, int dataCenterId, int machineId) {
        int dc = field("dataCenterId", dataCenterId, MAX_DATA_CENTER_ID);
        int machine = field("machineId", machineId, MAX_MACHINE_ID);
        return pack(timestampMs, random, (dc << MACHINE_ID_BITS) | machine);
    }

    /**
     * Packs a V2 identifier under this policy.
     *
     * @param timestampMs milliseconds since the Unix epoch
     * @param random random component (70 bits)
     * @param workerId worker ID (10 bits)
     * @return the packed identifier
     * @throws IllegalArgumentException in strict mode, if a field is out of range
     */
    public Sulid v2(long timestampMs, BigInteger random, int workerId) {
        return pack(timestampMs, random, field("workerId", workerId, MAX_WORKER_ID));
    }

    private Sulid pack(long timestampMs, BigInteger random, int identityBits) {
        BigInteger r = random(random);
        return Sulid.pack(timestamp(timestampMs), r.shiftRight(64).longValue(), r.longValue(), identityBits);
    }

    abstract long timestamp(long timestampMs);

    abstract BigInteger random(BigInteger random);

    abstract int field(String name, int value, int max);
}
