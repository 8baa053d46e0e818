// ==================== Sulid.java ====================
package com.sulid;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;

import static com.sulid.DefaultValue.BYTE_LENGTH;
import static com.sulid.DefaultValue.ENCODED_LENGTH;
import static com.sulid.DefaultValue.MACHINE_ID_BITS;
import static com.sulid.DefaultValue.MAX_MACHINE_ID;
import static com.sulid.DefaultValue.MAX_TIMESTAMP_MS;
import static com.sulid.DefaultValue.MAX_WORKER_ID;
import static com.sulid.DefaultValue.RANDOM_BITS;
import static com.sulid.DefaultValue.WORKER_ID_BITS;

/**
 * Sulid - Snowflake-inspired Universally unique Lexicographically sortable IDentifier
 *
 * <p>An immutable 128-bit value, canonically written as 26 Crockford Base32
 * characters. The high 48 bits are a Unix timestamp in milliseconds, the next 70
 * bits are random and the low 10 bits carry the worker identity:</p>
 *
 * <pre>
 * V1 | 48-bit timestamp | 70-bit random | 5-bit data center ID | 5-bit machine ID |
 * V2 | 48-bit timestamp | 70-bit random | 10-bit worker ID                      |
 * </pre>
 *
 * <p>Ordering is unsigned 128-bit ordering, which matches the ordering of the text
 * form and, for different timestamps, the order of creation.</p>
 *
 * @see SulidGenerator
 */
public final class Sulid implements Comparable<Sulid> {

    // ==================== Layout Constants ====================

    /** Largest random component, 70 bits set */
    static final BigInteger MAX_RANDOM = BigInteger.ONE.shiftLeft(RANDOM_BITS).subtract(BigInteger.ONE);

    private static final BigInteger MASK_64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    /** Bits of the random component living in the high word */
    private static final long RANDOM_HIGH_MASK = (1L << (RANDOM_BITS - 64)) - 1;

    /** Shift of the timestamp inside the high word */
    private static final int TIMESTAMP_SHIFT = 128 - 64 - DefaultValue.TIMESTAMP_BITS;

    /** One unit of the random component */
    private static final long RANDOM_UNIT = 1L << WORKER_ID_BITS;

    private static final Sulid NIL = new Sulid(0L, 0L);

    // ==================== Value ====================

    private final long msb;
    private final long lsb;

    private Sulid(long msb, long lsb) {
        this.msb = msb;
        this.lsb = lsb;
    }

    // ==================== Factories ====================

    /**
     * Creates a Sulid from its two 64-bit halves.
     *
     * @param mostSignificantBits high 64 bits
     * @param leastSignificantBits low 64 bits
     * @return the identifier
     */
    public static Sulid of(long mostSignificantBits, long leastSignificantBits) {
        return new Sulid(mostSignificantBits, leastSignificantBits);
    }

    /**
     * Creates a V1 Sulid from separated parts, using {@link FieldPolicy#configured()}.
     *
     * <p>With the default masking policy any overflow bits in the arguments are
     * discarded and a negative timestamp becomes zero.</p>
     *
     * @param timestampMs milliseconds since the Unix epoch
     * @param random random component (70 bits)
     * @param dataCenterId data center ID (5 bits)
     * @param machineId machine ID (5 bits)
     * @return the identifier
     * @throws IllegalArgumentException in strict mode, if a field is out of range
     */
    public static Sulid fromParts(long timestampMs, BigInteger random, int dataCenterId, int machineId) {
        return FieldPolicy.configured().v1(timestampMs, random, dataCenterId, machineId);
    }

    /**
     * Creates a V2 Sulid from separated parts, using {@link FieldPolicy#configured()}.
     *
     * @param timestampMs milliseconds since the Unix epoch
     * @param random random component (70 bits)
     * @param workerId worker ID (10 bits)
     * @return the identifier
     * @throws IllegalArgumentException in strict mode, if a field is out of range
     */
    public static Sulid fromParts(long timestampMs, BigInteger random, int workerId) {
        return FieldPolicy.configured().v2(timestampMs, random, workerId);
    }

    /**
     * Creates a Sulid stamped with a validated worker identity.
     *
     * @param timestampMs milliseconds since the Unix epoch
     * @param random random component (70 bits)
     * @param identity the worker identity
     * @return the identifier
     */
    public static Sulid fromParts(long timestampMs, BigInteger random, WorkerIdentity identity) {
        return FieldPolicy.configured().v2(timestampMs, random, identity.bits());
    }

    /**
     * Reassembles a Sulid from the result of {@link #toParts()}.
     *
     * @param parts the parts
     * @return the identifier
     */
    public static Sulid fromParts(Parts parts) {
        return fromParts(parts.timestampMs, parts.random, parts.dataCenterId, parts.machineId);
    }

    /**
     * Packs already range-checked fields. The random component is given as its
     * high 6 bits and low 64 bits.
     */
    static Sulid pack(long timestampMs, long randomHigh, long randomLow, int identityBits) {
        long msb = (timestampMs << TIMESTAMP_SHIFT)
                | ((randomHigh & RANDOM_HIGH_MASK) << WORKER_ID_BITS)
                | (randomLow >>> (64 - WORKER_ID_BITS));
        long lsb = (randomLow << WORKER_ID_BITS) | (identityBits & MAX_WORKER_ID);
        return new Sulid(msb, lsb);
    }

    /**
     * Creates a Sulid from its unsigned integer representation.
     *
     * <p>Bits above the low 128 are discarded.</p>
     *
     * @param value the 128-bit value
     * @return the identifier
     */
    public static Sulid fromBigInteger(BigInteger value) {
        Objects.requireNonNull(value, "value");
        return new Sulid(value.shiftRight(64).longValue(), value.longValue());
    }

    /**
     * Creates a Sulid from 16 big-endian bytes.
     *
     * @param bytes the binary form, byte 0 most significant
     * @return the identifier
     * @throws IllegalArgumentException if the array is not 16 bytes long
     */
    public static Sulid fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Sulid bytes must be " + BYTE_LENGTH + " long");
        }
        long msb = 0L;
        long lsb = 0L;
        for (int i = 0; i < 8; i++) {
            msb = (msb << 8) | (bytes[i] & 0xFF);
        }
        for (int i = 8; i < BYTE_LENGTH; i++) {
            lsb = (lsb << 8) | (bytes[i] & 0xFF);
        }
        return new Sulid(msb, lsb);
    }

    /**
     * Creates a Sulid from its Crockford Base32 text form.
     *
     * @param encoded 26 character string
     * @return the identifier
     * @throws DecodeException if the text is not a valid encoded Sulid
     */
    public static Sulid fromString(String encoded) {
        return Crockford.decode(encoded);
    }

    /**
     * The nil Sulid, all 128 bits zero.
     *
     * @return the nil identifier
     */
    public static Sulid nil() {
        return NIL;
    }

    public boolean isNil() {
        return msb == 0L && lsb == 0L;
    }

    // ==================== Projections ====================

    public long getMostSignificantBits() {
        return msb;
    }

    public long getLeastSignificantBits() {
        return lsb;
    }

    /**
     * Returns the timestamp section.
     *
     * @return milliseconds since the Unix epoch
     */
    public long timestampMs() {
        return (msb >>> TIMESTAMP_SHIFT) & MAX_TIMESTAMP_MS;
    }

    /**
     * Returns the timestamp section as an instant, accurate to 1ms.
     *
     * @return the creation instant
     */
    public Instant instant() {
        return Instant.ofEpochMilli(timestampMs());
    }

    /**
     * Returns the 70-bit random section.
     *
     * @return the random component, never negative
     */
    public BigInteger random() {
        return unsigned(randomHigh()).shiftLeft(64).or(unsigned(randomLow()));
    }

    public int dataCenterId() {
        return (int) ((lsb >>> MACHINE_ID_BITS) & MAX_MACHINE_ID);
    }

    public int machineId() {
        return (int) (lsb & MAX_MACHINE_ID);
    }

    public int workerId() {
        return (int) (lsb & MAX_WORKER_ID);
    }

    /**
     * Returns the identity bits read with the given layout.
     *
     * @param version how to interpret the identity bits
     * @return the identity
     */
    public WorkerIdentity identity(SulidVersion version) {
        return WorkerIdentity.of(this, version);
    }

    private long randomHigh() {
        return (msb >>> WORKER_ID_BITS) & RANDOM_HIGH_MASK;
    }

    private long randomLow() {
        return (lsb >>> WORKER_ID_BITS) | (msb << (64 - WORKER_ID_BITS));
    }

    // ==================== Arithmetic ====================

    /**
     * Returns the next Sulid with the same timestamp and identity.
     *
     * <p>Only the random section is incremented. When it is already at its maximum
     * there is no successor for this millisecond and identity.</p>
     *
     * @return the successor, or empty if the random section is exhausted
     */
    public Optional<Sulid> increment() {
        if (randomHigh() == RANDOM_HIGH_MASK && randomLow() == -1L) {
            return Optional.empty();
        }
        long next = lsb + RANDOM_UNIT;
        // Carry into the high word; cannot reach the timestamp while random < max
        long carry = Long.compareUnsigned(next, lsb) < 0 ? 1L : 0L;
        return Optional.of(new Sulid(msb + carry, next));
    }

    // ==================== Conversions ====================

    /**
     * Returns the unsigned integer representation.
     *
     * @return a value in {@code [0, 2^128)}
     */
    public BigInteger toBigInteger() {
        return unsigned(msb).shiftLeft(64).or(unsigned(lsb));
    }

    /**
     * Returns the 16 big-endian bytes.
     *
     * @return a new array, byte 0 most significant
     */
    public byte[] toBytes() {
        byte[] bytes = new byte[BYTE_LENGTH];
        for (int i = 0; i < 8; i++) {
            bytes[i] = (byte) (msb >>> (56 - 8 * i));
            bytes[8 + i] = (byte) (lsb >>> (56 - 8 * i));
        }
        return bytes;
    }

    /**
     * Splits this Sulid into its fields.
     *
     * @return the parts, inverse of {@link #fromParts(Parts)}
     */
    public Parts toParts() {
        return new Parts(timestampMs(), random(), dataCenterId(), machineId());
    }

    /**
     * Writes the Crockford Base32 form into a caller-provided buffer.
     *
     * @param buffer destination, at least 26 chars
     * @return the buffer
     * @throws IllegalArgumentException if the buffer is too small
     */
    public char[] encodeTo(char[] buffer) {
        if (buffer == null || buffer.length < ENCODED_LENGTH) {
            throw new IllegalArgumentException("Buffer too small, need " + ENCODED_LENGTH + " chars");
        }
        Crockford.encode(msb, lsb, buffer);
        return buffer;
    }

    /**
     * Returns the 26 character Crockford Base32 form.
     */
    @Override
    public String toString() {
        char[] buffer = new char[ENCODED_LENGTH];
        Crockford.encode(msb, lsb, buffer);
        return new String(buffer);
    }

    @Override
    public int compareTo(Sulid other) {
        int c = Long.compareUnsigned(msb, other.msb);
        return c != 0 ? c : Long.compareUnsigned(lsb, other.lsb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sulid)) return false;
        Sulid that = (Sulid) o;
        return msb == that.msb && lsb == that.lsb;
    }

    @Override
    public int hashCode() {
        long h = msb ^ lsb;
        return (int) (h ^ (h >>> 32));
    }

    private static BigInteger unsigned(long value) {
        return BigInteger.valueOf(value).and(MASK_64);
    }

    // ==================== Parts ====================

    /**
     * Sulid fields container class.
     *
     * <p>Provides structured access to the fields of one identifier and a report
     * for analysis and debugging.</p>
     */
    public static final class Parts {
        /** Timestamp component, milliseconds since the Unix epoch */
        public final long timestampMs;

        /** Random component (70 bits) */
        public final BigInteger random;

        /** Data center ID component (V1 view) */
        public final int dataCenterId;

        /** Machine ID component (V1 view) */
        public final int machineId;

        /**
         * Constructs Parts with all components.
         *
         * @param timestampMs timestamp component
         * @param random random component
         * @param dataCenterId data center ID component
         * @param machineId machine ID component
         */
        public Parts(long timestampMs, BigInteger random, int dataCenterId, int machineId) {
            this.timestampMs = timestampMs;
            this.random = Objects.requireNonNull(random, "random");
            this.dataCenterId = dataCenterId;
            this.machineId = machineId;
        }

        /** Worker ID component (V2 view of the same bits) */
        public int getWorkerId() {
            return ((dataCenterId & MAX_MACHINE_ID) << MACHINE_ID_BITS) | (machineId & MAX_MACHINE_ID);
        }

        public Date getDate() {
            return new Date(timestampMs);
        }

        /**
         * Generates a detailed report of the components.
         *
         * @return formatted report string
         */
        public String generateReport() {
            Sulid sulid = fromParts(this);
            return String.format(
                    "═══════════════════════════════════════\n" +
                            "Sulid Detailed Report\n" +
                            "═══════════════════════════════════════\n" +
                            "Sulid           : %s\n" +
                            "Hex             : 0x%016X%016X\n" +
                            "Timestamp       : %d (%s)\n" +
                            "Random          : %s\n" +
                            "Datacenter ID   : %d\n" +
                            "Machine ID      : %d\n" +
                            "Worker ID       : %d\n" +
                            "═══════════════════════════════════════\n",
                    sulid, sulid.msb, sulid.lsb, timestampMs, Instant.ofEpochMilli(timestampMs),
                    random.toString(16).toUpperCase(), dataCenterId, machineId, getWorkerId());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Parts)) return false;
            Parts that = (Parts) o;
            return timestampMs == that.timestampMs && dataCenterId == that.dataCenterId
                    && machineId == that.machineId && random.equals(that.random);
        }

        @Override
        public int hashCode() {
            return Objects.hash(timestampMs, random, dataCenterId, machineId);
        }

        @Override
        public String toString() {
            return String.format("Sulid.Parts[Time:%d Random:%s DC:%d Machine:%d]",
                    timestampMs, random, dataCenterId, machineId);
        }
    }
}
