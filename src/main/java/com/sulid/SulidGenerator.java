// ==================== SulidGenerator.java ====================
package com.sulid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.sulid.DefaultValue.MAX_BATCH_SIZE;
import static com.sulid.DefaultValue.MAX_TIMESTAMP_MS;
import static com.sulid.DefaultValue.MAX_WORKER_ID;

/**
 * SulidGenerator - Sulid generator backed by a clock and a random source
 *
 * <p>Each call reads the current time, draws 70 random bits and stamps the
 * generator's fixed {@link WorkerIdentity}. The generator keeps no record of
 * previously issued ids: uniqueness within one millisecond is probabilistic,
 * and ids from consecutive calls are not guaranteed to increase. Use
 * {@link #generateBatch(int)} or {@link Sulid#increment()} for an increasing
 * sequence.</p>
 *
 * <p><b>Thread safety:</b> in shared mode (the default, see
 * {@link DefaultValue#DEFAULT_SHARED_RANDOM}) both random words of one id are drawn
 * inside a single {@code synchronized} block on a private lock, so one instance
 * can serve many threads. In local mode nothing is locked and the instance must
 * stay confined to one thread.</p>
 *
 * <pre>{@code
 * SulidGenerator generator = SulidGenerator.v1(1, 1);
 * Sulid id = generator.generate();
 * }</pre>
 */
public final class SulidGenerator implements SulidFactory {
    private static final Logger logger = LoggerFactory.getLogger(SulidGenerator.class);

    private final PureSulidFactory factory;
    private final RandomSource randomSource;
    private final Clock clock;
    private final boolean sharedRandom;

    /** Guards {@link #randomSource} in shared mode */
    private final Object randomLock = new Object();

    private SulidGenerator(Builder builder) {
        this.factory = new PureSulidFactory(builder.identity);
        this.randomSource = builder.randomSource != null ? builder.randomSource : RandomSource.secure();
        this.clock = builder.clock;
        this.sharedRandom = builder.sharedRandom;
        logger.info("Sulid generator created: identity={}, sharedRandom={}", builder.identity, sharedRandom);
    }

    // ==================== Factories ====================

    /**
     * Creates a V1 generator.
     *
     * @param dataCenterId data center ID (0-31)
     * @param machineId machine ID within the data center (0-31)
     * @return the generator
     * @throws IllegalArgumentException if either value is outside 0-31
     */
    public static SulidGenerator v1(int dataCenterId, int machineId) {
        return builder().identity(WorkerIdentity.v1(dataCenterId, machineId)).build();
    }

    /**
     * Creates a V2 generator.
     *
     * @param workerId worker ID (0-1023)
     * @return the generator
     * @throws IllegalArgumentException if the value is outside 0-1023
     */
    public static SulidGenerator v2(int workerId) {
        return builder().identity(WorkerIdentity.v2(workerId)).build();
    }

    /**
     * Creates a V2 generator whose worker ID is resolved by {@link WorkerIdAllocator}.
     *
     * @return the generator
     */
    public static SulidGenerator auto() {
        return v2((int) WorkerIdAllocator.getAutoWorkerId(MAX_WORKER_ID));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Core Generation Methods ====================

    /**
     * Generates a Sulid for the current time.
     *
     * @return a new identifier
     */
    public Sulid generate() {
        return generate(clock.instant());
    }

    /**
     * Generates a Sulid for the given time, e.g. when backdating migrated records.
     *
     * <p>Instants before the Unix epoch are clamped to the epoch.</p>
     *
     * @param instant the creation time to embed
     * @return a new identifier
     */
    public Sulid generate(Instant instant) {
        long timestampMs = epochMillis(instant);
        long high;
        long low;
        if (sharedRandom) {
            synchronized (randomLock) {
                high = randomSource.nextLong();
                low = randomSource.nextLong();
            }
        } else {
            high = randomSource.nextLong();
            low = randomSource.nextLong();
        }
        return Sulid.pack(timestampMs, high, low, factory.identity().bits());
    }

    /**
     * Generates a Sulid for the given time from a caller-owned random source.
     *
     * <p>The source is not locked; the caller is responsible for confining it.</p>
     *
     * @param instant the creation time to embed
     * @param source the random source to draw from
     * @return a new identifier
     */
    public Sulid generate(Instant instant, RandomSource source) {
        Objects.requireNonNull(source, "source");
        long high = source.nextLong();
        long low = source.nextLong();
        return Sulid.pack(epochMillis(instant), high, low, factory.identity().bits());
    }

    @Override
    public Sulid generate(long timestampMs, BigInteger random) {
        return factory.generate(timestampMs, random);
    }

    /**
     * Generates a strictly increasing batch sharing one timestamp.
     *
     * <p>The first id is random; every following id is its predecessor's
     * {@link Sulid#increment()}.</p>
     *
     * @param count number of ids (1-1024)
     * @return the ids, in increasing order
     * @throws IllegalArgumentException if count is invalid
     * @throws IllegalStateException if the random component runs out inside the batch
     */
    public List<Sulid> generateBatch(int count) {
        if (count <= 0 || count > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Invalid count: " + count);
        }
        List<Sulid> batch = new ArrayList<>(count);
        Sulid current = generate();
        batch.add(current);
        while (batch.size() < count) {
            Optional<Sulid> next = current.increment();
            if (!next.isPresent()) {
                logger.warn("Random component exhausted after {} of {} ids at {}", batch.size(), count, current);
                throw new IllegalStateException("Random component exhausted after " + batch.size() + " ids");
            }
            current = next.get();
            batch.add(current);
        }
        return batch;
    }

    // ==================== Getter Methods ====================

    @Override
    public WorkerIdentity identity() {
        return factory.identity();
    }

    public SulidVersion getVersion() {
        return factory.identity().getVersion();
    }

    public boolean isSharedRandom() {
        return sharedRandom;
    }

    /**
     * Returns configuration information as formatted string.
     *
     * @return formatted configuration report
     */
    public String getInfo() {
        WorkerIdentity identity = factory.identity();
        long years = MAX_TIMESTAMP_MS / (365L * 24 * 3600 * 1000);
        return String.format(
                "═══════════════════════════════════════\n" +
                        "Sulid Generator Config\n" +
                        "Version         : %s\n" +
                        "Bits            : %d(ts)+%d(rand)+%d(identity)=128 bits\n" +
                        "Timestamp Range : Unix epoch + ~%d years\n" +
                        "Identity        : %s\n" +
                        "Random Source   : %s\n" +
                        "Field Policy    : %s\n" +
                        "═══════════════════════════════════════\n",
                identity.getVersion(),
                DefaultValue.TIMESTAMP_BITS, DefaultValue.RANDOM_BITS, DefaultValue.WORKER_ID_BITS,
                years, identity,
                sharedRandom ? "shared (locked)" : "local (unlocked)",
                FieldPolicy.configured()
        );
    }

    /**
     * Milliseconds since the epoch, clamped at zero and truncated to 48 bits.
     */
    private static long epochMillis(Instant instant) {
        if (instant.getEpochSecond() < 0) {
            return 0L;
        }
        long millis = instant.getEpochSecond() * 1000L + instant.getNano() / 1_000_000;
        return millis & MAX_TIMESTAMP_MS;
    }

    // ==================== Builder ====================

    /**
     * Chainable configuration for a {@link SulidGenerator}.
     */
    public static final class Builder {
        private WorkerIdentity identity;
        private RandomSource randomSource;
        private Clock clock = Clock.systemUTC();
        private boolean sharedRandom = DefaultValue.DEFAULT_SHARED_RANDOM;

        private Builder() {
        }

        public Builder identity(WorkerIdentity identity) {
            this.identity = identity;
            return this;
        }

        /**
         * Sets the random source. Defaults to a new {@link java.security.SecureRandom}.
         */
        public Builder randomSource(RandomSource randomSource) {
            this.randomSource = randomSource;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Chooses whether draws from the random source are serialized.
         *
         * @param sharedRandom true to lock around every draw
         */
        public Builder sharedRandom(boolean sharedRandom) {
            this.sharedRandom = sharedRandom;
            return this;
        }

        /**
         * @throws IllegalStateException if no identity was set
         */
        public SulidGenerator build() {
            if (identity == null) {
                throw new IllegalStateException("identity must be set");
            }
            return new SulidGenerator(this);
        }
    }
}
