package com.sulid;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for SulidGenerator
 *
 * <p>Validates construction checks, live and backdated generation, deterministic
 * sources, batches and concurrent use of one instance.</p>
 */
class SulidGeneratorTest {
    private static final Logger logger = LoggerFactory.getLogger(SulidGeneratorTest.class);

    private static final Instant FIXED = Instant.parse("2024-06-01T12:00:00.123Z");

    static void line() {
        logger.info("═══════════════════════════════════════");
    }

    static void lineDone() {
        logger.info("═══════════════════════════════════════\n\n");
    }

    private static SulidGenerator fixedClockGenerator(WorkerIdentity identity) {
        return SulidGenerator.builder()
                .identity(identity)
                .clock(Clock.fixed(FIXED, ZoneOffset.UTC))
                .build();
    }

    // ==================== Construction ====================

    @Test
    void testV1RejectsOutOfRangeIds() {
        IllegalArgumentException dc = assertThrows(IllegalArgumentException.class, () -> SulidGenerator.v1(32, 1));
        assertEquals("dataCenterId must be in the range 0-31", dc.getMessage());

        IllegalArgumentException machine = assertThrows(IllegalArgumentException.class, () -> SulidGenerator.v1(1, 32));
        assertEquals("machineId must be in the range 0-31", machine.getMessage());

        assertThrows(IllegalArgumentException.class, () -> SulidGenerator.v1(-1, 0));
    }

    @Test
    void testV2RejectsOutOfRangeIds() {
        assertThrows(IllegalArgumentException.class, () -> SulidGenerator.v2(1024));
        assertThrows(IllegalArgumentException.class, () -> SulidGenerator.v2(-1));
        assertEquals(1023, SulidGenerator.v2(1023).identity().getWorkerId());
    }

    @Test
    void testBuilderRequiresIdentity() {
        assertThrows(IllegalStateException.class, () -> SulidGenerator.builder().build());
    }

    // ==================== Generation ====================

    @Test
    void testGenerateUniqueIds() {
        SulidGenerator generator = SulidGenerator.v1(1, 1);

        Sulid id1 = generator.generate();
        Sulid id2 = generator.generate();

        assertNotEquals(id1, id2);
        assertEquals(1, id1.dataCenterId());
        assertEquals(1, id1.machineId());
        assertEquals(SulidVersion.V1, generator.getVersion());
    }

    @Test
    void testSameMillisecondDiffersOnlyInRandom() {
        SulidGenerator generator = fixedClockGenerator(WorkerIdentity.v1(3, 17));

        Sulid id1 = generator.generate();
        Sulid id2 = generator.generate();

        assertNotEquals(id1.random(), id2.random());
        assertEquals(FIXED.toEpochMilli(), id1.timestampMs());
        assertEquals(id1.timestampMs(), id2.timestampMs());
        assertEquals(3, id2.dataCenterId());
        assertEquals(17, id2.machineId());
    }

    @Test
    void testV2StampsWorkerId() {
        SulidGenerator generator = fixedClockGenerator(WorkerIdentity.v2(777));

        Sulid id = generator.generate();

        assertEquals(777, id.workerId());
        assertEquals(WorkerIdentity.v2(777), id.identity(SulidVersion.V2));
    }

    @Test
    void testTimestampTracksClock() {
        long before = System.currentTimeMillis();
        Sulid id = SulidGenerator.v2(5).generate();
        long after = System.currentTimeMillis();

        assertTrue(id.timestampMs() >= before && id.timestampMs() <= after,
                "timestamp should come from the wall clock");
    }

    @Test
    void testDeterministicSource() {
        SulidGenerator generator = SulidGenerator.v1(0, 0);
        RandomSource constant = () -> 123L;

        Sulid u1 = generator.generate(FIXED, constant);
        Sulid u2 = generator.generate(FIXED.plusMillis(1), constant);
        Sulid u3 = generator.generate(FIXED.plusMillis(1), constant);

        assertTrue(u1.compareTo(u2) < 0);
        assertEquals(u2, u3);
    }

    @Test
    void testSeededGeneratorsAgree() {
        SulidGenerator a = SulidGenerator.builder().identity(WorkerIdentity.v2(9))
                .clock(Clock.fixed(FIXED, ZoneOffset.UTC))
                .randomSource(RandomSource.of(new Random(42L))).build();
        SulidGenerator b = SulidGenerator.builder().identity(WorkerIdentity.v2(9))
                .clock(Clock.fixed(FIXED, ZoneOffset.UTC))
                .randomSource(RandomSource.of(new Random(42L))).sharedRandom(false).build();

        for (int i = 0; i < 10; i++) {
            assertEquals(a.generate(), b.generate());
        }
        assertFalse(b.isSharedRandom());
    }

    @Test
    void testBackdatingClampsAtEpoch() {
        SulidGenerator generator = SulidGenerator.v1(0, 0);

        Sulid beforeEpoch = generator.generate(Instant.EPOCH.minusSeconds(100));
        Sulid justBefore = generator.generate(Instant.EPOCH.minusMillis(1));
        Sulid migrated = generator.generate(Instant.parse("2001-09-09T01:46:40Z"));

        assertEquals(Instant.EPOCH, beforeEpoch.instant());
        assertEquals(0L, justBefore.timestampMs());
        assertEquals(1_000_000_000_000L, migrated.timestampMs());
    }

    @Test
    void testOrderAcrossMilliseconds() {
        SulidGenerator generator = SulidGenerator.v1(0, 0);

        Sulid first = generator.generate(FIXED);
        Sulid second = generator.generate(FIXED.plusMillis(1));

        assertTrue(first.compareTo(second) < 0);
        assertTrue(first.toString().compareTo(second.toString()) < 0);
    }

    @Test
    void testPureGenerateUsesIdentity() {
        SulidGenerator generator = SulidGenerator.v1(2, 4);
        PureSulidFactory pure = PureSulidFactory.v1(2, 4);
        BigInteger random = new BigInteger("3FFFFFFFFFFFFFFFF", 16);

        Sulid id = generator.generate(1_000L, random);

        assertEquals(pure.generate(1_000L, random), id);
        assertEquals(Sulid.fromParts(1_000L, random, 2, 4), id);
        assertEquals(pure.identity(), generator.identity());
    }

    // ==================== Batch ====================

    @Test
    void testBatchIsStrictlyIncreasing() {
        SulidGenerator generator = fixedClockGenerator(WorkerIdentity.v1(6, 6));

        List<Sulid> batch = generator.generateBatch(100);

        assertEquals(100, batch.size());
        for (int i = 1; i < batch.size(); i++) {
            Sulid prev = batch.get(i - 1);
            Sulid cur = batch.get(i);
            assertTrue(prev.compareTo(cur) < 0);
            assertEquals(prev.random().add(BigInteger.ONE), cur.random());
            assertEquals(prev.timestampMs(), cur.timestampMs());
            assertEquals(prev.workerId(), cur.workerId());
        }
    }

    @Test
    void testBatchRejectsInvalidCount() {
        SulidGenerator generator = SulidGenerator.v2(1);

        assertThrows(IllegalArgumentException.class, () -> generator.generateBatch(0));
        assertThrows(IllegalArgumentException.class, () -> generator.generateBatch(DefaultValue.MAX_BATCH_SIZE + 1));
    }

    @Test
    void testBatchExhaustion() {
        // All random bits set except the lowest: only one successor exists
        SulidGenerator generator = SulidGenerator.builder()
                .identity(WorkerIdentity.v2(1))
                .clock(Clock.fixed(FIXED, ZoneOffset.UTC))
                .randomSource(new RandomSource() {
                    private int calls;

                    @Override
                    public long nextLong() {
                        return calls++ % 2 == 0 ? -1L : -2L;
                    }
                })
                .build();

        assertEquals(2, generator.generateBatch(2).size());
        assertThrows(IllegalStateException.class, () -> generator.generateBatch(3));
    }

    // ==================== Concurrency ====================

    @Test
    void testConcurrentGenerationIsUnique() throws InterruptedException {
        line();
        logger.info("Test name: [testConcurrentGenerationIsUnique]");
        logger.info("Goal: one shared generator serving many threads");
        line();

        final int THREAD_COUNT = 16;
        final int IDS_PER_THREAD = 10_000;

        SulidGenerator generator = SulidGenerator.v1(7, 7);
        logger.info(generator.getInfo());

        Set<Sulid> allIds = ConcurrentHashMap.newKeySet(THREAD_COUNT * IDS_PER_THREAD);
        AtomicInteger dup = new AtomicInteger();
        AtomicInteger wrongIdentity = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch end = new CountDownLatch(THREAD_COUNT);

        long startTime = System.nanoTime();
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < THREAD_COUNT; t++) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < IDS_PER_THREAD; i++) {
                        Sulid id = generator.generate();
                        if (!allIds.add(id)) dup.incrementAndGet();
                        if (id.dataCenterId() != 7 || id.machineId() != 7) wrongIdentity.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    end.countDown();
                }
            });
            threads.add(thread);
            thread.start();
        }
        start.countDown();
        assertTrue(end.await(60, TimeUnit.SECONDS), "workers should finish");
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;

        assertEquals(0, dup.get(), "no duplicates expected");
        assertEquals(0, wrongIdentity.get(), "identity bits must be preserved");
        assertEquals(THREAD_COUNT * IDS_PER_THREAD, allIds.size());

        line();
        logger.info("Result - [testConcurrentGenerationIsUnique]");
        logger.info("✅ {} unique ids from {} threads in {} ms", allIds.size(), threads.size(), durationMs);
        lineDone();
    }
}
