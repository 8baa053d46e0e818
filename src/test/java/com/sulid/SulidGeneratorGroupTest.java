package com.sulid;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for SulidGeneratorGroup
 *
 * <p>Validates member configuration, balancing strategies and multi-threaded use.</p>
 */
class SulidGeneratorGroupTest {
    private static final Logger logger = LoggerFactory.getLogger(SulidGeneratorGroupTest.class);

    private static final int TEST_INSTANCE_COUNT = 4;
    private static final int START_WORKER_ID = 10;

    private SulidGeneratorGroup group;

    @BeforeEach
    void setUp() {
        group = new SulidGeneratorGroup()
                .setStartWorkerIdAndCount(START_WORKER_ID, TEST_INSTANCE_COUNT)
                .setBalancingStrategy(SulidGeneratorGroup.BalancingStrategy.THREAD_LOCAL_ROUND_ROBIN);
    }

    static void line() {
        logger.info("═══════════════════════════════════════");
    }

    @Test
    void testInstanceConfiguration() {
        assertEquals(TEST_INSTANCE_COUNT, group.getInstanceCount());
        for (int i = 0; i < TEST_INSTANCE_COUNT; i++) {
            assertEquals(START_WORKER_ID + i, group.getInstance(i).identity().getWorkerId(),
                    "Instance " + i + " should have consecutive worker ID");
            assertEquals(SulidVersion.V2, group.getInstance(i).getVersion());
        }
        logger.info(group.getInfo());
    }

    @Test
    void testRejectsInvalidRanges() {
        SulidGeneratorGroup g = new SulidGeneratorGroup();

        assertThrows(IllegalStateException.class, g::generate);
        assertThrows(IllegalArgumentException.class, () -> g.setStartWorkerIdAndCount(0, 0));
        assertThrows(IllegalArgumentException.class, () -> g.setStartWorkerIdAndCount(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> g.setStartWorkerIdAndCount(1020, 5));
        assertEquals(4, g.setStartWorkerIdAndCount(1020, 4).getInstanceCount());
    }

    @Test
    void testBalancingStrategies() {
        for (SulidGeneratorGroup.BalancingStrategy strategy : SulidGeneratorGroup.BalancingStrategy.values()) {
            SulidGeneratorGroup testGroup = new SulidGeneratorGroup()
                    .setStartWorkerIdAndCount(0, 4)
                    .setBalancingStrategy(strategy);

            Map<Integer, Integer> usage = new HashMap<>();
            for (int i = 0; i < 1000; i++) {
                usage.merge(testGroup.generate().workerId(), 1, Integer::sum);
            }

            switch (strategy) {
                case THREAD_LOCAL_ROUND_ROBIN:
                    assertEquals(4, usage.size(), "round robin should use every member");
                    for (int count : usage.values()) {
                        assertEquals(250, count, "round robin should be perfectly balanced");
                    }
                    break;
                case THREAD_LOCAL_FIXED:
                case THREAD_ID_HASH:
                    assertEquals(1, usage.size(), strategy + " should pin a single thread to one member");
                    break;
            }
            logger.info("Strategy {}: single thread distribution {}", strategy, usage);
        }
    }

    @Test
    void testMultiThreadUniqueness() throws InterruptedException, ExecutionException {
        line();
        logger.info("Test name: [testMultiThreadUniqueness]");
        line();

        final int THREADS = 8;
        final int IDS_PER_THREAD = 5_000;
        group.setBalancingStrategy(SulidGeneratorGroup.BalancingStrategy.THREAD_ID_HASH);

        Set<Sulid> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(executor.submit(() -> {
                    int duplicates = 0;
                    for (int i = 0; i < IDS_PER_THREAD; i++) {
                        Sulid id = group.generate();
                        if (id.workerId() < START_WORKER_ID || id.workerId() >= START_WORKER_ID + TEST_INSTANCE_COUNT) {
                            throw new AssertionError("worker ID out of range: " + id.workerId());
                        }
                        if (!ids.add(id)) duplicates++;
                    }
                    return duplicates;
                }));
            }
            for (Future<Integer> f : futures) {
                assertEquals(0, f.get());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(THREADS * IDS_PER_THREAD, ids.size());
        logger.info("✅ {} unique ids across {} threads", ids.size(), THREADS);
    }
}
