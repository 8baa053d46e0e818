package com.sulid;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SulidGeneratorGroup - several V2 generators behind one facade
 *
 * <p>Each member owns its own random source and lock and gets a consecutive
 * worker ID, so threads spread over the members contend less for a single lock
 * while the worker IDs keep their ids apart.</p>
 */
public final class SulidGeneratorGroup {

    /**
     * Member selection strategies
     */
    public enum BalancingStrategy {
        /** Each thread is bound to one member for its lifetime */
        THREAD_LOCAL_FIXED,

        /** Each thread cycles through all members */
        THREAD_LOCAL_ROUND_ROBIN,

        /** Member chosen by thread ID modulo member count */
        THREAD_ID_HASH
    }

    /**
     * Thread-local round-robin cursor
     */
    private static class ThreadLocalRoundRobin {
        private final ThreadLocal<Integer> threadLocalIndex = ThreadLocal.withInitial(() -> 0);
        private final int instanceCount;

        ThreadLocalRoundRobin(int instanceCount) {
            this.instanceCount = instanceCount;
        }

        int next() {
            int current = threadLocalIndex.get();
            threadLocalIndex.set((current + 1) % instanceCount);
            return current;
        }
    }

    // ==================== Instance Fields ====================

    private final List<SulidGenerator> generators = new ArrayList<>();
    private BalancingStrategy balancingStrategy = BalancingStrategy.THREAD_LOCAL_FIXED;

    private ThreadLocal<SulidGenerator> fixedBinding;
    private ThreadLocalRoundRobin roundRobin;

    // ==================== Configuration Fields ====================

    private Clock clock = Clock.systemUTC();
    private boolean sharedRandom = DefaultValue.DEFAULT_SHARED_RANDOM;

    // ==================== Configuration Methods ====================

    /**
     * Sets the clock used by members created afterwards.
     */
    public SulidGeneratorGroup setClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Sets the random-access mode of members created afterwards.
     */
    public SulidGeneratorGroup setSharedRandom(boolean sharedRandom) {
        this.sharedRandom = sharedRandom;
        return this;
    }

    /**
     * Creates the members with consecutive worker IDs.
     *
     * @param startWorkerId worker ID of the first member
     * @param instanceCount number of members
     * @return this group for method chaining
     * @throws IllegalArgumentException if the range does not fit in 0-1023
     */
    public SulidGeneratorGroup setStartWorkerIdAndCount(int startWorkerId, int instanceCount) {
        if (instanceCount <= 0) {
            throw new IllegalArgumentException("instanceCount must be positive");
        }
        if (startWorkerId < 0 || startWorkerId + instanceCount - 1 > DefaultValue.MAX_WORKER_ID) {
            throw new IllegalArgumentException("worker IDs " + startWorkerId + ".." + (startWorkerId + instanceCount - 1)
                    + " do not fit in 0-" + DefaultValue.MAX_WORKER_ID);
        }

        List<SulidGenerator> created = new ArrayList<>(instanceCount);
        for (int i = 0; i < instanceCount; i++) {
            created.add(SulidGenerator.builder()
                    .identity(WorkerIdentity.v2(startWorkerId + i))
                    .clock(clock)
                    .sharedRandom(sharedRandom)
                    .build());
        }
        generators.clear();
        generators.addAll(created);

        List<SulidGenerator> members = Collections.unmodifiableList(new ArrayList<>(created));
        this.fixedBinding = ThreadLocal.withInitial(
                () -> members.get((int) (Thread.currentThread().getId() % members.size())));
        this.roundRobin = new ThreadLocalRoundRobin(instanceCount);
        return this;
    }

    public SulidGeneratorGroup setBalancingStrategy(BalancingStrategy strategy) {
        this.balancingStrategy = strategy;
        return this;
    }

    // ==================== ID Generation Methods ====================

    /**
     * Generates a Sulid from the member picked by the balancing strategy.
     *
     * @return a new identifier
     * @throws IllegalStateException if no members are configured
     */
    public Sulid generate() {
        return selectInstance().generate();
    }

    private SulidGenerator selectInstance() {
        if (generators.isEmpty()) {
            throw new IllegalStateException("No generators configured. Call setStartWorkerIdAndCount() first.");
        }

        switch (balancingStrategy) {
            case THREAD_LOCAL_FIXED:
                return fixedBinding.get();
            case THREAD_LOCAL_ROUND_ROBIN:
                return generators.get(roundRobin.next());
            case THREAD_ID_HASH:
            default:
                return generators.get((int) (Thread.currentThread().getId() % generators.size()));
        }
    }

    // ==================== Utility Methods ====================

    public int getInstanceCount() {
        return generators.size();
    }

    public BalancingStrategy getBalancingStrategy() {
        return balancingStrategy;
    }

    /**
     * @throws IndexOutOfBoundsException if index is invalid
     */
    public SulidGenerator getInstance(int index) {
        return generators.get(index);
    }

    /**
     * Returns detailed configuration information
     *
     * @return formatted configuration report
     */
    public String getInfo() {
        if (generators.isEmpty()) {
            return "SulidGeneratorGroup: No generators configured";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("═══════════════════════════════════════\n");
        sb.append("SulidGeneratorGroup Configuration\n");
        sb.append("═══════════════════════════════════════\n");
        sb.append("Instance Count    : ").append(generators.size()).append("\n");
        sb.append("Balancing Strategy: ").append(balancingStrategy).append("\n");
        sb.append("Worker ID Range   : ").append(generators.get(0).identity().getWorkerId())
                .append(" to ").append(generators.get(generators.size() - 1).identity().getWorkerId()).append("\n");
        sb.append("═══════════════════════════════════════\n");
        return sb.toString();
    }
}
