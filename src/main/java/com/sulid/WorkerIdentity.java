package com.sulid;

import java.util.Objects;

import static com.sulid.DefaultValue.MACHINE_ID_BITS;
import static com.sulid.DefaultValue.MAX_DATA_CENTER_ID;
import static com.sulid.DefaultValue.MAX_MACHINE_ID;
import static com.sulid.DefaultValue.MAX_WORKER_ID;

/**
 * The identity suffix a generator stamps on every {@link Sulid} it produces.
 *
 * <p>Either a V1 data center / machine pair or a V2 worker ID. Both occupy the
 * same 10 low bits, so a V1 identity also has a worker ID view and vice versa;
 * the version only says which fields the owner thinks in.</p>
 */
public final class WorkerIdentity {

    private final SulidVersion version;
    private final int bits;

    private WorkerIdentity(SulidVersion version, int bits) {
        this.version = version;
        this.bits = bits;
    }

    /**
     * Creates a V1 identity.
     *
     * @param dataCenterId data center ID (0-31)
     * @param machineId machine ID within the data center (0-31)
     * @return the identity
     * @throws IllegalArgumentException if either value is outside 0-31
     */
    public static WorkerIdentity v1(int dataCenterId, int machineId) {
        if (dataCenterId < 0 || dataCenterId > MAX_DATA_CENTER_ID)
            throw new IllegalArgumentException("dataCenterId must be in the range 0-" + MAX_DATA_CENTER_ID);
        if (machineId < 0 || machineId > MAX_MACHINE_ID)
            throw new IllegalArgumentException("machineId must be in the range 0-" + MAX_MACHINE_ID);
        return new WorkerIdentity(SulidVersion.V1, (dataCenterId << MACHINE_ID_BITS) | machineId);
    }

    /**
     * Creates a V2 identity.
     *
     * @param workerId worker ID (0-1023)
     * @return the identity
     * @throws IllegalArgumentException if the value is outside 0-1023
     */
    public static WorkerIdentity v2(int workerId) {
        if (workerId < 0 || workerId > MAX_WORKER_ID)
            throw new IllegalArgumentException("workerId must be in the range 0-" + MAX_WORKER_ID);
        return new WorkerIdentity(SulidVersion.V2, workerId);
    }

    /**
     * Reads the identity bits of an existing Sulid.
     *
     * @param sulid the identifier
     * @param version how to interpret the bits
     * @return the identity
     */
    public static WorkerIdentity of(Sulid sulid, SulidVersion version) {
        Objects.requireNonNull(version, "version");
        return new WorkerIdentity(version, sulid.workerId());
    }

    public SulidVersion getVersion() {
        return version;
    }

    public int getDataCenterId() {
        return bits >>> MACHINE_ID_BITS;
    }

    public int getMachineId() {
        return bits & MAX_MACHINE_ID;
    }

    public int getWorkerId() {
        return bits;
    }

    /** The 10-bit suffix as packed into the identifier */
    int bits() {
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkerIdentity)) return false;
        WorkerIdentity that = (WorkerIdentity) o;
        return version == that.version && bits == that.bits;
    }

    @Override
    public int hashCode() {
        return 31 * version.hashCode() + bits;
    }

    @Override
    public String toString() {
        if (version == SulidVersion.V1) {
            return String.format("V1[DC:%d Machine:%d]", getDataCenterId(), getMachineId());
        }
        return String.format("V2[Worker:%d]", bits);
    }
}
