// ==================== DefaultValue.java ====================
package com.sulid;

/**
 * Sulid Default Configuration Values
 *
 * <p>Centralized location for the bit layout constants and the deployment-time
 * switches used by {@link Sulid}, {@link SulidGenerator} and related components.
 * The switches are resolved once when this class is loaded, from an environment
 * variable first and a JVM system property second.</p>
 */
public final class DefaultValue {

    // ==================== Bit Layout ====================

    /** Number of bits for the millisecond timestamp (48 bits) */
    public static final int TIMESTAMP_BITS = 48;

    /** Number of bits for the random component (70 bits) */
    public static final int RANDOM_BITS = 70;

    /** Number of bits for the data center ID in a V1 layout (5 bits) */
    public static final int DATA_CENTER_ID_BITS = 5;

    /** Number of bits for the machine ID in a V1 layout (5 bits) */
    public static final int MACHINE_ID_BITS = 5;

    /** Number of bits for the worker ID in a V2 layout (10 bits) */
    public static final int WORKER_ID_BITS = DATA_CENTER_ID_BITS + MACHINE_ID_BITS;

    /** Maximum data center ID (31) */
    public static final int MAX_DATA_CENTER_ID = (1 << DATA_CENTER_ID_BITS) - 1;

    /** Maximum machine ID (31) */
    public static final int MAX_MACHINE_ID = (1 << MACHINE_ID_BITS) - 1;

    /** Maximum worker ID (1023) */
    public static final int MAX_WORKER_ID = (1 << WORKER_ID_BITS) - 1;

    /** Maximum timestamp in milliseconds (2^48 - 1) */
    public static final long MAX_TIMESTAMP_MS = (1L << TIMESTAMP_BITS) - 1;

    /** Length of the canonical text form (26 Crockford Base32 characters) */
    public static final int ENCODED_LENGTH = 26;

    /** Length of the binary form (16 bytes) */
    public static final int BYTE_LENGTH = 16;

    // ==================== Deployment Switches ====================

    /** Environment variable enabling strict field range checks */
    public static final String STRICT_ENV_KEY = "SULID_STRICT";

    /** System property enabling strict field range checks */
    public static final String STRICT_PROP_KEY = "sulid.strict";

    /** Environment variable selecting a shared (locked) random source */
    public static final String SHARED_RANDOM_ENV_KEY = "SULID_SHARED_RANDOM";

    /** System property selecting a shared (locked) random source */
    public static final String SHARED_RANDOM_PROP_KEY = "sulid.random.shared";

    /** Whether out-of-range fields are rejected instead of masked (default false) */
    public static final boolean DEFAULT_STRICT = resolveFlag(STRICT_ENV_KEY, STRICT_PROP_KEY, false);

    /** Whether generators lock around their random source by default (default true) */
    public static final boolean DEFAULT_SHARED_RANDOM =
            resolveFlag(SHARED_RANDOM_ENV_KEY, SHARED_RANDOM_PROP_KEY, true);

    /** Largest batch accepted by {@link SulidGenerator#generateBatch(int)} */
    public static final int MAX_BATCH_SIZE = 1024;

    // ==================== Utility Methods ====================

    /** Prevent instantiation */
    private DefaultValue() {
        throw new AssertionError("Cannot instantiate DefaultValue class");
    }

    /**
     * Reads a boolean switch, environment variable first.
     *
     * @param envKey environment variable name
     * @param propKey system property name
     * @param fallback value used when neither is set
     * @return the resolved flag
     */
    static boolean resolveFlag(String envKey, String propKey, boolean fallback) {
        String value = System.getenv(envKey);
        if (value == null || value.trim().isEmpty()) {
            value = System.getProperty(propKey);
        }
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
