package com.sulid;

/**
 * Layout of the 10 identity bits at the bottom of a {@link Sulid}.
 *
 * <pre>
 * V1 | 48-bit timestamp | 70-bit random | 5-bit data center ID | 5-bit machine ID |
 * V2 | 48-bit timestamp | 70-bit random | 10-bit worker ID                      |
 * </pre>
 */
public enum SulidVersion {
    /** Data center ID and machine ID, 5 bits each */
    V1,

    /** Combined 10-bit worker ID */
    V2
}
