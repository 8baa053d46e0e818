package com.sulid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Resolves the local worker identity without any coordination service.
 *
 * <p>Priority: env var → system property → host address last segment → MAC address → random.
 * The result is only as unique as the deployment makes it; pin {@code WORKER_ID}
 * or {@code -Dworker.id} wherever two processes could share a host.</p>
 */
public final class WorkerIdAllocator {
    private static final Logger logger = LoggerFactory.getLogger(WorkerIdAllocator.class);

    static final String ENV_KEY = "WORKER_ID";
    static final String PROP_KEY = "worker.id";

    private WorkerIdAllocator() {
    }

    /**
     * Resolves a worker ID.
     *
     * @param maxWorkerId maximum allowed worker ID (e.g. 1023 for 10 bits)
     * @return value between 0 and maxWorkerId
     * @throws IllegalArgumentException if maxWorkerId is negative
     */
    public static long getAutoWorkerId(int maxWorkerId) {
        if (maxWorkerId < 0) {
            throw new IllegalArgumentException("maxWorkerId must be non-negative");
        }

        OptionalLong configured = getConfiguredWorkerId(maxWorkerId);
        if (configured.isPresent()) {
            logger.info("Using configured WorkerId: {} (source: {})", configured.getAsLong(),
                    configuredFromEnv() ? "environment variable" : "JVM parameter");
            return configured.getAsLong();
        }

        try {
            OptionalLong segment = getIpLastSegment();
            if (segment.isPresent()) {
                long id = segment.getAsLong() % (maxWorkerId + 1L);
                logger.info("Auto allocated WorkerId from IP: {} (last segment: {})", id, segment.getAsLong());
                return id;
            }
            OptionalLong mac = getMacAddress();
            if (mac.isPresent()) {
                long id = mac.getAsLong() % (maxWorkerId + 1L);
                logger.info("Auto allocated WorkerId from MAC: {} (MAC: {})", id, String.format("%012X", mac.getAsLong()));
                return id;
            }
        } catch (SocketException e) {
            logger.warn("Failed to inspect network interfaces: {}", e.toString());
        }

        long random = ThreadLocalRandom.current().nextLong(maxWorkerId + 1L);
        logger.warn("Using random WorkerId: {} (recommend setting a fixed value via {} or -D{})",
                random, ENV_KEY, PROP_KEY);
        return random;
    }

    /**
     * Resolves a worker identity of the given layout.
     *
     * <p>For V1 the 10-bit worker ID is split into data center ID (high 5 bits)
     * and machine ID (low 5 bits).</p>
     *
     * @param version the layout to produce
     * @return the identity
     */
    public static WorkerIdentity autoIdentity(SulidVersion version) {
        int workerId = (int) getAutoWorkerId(DefaultValue.MAX_WORKER_ID);
        if (version == SulidVersion.V1) {
            return WorkerIdentity.v1(workerId >>> DefaultValue.MACHINE_ID_BITS,
                    workerId & DefaultValue.MAX_MACHINE_ID);
        }
        return WorkerIdentity.v2(workerId);
    }

    static OptionalLong getConfiguredWorkerId(int maxWorkerId) {
        String value = System.getenv(ENV_KEY);
        if (value == null || value.trim().isEmpty()) {
            value = System.getProperty(PROP_KEY);
        }
        if (value == null || value.trim().isEmpty()) {
            return OptionalLong.empty();
        }

        try {
            long id = Long.parseLong(value.trim());
            if (id >= 0 && id <= maxWorkerId) {
                return OptionalLong.of(id);
            }
            logger.warn("Configured WorkerId {} is outside 0-{}, ignoring it", id, maxWorkerId);
        } catch (NumberFormatException e) {
            logger.warn("Configured WorkerId '{}' is not a number, ignoring it", value);
        }
        return OptionalLong.empty();
    }

    private static boolean configuredFromEnv() {
        String value = System.getenv(ENV_KEY);
        return value != null && !value.trim().isEmpty();
    }

    /** Last numeric segment of any non-loopback address */
    private static OptionalLong getIpLastSegment() throws SocketException {
        Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
        while (interfaces != null && interfaces.hasMoreElements()) {
            NetworkInterface ni = interfaces.nextElement();
            if (ni.isLoopback() || !ni.isUp()) continue;

            Enumeration<InetAddress> addresses = ni.getInetAddresses();
            while (addresses.hasMoreElements()) {
                InetAddress addr = addresses.nextElement();
                if (addr.isLoopbackAddress()) continue;

                // IPv4 last octet; IPv6 last group is hex
                String host = addr.getHostAddress();
                int zone = host.indexOf('%');
                if (zone >= 0) {
                    host = host.substring(0, zone);
                }
                int lastDot = host.lastIndexOf('.');
                int lastColon = host.lastIndexOf(':');
                try {
                    if (lastDot > 0) {
                        return OptionalLong.of(Integer.parseInt(host.substring(lastDot + 1)));
                    }
                    if (lastColon >= 0 && lastColon < host.length() - 1) {
                        return OptionalLong.of(Integer.parseInt(host.substring(lastColon + 1), 16));
                    }
                } catch (NumberFormatException e) {
                    logger.debug("Skipping address {}: {}", host, e.getMessage());
                }
            }
        }
        return OptionalLong.empty();
    }

    private static OptionalLong getMacAddress() throws SocketException {
        Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
        while (interfaces != null && interfaces.hasMoreElements()) {
            NetworkInterface ni = interfaces.nextElement();
            if (ni.isLoopback() || !ni.isUp() || ni.isVirtual() || ni.isPointToPoint()) continue;

            byte[] mac = ni.getHardwareAddress();
            if (mac != null && mac.length == 6) {
                long value = 0;
                for (byte b : mac) {
                    value = (value << 8) | (b & 0xFF);
                }
                return OptionalLong.of(value);
            }
        }
        return OptionalLong.empty();
    }
}
