package com.questrail.framestream.config;

import java.time.Duration;
import java.util.Objects;

/**
 * StreamTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing of the connection.
 *
 * <p>No operation blocks indefinitely: connects and write flushes are bounded
 * by these durations, and acknowledgment reads never wait.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: bound on a single connect attempt.</li>
 *   <li><b>writeTimeout</b>: bound on flushing one frame.</li>
 *   <li><b>reconnectCooldownTicks</b>: number of encode calls to wait after a
 *       connect attempt before the next one. One tick is one produced frame.</li>
 * </ul>
 */
public record StreamTimingPolicy(
        Duration connectTimeout,
        Duration writeTimeout,
        int reconnectCooldownTicks
) {
    public StreamTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (writeTimeout.isNegative() || writeTimeout.isZero()) {
            throw new IllegalArgumentException("writeTimeout must be positive");
        }
        if (reconnectCooldownTicks < 0) {
            throw new IllegalArgumentException("reconnectCooldownTicks must be non-negative");
        }
    }

    /**
     * Defaults: 1000ms connect, 1000ms write, 300 ticks between connect attempts.
     */
    public static StreamTimingPolicy defaults() {
        return new StreamTimingPolicy(Duration.ofMillis(1000), Duration.ofMillis(1000), 300);
    }
}
