package com.questrail.framestream.observability;

import com.questrail.framestream.transport.ConnectionPhase;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing a connection phase change.
 *
 * @param reason diagnostic text; {@code null} for ordinary progress
 */
public record ConnectionTransitionEvent(
    Instant timestamp,
    InetSocketAddress remote,
    ConnectionPhase oldPhase,
    ConnectionPhase newPhase,
    String reason
) {
}
