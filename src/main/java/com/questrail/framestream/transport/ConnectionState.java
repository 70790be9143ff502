package com.questrail.framestream.transport;

/**
 * Immutable snapshot of {@link ConnectionManager} state.
 *
 * @param phase    current connection phase
 * @param cooldown ticks remaining before another connect attempt is allowed
 * @param lastAck  last acknowledgment byte read, 0 if none yet
 */
public record ConnectionState(ConnectionPhase phase, int cooldown, int lastAck) {
}
