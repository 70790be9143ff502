package com.questrail.framestream.transport;

import com.questrail.framestream.config.StreamTimingPolicy;
import com.questrail.framestream.observability.ConnectionTransitionEvent;
import com.questrail.framestream.observability.StreamObservabilitySink;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * ConnectionManager
 * =============================================================================
 * Owns the outbound connection of one streaming session.
 *
 * <h2>Policy</h2>
 * <ul>
 *   <li><b>Lazy connect.</b> {@link #ensureConnected()} is called at the top of
 *       every tick. When disconnected with no cooldown left it makes one bounded
 *       connect attempt and re-arms the cooldown; otherwise it counts the
 *       cooldown down.</li>
 *   <li><b>Best effort send.</b> {@link #send(byte[])} writes only while
 *       connected. Frames are dropped, never queued or retried.</li>
 *   <li><b>Lazy loss detection.</b> A dropped connection is noticed on the next
 *       {@link #ensureConnected()}.</li>
 *   <li><b>Non-blocking acknowledgment.</b> {@link #pollAck()} never waits.</li>
 * </ul>
 *
 * <p>Connection failures are not errors to the caller. They are reported as
 * {@link ConnectionTransitionEvent}s on the observability sink.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe; driven by the single thread that drives the session.</p>
 */
public final class ConnectionManager
{
    /** Acknowledgment value reported when nothing was received. */
    public static final int NO_ACK = 0;

    private final StreamEndpoint endpoint;
    private final InetSocketAddress remote;
    private final StreamTimingPolicy timing;
    private final StreamObservabilitySink sink;

    private ConnectionPhase phase = ConnectionPhase.DISCONNECTED;
    private int cooldown = 0;
    private int lastAck = NO_ACK;
    private boolean closed = false;

    public ConnectionManager(StreamEndpoint endpoint,
                             InetSocketAddress remote,
                             StreamTimingPolicy timing,
                             StreamObservabilitySink sink) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Advance the connection state machine by one tick.
     */
    public void ensureConnected() {
        if (closed) {
            return;
        }

        if (endpoint.isConnected()) {
            if (phase != ConnectionPhase.CONNECTED) {
                transition(ConnectionPhase.CONNECTED, null);
            }
            return;
        }

        if (phase == ConnectionPhase.CONNECTED) {
            transition(ConnectionPhase.DISCONNECTED, "connection lost");
        }

        if (cooldown > 0) {
            cooldown--;
            return;
        }

        cooldown = timing.reconnectCooldownTicks();
        transition(ConnectionPhase.CONNECTING, null);

        boolean ok = endpoint.connect(remote, timing.connectTimeout());
        if (ok) {
            transition(ConnectionPhase.CONNECTED, null);
        } else {
            transition(ConnectionPhase.DISCONNECTED, "connect attempt failed");
        }
    }

    /**
     * Write one frame if connected.
     *
     * @return whether the bytes were written; {@code false} means the frame was dropped
     */
    public boolean send(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (closed || phase != ConnectionPhase.CONNECTED) {
            return false;
        }
        return endpoint.send(bytes, timing.writeTimeout());
    }

    /**
     * Read at most one acknowledgment byte without waiting.
     *
     * @return the byte (0..255), or {@link #NO_ACK} if none is available
     */
    public int pollAck() {
        if (closed) {
            return NO_ACK;
        }
        int b = endpoint.pollByte();
        if (b < 0) {
            return NO_ACK;
        }
        lastAck = b;
        return b;
    }

    /**
     * Close the connection. Further calls are no-ops.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        endpoint.close();
        if (phase != ConnectionPhase.DISCONNECTED) {
            transition(ConnectionPhase.DISCONNECTED, "session closed");
        }
    }

    public ConnectionPhase phase() {
        return phase;
    }

    public boolean isConnected() {
        return phase == ConnectionPhase.CONNECTED;
    }

    public ConnectionState state() {
        return new ConnectionState(phase, cooldown, lastAck);
    }

    public InetSocketAddress remote() {
        return remote;
    }

    private void transition(ConnectionPhase next, String reason) {
        ConnectionPhase previous = phase;
        phase = next;
        sink.onConnectionTransition(new ConnectionTransitionEvent(
                Instant.now(), remote, previous, next, reason));
    }
}
