package com.questrail.framestream.transport;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for an outbound, connection-oriented byte transport (TCP-style).
 *
 * <p>This endpoint is intentionally small. {@link ConnectionManager} is
 * responsible for:</p>
 * <ul>
 *   <li>deciding when to connect and how long to back off</li>
 *   <li>dropping frames while disconnected</li>
 *   <li>turning inbound bytes into acknowledgments</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness. No
 * method may block longer than the bound it is given.</p>
 */
public interface StreamEndpoint
{
    /**
     * Attempt a single connection to {@code remote}, waiting at most {@code timeout}.
     * Any previous connection is closed first.
     *
     * @return whether the connection is established
     */
    boolean connect(InetSocketAddress remote, Duration timeout);

    /**
     * Whether the connection is currently usable.
     */
    boolean isConnected();

    /**
     * Write {@code payload} and wait at most {@code timeout} for it to be flushed.
     *
     * <p>On failure the endpoint closes the connection; the caller observes the
     * loss through {@link #isConnected()}.</p>
     *
     * @return whether the write completed
     */
    boolean send(byte[] payload, Duration timeout);

    /**
     * Non-blocking read of one received byte.
     *
     * @return the byte as 0..255, or -1 if nothing is available
     */
    int pollByte();

    /**
     * Close the connection and release all transport resources. The endpoint
     * cannot be reused afterwards.
     */
    void close();
}
