/**
 * Frame Stream Transport
 * =============================================================================
 *
 * <p>{@link com.questrail.framestream.transport.StreamEndpoint} is the
 * <em>framework-agnostic transport boundary</em> between a concrete networking
 * implementation (Netty TCP, a test double) and the streaming session.</p>
 *
 * <p>Everything above the endpoint sees only:</p>
 * <ul>
 *   <li>Outbound frames as {@code byte[]}</li>
 *   <li>Inbound acknowledgments as single bytes</li>
 *   <li>A connected/disconnected flag</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Endpoint implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decide when to reconnect</li>
 *   <li>Not queue or retry frames</li>
 *   <li>Bound every wait by the duration they are given</li>
 * </ul>
 *
 * <p>Reconnect cooldown and drop-on-disconnect live in
 * {@link com.questrail.framestream.transport.ConnectionManager}.</p>
 */
package com.questrail.framestream.transport;
