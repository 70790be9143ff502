/**
 * Stream Wire Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the frame stream:
 * the mechanical translation between {@link com.questrail.framestream.model.EncodedFrame}
 * and bytes on the connection.</p>
 *
 * <h2>Wire layout</h2>
 * <pre>
 *   [ mode tag : u16 ][ payload length : u16 ][ change bitmap ][ payload ... ]
 * </pre>
 * <ul>
 *   <li>All integers are unsigned 16-bit <strong>little-endian</strong>.</li>
 *   <li>The length field and payload are absent for {@code NONE}.</li>
 *   <li>The bitmap is present only for {@code DIFF}; its length is not sent and
 *       is derived by both ends from the session geometry.</li>
 * </ul>
 *
 * <h2>Architectural placement</h2>
 * <pre>
 *   FrameStreamEncoder (mode + payload + compression)
 *        → EncodedFrame
 *            → EncodedFrameEncoder   (wire rules applied here)
 *                → ConnectionManager.send(byte[])
 * </pre>
 *
 * <p>The codec never compresses, never chooses modes, and never performs I/O.</p>
 */
package com.questrail.framestream.codec;
