package com.questrail.framestream.codec;

import com.questrail.framestream.model.EncodedFrame;

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * EncodedFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for the stream wire format, used on the viewer side.
 */
public interface EncodedFrameDecoder
{
    /**
     * Decode exactly one frame.
     *
     * @param wire the bytes of a single frame, nothing more
     * @return the frame, or empty if the bytes are truncated, carry trailing
     *         data, or have an unknown mode tag
     */
    Optional<EncodedFrame> decode(byte[] wire);

    /**
     * Decode the next frame from a stream buffer.
     *
     * <p>On success the buffer position advances past the frame. If the buffer
     * does not yet hold a complete frame, the position is left untouched and
     * empty is returned.</p>
     *
     * @throws WireFormatException if the next bytes cannot start a valid frame;
     *         the stream is then out of sync and must be abandoned
     */
    Optional<EncodedFrame> decodeNext(ByteBuffer buffer);
}
