package com.questrail.framestream.codec;

import com.questrail.framestream.model.EncodedFrame;

/**
 * EncodedFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for the stream wire format.
 *
 * <p>This interface is the outbound boundary between a structured
 * {@link EncodedFrame} and raw transport bytes. It does NOT choose a mode and
 * does NOT compress; it only lays out tag, length, bitmap and payload.</p>
 */
public interface EncodedFrameEncoder
{
    /**
     * Encode a frame into bytes ready to be written to the connection as one unit.
     */
    byte[] encode(EncodedFrame frame);
}
