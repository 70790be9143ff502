package com.questrail.framestream.codec.impl;

import com.questrail.framestream.codec.EncodedFrameEncoder;
import com.questrail.framestream.model.EncodedFrame;
import com.questrail.framestream.model.FrameMode;

import java.util.Objects;

/**
 * DefaultEncodedFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EncodedFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultEncodedFrameDecoder}. The
 * {@link EncodedFrame} constructor has already enforced the structural rules, so
 * encoding cannot fail.</p>
 */
public final class DefaultEncodedFrameEncoder implements EncodedFrameEncoder
{
    @Override
    public byte[] encode(EncodedFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final FrameMode mode = frame.mode();

        if (!mode.carriesPayload()) {
            byte[] tagOnly = new byte[WireFormat.TAG_BYTES];
            WireFormat.putU16(tagOnly, 0, mode.tag());
            return tagOnly;
        }

        final byte[] bitmap = frame.bitmap();
        final byte[] payload = frame.payload();

        // [ tag ][ length ][ bitmap (DIFF only) ][ payload ]
        byte[] out = new byte[WireFormat.HEADER_BYTES + bitmap.length + payload.length];
        WireFormat.putU16(out, 0, mode.tag());
        WireFormat.putU16(out, WireFormat.TAG_BYTES, payload.length);
        System.arraycopy(bitmap, 0, out, WireFormat.HEADER_BYTES, bitmap.length);
        System.arraycopy(payload, 0, out, WireFormat.HEADER_BYTES + bitmap.length, payload.length);
        return out;
    }
}
