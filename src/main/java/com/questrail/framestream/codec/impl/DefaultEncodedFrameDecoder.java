package com.questrail.framestream.codec.impl;

import com.questrail.framestream.api.FrameGeometry;
import com.questrail.framestream.codec.EncodedFrameDecoder;
import com.questrail.framestream.codec.WireFormatException;
import com.questrail.framestream.model.EncodedFrame;
import com.questrail.framestream.model.FrameMode;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultEncodedFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EncodedFrameDecoder}.
 *
 * <p>The change bitmap length is not carried on the wire, so the decoder is
 * bound to the session geometry.</p>
 */
public final class DefaultEncodedFrameDecoder implements EncodedFrameDecoder
{
    private final int bitmapLength;

    public DefaultEncodedFrameDecoder(FrameGeometry geometry)
    {
        this.bitmapLength = Objects.requireNonNull(geometry, "geometry").bitmapBytes();
    }

    @Override
    public Optional<EncodedFrame> decode(byte[] wire)
    {
        Objects.requireNonNull(wire, "wire");
        try {
            int length = frameLength(wire, 0, wire.length);
            if (length != wire.length) {
                // truncated (-1) or trailing bytes
                return Optional.empty();
            }
            return Optional.of(parse(wire, 0));
        }
        catch (WireFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public Optional<EncodedFrame> decodeNext(ByteBuffer buffer)
    {
        Objects.requireNonNull(buffer, "buffer");

        byte[] available = new byte[buffer.remaining()];
        buffer.duplicate().get(available);

        int length = frameLength(available, 0, available.length);
        if (length < 0) {
            return Optional.empty();
        }

        EncodedFrame frame = parse(available, 0);
        buffer.position(buffer.position() + length);
        return Optional.of(frame);
    }

    /**
     * Total encoded length of the frame starting at {@code offset}, or -1 if
     * {@code limit} does not yet cover it.
     */
    private int frameLength(byte[] src, int offset, int limit)
    {
        if (limit - offset < WireFormat.TAG_BYTES) {
            return -1;
        }
        FrameMode mode = modeAt(src, offset);
        if (!mode.carriesPayload()) {
            return WireFormat.TAG_BYTES;
        }
        if (limit - offset < WireFormat.HEADER_BYTES) {
            return -1;
        }
        int payloadLength = WireFormat.getU16(src, offset + WireFormat.TAG_BYTES);
        int total = WireFormat.HEADER_BYTES + bitmapLengthFor(mode) + payloadLength;
        return (limit - offset < total) ? -1 : total;
    }

    private EncodedFrame parse(byte[] src, int offset)
    {
        FrameMode mode = modeAt(src, offset);
        if (!mode.carriesPayload()) {
            return EncodedFrame.none();
        }

        int payloadLength = WireFormat.getU16(src, offset + WireFormat.TAG_BYTES);
        int bitmapStart = offset + WireFormat.HEADER_BYTES;
        int payloadStart = bitmapStart + bitmapLengthFor(mode);

        byte[] bitmap = (mode == FrameMode.DIFF)
                ? Arrays.copyOfRange(src, bitmapStart, payloadStart)
                : null;
        byte[] payload = Arrays.copyOfRange(src, payloadStart, payloadStart + payloadLength);

        return new EncodedFrame(mode, bitmap, payload);
    }

    private int bitmapLengthFor(FrameMode mode)
    {
        return (mode == FrameMode.DIFF) ? bitmapLength : 0;
    }

    private static FrameMode modeAt(byte[] src, int offset)
    {
        int tag = WireFormat.getU16(src, offset);
        return FrameMode.fromTag(tag)
                .orElseThrow(() -> new WireFormatException("unknown mode tag " + tag));
    }
}
