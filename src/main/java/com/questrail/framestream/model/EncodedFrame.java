package com.questrail.framestream.model;

import java.util.Objects;

/**
 * EncodedFrame
 * -----------------------------------------------------------------------------
 * Immutable wire unit of the stream: a mode, an optional change bitmap and an
 * optional compressed payload.
 *
 * <p>Structural rules are enforced at construction:</p>
 * <ul>
 *   <li>{@link FrameMode#NONE} carries neither bitmap nor payload</li>
 *   <li>{@link FrameMode#DIFF} carries a non-empty bitmap</li>
 *   <li>other modes carry no bitmap</li>
 *   <li>the payload fits the 16-bit length field</li>
 * </ul>
 *
 * <p>Arrays are copied in and out.</p>
 */
public final class EncodedFrame
{
    public static final int MAX_PAYLOAD_LENGTH = 0xFFFF;

    private static final byte[] EMPTY = new byte[0];

    private final FrameMode mode;
    private final byte[] bitmap;
    private final byte[] payload;

    public EncodedFrame(FrameMode mode, byte[] bitmap, byte[] payload) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.bitmap = (bitmap == null) ? EMPTY : bitmap.clone();
        this.payload = (payload == null) ? EMPTY : payload.clone();

        if (mode == FrameMode.NONE && (this.bitmap.length > 0 || this.payload.length > 0)) {
            throw new IllegalArgumentException("NONE frames carry no data");
        }
        if (mode == FrameMode.DIFF && this.bitmap.length == 0) {
            throw new IllegalArgumentException("DIFF frames require a change bitmap");
        }
        if (mode != FrameMode.DIFF && this.bitmap.length > 0) {
            throw new IllegalArgumentException(mode + " frames carry no change bitmap");
        }
        if (this.payload.length > MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(
                    "payload of " + this.payload.length + " bytes exceeds " + MAX_PAYLOAD_LENGTH);
        }
    }

    public static EncodedFrame none() {
        return new EncodedFrame(FrameMode.NONE, null, null);
    }

    public FrameMode mode() {
        return mode;
    }

    public byte[] bitmap() {
        return bitmap.clone();
    }

    public byte[] payload() {
        return payload.clone();
    }

    public int bitmapLength() {
        return bitmap.length;
    }

    public int payloadLength() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "EncodedFrame[" +
                "mode=" + mode +
                ", bitmapLength=" + bitmap.length +
                ", payloadLength=" + payload.length +
                ']';
    }
}
