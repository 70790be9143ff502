package com.questrail.framestream.codec.impl;

/**
 * Constants and primitive helpers of the stream wire format.
 *
 * <p>Integers are unsigned 16-bit, least significant byte first.</p>
 */
final class WireFormat
{
    static final int TAG_BYTES = 2;
    static final int LENGTH_BYTES = 2;
    static final int HEADER_BYTES = TAG_BYTES + LENGTH_BYTES;

    private WireFormat() {
    }

    static void putU16(byte[] dst, int offset, int value)
    {
        dst[offset] = (byte) (value & 0xFF);
        dst[offset + 1] = (byte) ((value >>> 8) & 0xFF);
    }

    static int getU16(byte[] src, int offset)
    {
        return (src[offset] & 0xFF) | ((src[offset + 1] & 0xFF) << 8);
    }
}
