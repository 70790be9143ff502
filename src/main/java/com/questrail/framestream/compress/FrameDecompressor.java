package com.questrail.framestream.compress;

/**
 * Inverse of {@link FrameCompressor}, used on the viewer side.
 */
public interface FrameDecompressor
{
    /**
     * @return packed RGB pixels, exactly {@code width * height * 3} bytes
     * @throws CompressionException if the data cannot be decoded or its
     *         dimensions differ from the expected ones
     */
    byte[] decompress(byte[] data, int width, int height) throws CompressionException;
}
