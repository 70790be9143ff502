package com.questrail.framestream.compress;

/**
 * Lossy image codec port: packed RGB in, compressed bytes out.
 *
 * <p>The stream treats the codec as a black box. Implementations must not
 * retain the input array.</p>
 */
public interface FrameCompressor
{
    /**
     * @param rgb     packed RGB pixels, {@code width * height * 3} bytes
     * @param width   image width in pixels
     * @param height  image height in pixels
     * @param quality 1..100
     * @return compressed bytes
     * @throws CompressionException if the codec rejects the input
     */
    byte[] compress(byte[] rgb, int width, int height, int quality) throws CompressionException;
}
