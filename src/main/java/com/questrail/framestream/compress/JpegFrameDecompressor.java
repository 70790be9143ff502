package com.questrail.framestream.compress;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * JPEG implementation of {@link FrameDecompressor} backed by {@code javax.imageio}.
 */
public final class JpegFrameDecompressor implements FrameDecompressor
{
    @Override
    public byte[] decompress(byte[] data, int width, int height) throws CompressionException
    {
        Objects.requireNonNull(data, "data");

        final BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new CompressionException("JPEG decoding failed", e);
        }
        if (image == null) {
            throw new CompressionException("data is not a readable image");
        }
        if (image.getWidth() != width || image.getHeight() != height) {
            throw new CompressionException("decoded " + image.getWidth() + "x" + image.getHeight()
                    + " but expected " + width + "x" + height);
        }

        byte[] rgb = new byte[width * height * 3];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                rgb[i++] = (byte) (argb >>> 16);
                rgb[i++] = (byte) (argb >>> 8);
                rgb[i++] = (byte) argb;
            }
        }
        return rgb;
    }
}
