package com.questrail.framestream.api;

import java.util.Objects;

/**
 * FrameBuffer
 * -----------------------------------------------------------------------------
 * A raw RGB pixel grid of fixed geometry.
 *
 * <p>The backing array is shared, not copied: the renderer writes into it and
 * the encoder reads from it for the duration of a single encode call. The
 * encoder never retains a reference beyond that call.</p>
 */
public final class FrameBuffer
{
    private final FrameGeometry geometry;
    private final byte[] pixels;

    private FrameBuffer(FrameGeometry geometry, byte[] pixels) {
        this.geometry = geometry;
        this.pixels = pixels;
    }

    /**
     * Allocate a zero-filled buffer for the given geometry.
     */
    public static FrameBuffer allocate(FrameGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        return new FrameBuffer(geometry, new byte[geometry.frameBytes()]);
    }

    /**
     * Wrap existing pixel data.
     *
     * @throws FrameGeometryMismatchException if the array length is not
     *         exactly {@code geometry.frameBytes()}
     */
    public static FrameBuffer wrap(FrameGeometry geometry, byte[] pixels) {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(pixels, "pixels");
        if (pixels.length != geometry.frameBytes()) {
            throw new FrameGeometryMismatchException(geometry,
                    "expected " + geometry.frameBytes() + " bytes for " + geometry
                            + " but got " + pixels.length);
        }
        return new FrameBuffer(geometry, pixels);
    }

    public FrameGeometry geometry() {
        return geometry;
    }

    /**
     * Returns the backing pixel array (not a copy).
     */
    public byte[] pixels() {
        return pixels;
    }

    @Override
    public String toString() {
        return "FrameBuffer[" + geometry + "]";
    }
}
