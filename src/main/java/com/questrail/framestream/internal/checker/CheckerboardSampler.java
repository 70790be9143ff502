package com.questrail.framestream.internal.checker;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameGeometry;
import com.questrail.framestream.api.FrameGeometryMismatchException;

import java.util.Objects;

/**
 * Produces half-density checkerboard samples of a frame.
 *
 * <p>Within a row a toggle starts at the row's phase and flips after every
 * pixel; a pixel is taken while the toggle is 0. The row phase flips at the end
 * of every row, so consecutive rows take complementary columns. Phase 0 and
 * phase 1 of the same frame are disjoint and together cover every pixel once.</p>
 *
 * <p>The sample is {@code width * height * 3 / 2} bytes, packed without gaps,
 * and is read as an image of {@code width / 2} by {@code height}.</p>
 */
public final class CheckerboardSampler
{
    private final FrameGeometry geometry;

    public CheckerboardSampler(FrameGeometry geometry) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
    }

    public byte[] sample(FrameBuffer frame, int phase) {
        Objects.requireNonNull(frame, "frame");
        if (!geometry.equals(frame.geometry())) {
            throw new FrameGeometryMismatchException(geometry,
                    "frame geometry " + frame.geometry() + " does not match sampler " + geometry);
        }
        if (phase != 0 && phase != 1) {
            throw new IllegalArgumentException("phase must be 0 or 1: " + phase);
        }

        final byte[] in = frame.pixels();
        final byte[] out = new byte[geometry.checkerSampleBytes()];

        int skip = phase;
        int src = 0;
        int dst = 0;
        for (int y = 0; y < geometry.height(); y++) {
            for (int x = 0; x < geometry.width(); x++) {
                if (skip == 0) {
                    out[dst] = in[src];
                    out[dst + 1] = in[src + 1];
                    out[dst + 2] = in[src + 2];
                    dst += FrameGeometry.BYTES_PER_PIXEL;
                }
                src += FrameGeometry.BYTES_PER_PIXEL;
                skip ^= 1;
            }
            // width is even, so the toggle is back at the row phase here
            skip ^= 1;
        }
        return out;
    }

    /**
     * Width of the image the sample is compressed as.
     */
    public int sampleWidth() {
        return geometry.width() / 2;
    }

    public int sampleHeight() {
        return geometry.height();
    }

    /**
     * Whether the pixel at (x, y) belongs to the given phase.
     */
    public static boolean isSampled(int x, int y, int phase) {
        return ((x + y + phase) & 1) == 0;
    }
}
