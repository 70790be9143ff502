package com.questrail.framestream.api;

/**
 * FrameGeometry
 * -----------------------------------------------------------------------------
 * Fixed pixel geometry of a streaming session.
 *
 * <p>Frames are packed RGB, 3 bytes per pixel, row-major, with a row stride of
 * {@code width * 3}. Both dimensions must be multiples of {@link #BLOCK_SIZE} so
 * the frame partitions exactly into 8x8 blocks.</p>
 *
 * <p>All buffer sizes used by the encoder are derived from this record; no other
 * component is allowed to assume a resolution.</p>
 */
public record FrameGeometry(int width, int height) {

    public static final int BLOCK_SIZE = 8;
    public static final int BYTES_PER_PIXEL = 3;

    /**
     * Bytes occupied by one block: 8 rows of 8 RGB pixels, no padding.
     */
    public static final int BLOCK_BYTES = BLOCK_SIZE * BLOCK_SIZE * BYTES_PER_PIXEL;

    public FrameGeometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("geometry must be positive: " + width + "x" + height);
        }
        if (width % BLOCK_SIZE != 0 || height % BLOCK_SIZE != 0) {
            throw new IllegalArgumentException(
                    "geometry must be a multiple of " + BLOCK_SIZE + ": " + width + "x" + height);
        }
    }

    public int rowStride() {
        return width * BYTES_PER_PIXEL;
    }

    public int frameBytes() {
        return width * height * BYTES_PER_PIXEL;
    }

    public int blockColumns() {
        return width / BLOCK_SIZE;
    }

    public int blockRows() {
        return height / BLOCK_SIZE;
    }

    public int blockCount() {
        return blockColumns() * blockRows();
    }

    /**
     * Size of the change bitmap: one bit per block, rounded up to whole bytes.
     */
    public int bitmapBytes() {
        return (blockCount() + 7) / 8;
    }

    /**
     * Size of one checkerboard half-sample.
     */
    public int checkerSampleBytes() {
        return frameBytes() / 2;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
