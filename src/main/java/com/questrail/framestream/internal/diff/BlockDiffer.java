package com.questrail.framestream.internal.diff;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameGeometry;

import java.util.Arrays;
import java.util.Objects;

/**
 * BlockDiffer
 * -----------------------------------------------------------------------------
 * Compares a frame against the {@link ReferenceFrame} at 8x8 block granularity.
 *
 * <p>For each block, in row-major block order, the sum of per-channel absolute
 * differences is accumulated pixel by pixel and the comparison stops as soon as
 * the sum exceeds the threshold. A changed block is:</p>
 * <ol>
 *   <li>marked in the bitmap</li>
 *   <li>copied into the reference</li>
 *   <li>appended to the payload as 8 rows of 24 bytes</li>
 * </ol>
 *
 * <p>Unchanged blocks leave the reference untouched. The payload scratch buffer
 * is sized for every block being changed, so packing can never overrun it.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe; owned by a single session.</p>
 */
public final class BlockDiffer
{
    /**
     * Default threshold: an average per-channel delta of 1 over a whole block.
     */
    public static final int DEFAULT_THRESHOLD = FrameGeometry.BLOCK_BYTES;

    private static final int BLOCK_ROW_BYTES = FrameGeometry.BLOCK_SIZE * FrameGeometry.BYTES_PER_PIXEL;

    private final FrameGeometry geometry;
    private final int threshold;
    private final byte[] scratch;

    public BlockDiffer(FrameGeometry geometry) {
        this(geometry, DEFAULT_THRESHOLD);
    }

    public BlockDiffer(FrameGeometry geometry, int threshold) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative");
        }
        this.threshold = threshold;
        this.scratch = new byte[geometry.blockCount() * FrameGeometry.BLOCK_BYTES];
    }

    public BlockDiffResult diff(FrameBuffer current, ReferenceFrame reference) {
        Objects.requireNonNull(reference, "reference");
        reference.requireSameGeometry(current);

        final byte[] cur = current.pixels();
        final byte[] ref = reference.buffer();
        final int stride = geometry.rowStride();

        ChangeBitmap bitmap = new ChangeBitmap(geometry.blockCount());
        int changed = 0;
        int block = 0;

        for (int by = 0; by < geometry.blockRows(); by++) {
            for (int bx = 0; bx < geometry.blockColumns(); bx++, block++) {
                int origin = by * FrameGeometry.BLOCK_SIZE * stride + bx * BLOCK_ROW_BYTES;

                if (blockDiffers(cur, ref, origin, stride)) {
                    bitmap.set(block, true);
                    copyBlock(cur, ref, origin, stride);
                    packBlock(cur, origin, stride, changed * FrameGeometry.BLOCK_BYTES);
                    changed++;
                }
            }
        }

        byte[] payload = Arrays.copyOf(scratch, changed * FrameGeometry.BLOCK_BYTES);
        return new BlockDiffResult(bitmap, payload, changed);
    }

    private boolean blockDiffers(byte[] cur, byte[] ref, int origin, int stride) {
        int sum = 0;
        for (int row = 0; row < FrameGeometry.BLOCK_SIZE; row++) {
            int p = origin + row * stride;
            int end = p + BLOCK_ROW_BYTES;
            for (; p < end; p++) {
                sum += Math.abs((cur[p] & 0xFF) - (ref[p] & 0xFF));
                if (sum > threshold) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void copyBlock(byte[] src, byte[] dst, int origin, int stride) {
        for (int row = 0; row < FrameGeometry.BLOCK_SIZE; row++) {
            int p = origin + row * stride;
            System.arraycopy(src, p, dst, p, BLOCK_ROW_BYTES);
        }
    }

    private void packBlock(byte[] src, int origin, int stride, int out) {
        for (int row = 0; row < FrameGeometry.BLOCK_SIZE; row++) {
            System.arraycopy(src, origin + row * stride, scratch, out + row * BLOCK_ROW_BYTES, BLOCK_ROW_BYTES);
        }
    }
}
