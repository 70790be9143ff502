package com.questrail.framestream.internal.diff;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameGeometry;
import com.questrail.framestream.api.FrameGeometryMismatchException;

import java.util.Objects;

/**
 * ReferenceFrame
 * -----------------------------------------------------------------------------
 * The last-transmitted image, used as the baseline for block differencing.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Unallocated until the first frame of the session is seen.</li>
 *   <li>{@link #overwrite(FrameBuffer)} allocates on first use and copies the
 *       whole frame (FULL mode).</li>
 *   <li>{@link BlockDiffer} updates it one block at a time.</li>
 *   <li>{@link #release()} drops the buffer when the session ends.</li>
 * </ul>
 *
 * <p>The geometry is fixed for the lifetime of the instance.</p>
 */
public final class ReferenceFrame
{
    private final FrameGeometry geometry;
    private byte[] pixels;

    public ReferenceFrame(FrameGeometry geometry) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
    }

    public FrameGeometry geometry() {
        return geometry;
    }

    public boolean isPopulated() {
        return pixels != null;
    }

    /**
     * Replace the whole reference with {@code frame}.
     */
    public void overwrite(FrameBuffer frame) {
        requireSameGeometry(frame);
        if (pixels == null) {
            pixels = new byte[geometry.frameBytes()];
        }
        System.arraycopy(frame.pixels(), 0, pixels, 0, pixels.length);
    }

    /**
     * Copy of the current reference pixels.
     *
     * @throws IllegalStateException if the reference has not been populated
     */
    public byte[] snapshot() {
        return buffer().clone();
    }

    public void release() {
        pixels = null;
    }

    byte[] buffer() {
        if (pixels == null) {
            throw new IllegalStateException("reference frame not populated");
        }
        return pixels;
    }

    void requireSameGeometry(FrameBuffer frame) {
        Objects.requireNonNull(frame, "frame");
        if (!geometry.equals(frame.geometry())) {
            throw new FrameGeometryMismatchException(geometry,
                    "frame geometry " + frame.geometry() + " does not match reference " + geometry);
        }
    }
}
