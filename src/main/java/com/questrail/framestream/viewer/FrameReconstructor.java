package com.questrail.framestream.viewer;

import com.questrail.framestream.api.FrameGeometry;
import com.questrail.framestream.codec.WireFormatException;
import com.questrail.framestream.compress.CompressionException;
import com.questrail.framestream.compress.FrameDecompressor;
import com.questrail.framestream.internal.checker.CheckerboardSampler;
import com.questrail.framestream.internal.diff.ChangeBitmap;
import com.questrail.framestream.model.EncodedFrame;
import com.questrail.framestream.model.FrameMode;

import java.util.Objects;

/**
 * FrameReconstructor
 * -----------------------------------------------------------------------------
 * Viewer-side image state: applies received frames to a canvas.
 *
 * <ul>
 *   <li>FULL replaces the canvas.</li>
 *   <li>DIFF writes each received block to the position of the next set bit,
 *       in row-major block order.</li>
 *   <li>CHECKER / CHECKER_COMPL write the pixels of their phase only, so a pair
 *       rebuilds the whole frame.</li>
 *   <li>NONE leaves the canvas as is.</li>
 * </ul>
 */
public final class FrameReconstructor
{
    private static final int BLOCK_ROW_BYTES = FrameGeometry.BLOCK_SIZE * FrameGeometry.BYTES_PER_PIXEL;

    private final FrameGeometry geometry;
    private final FrameDecompressor decompressor;
    private final byte[] canvas;

    public FrameReconstructor(FrameGeometry geometry, FrameDecompressor decompressor) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.decompressor = Objects.requireNonNull(decompressor, "decompressor");
        this.canvas = new byte[geometry.frameBytes()];
    }

    /**
     * Apply one received frame.
     *
     * @throws CompressionException if the payload cannot be decoded
     * @throws WireFormatException if the bitmap does not fit the geometry
     */
    public void apply(EncodedFrame frame) throws CompressionException {
        Objects.requireNonNull(frame, "frame");
        switch (frame.mode()) {
            case NONE -> { }
            case FULL -> applyFull(frame);
            case DIFF -> applyDiff(frame);
            case CHECKER, CHECKER_COMPL -> applyChecker(frame);
        }
    }

    /**
     * Copy of the current image.
     */
    public byte[] canvas() {
        return canvas.clone();
    }

    private void applyFull(EncodedFrame frame) throws CompressionException {
        byte[] rgb = decompressor.decompress(frame.payload(), geometry.width(), geometry.height());
        System.arraycopy(rgb, 0, canvas, 0, canvas.length);
    }

    private void applyDiff(EncodedFrame frame) throws CompressionException {
        final ChangeBitmap bitmap;
        try {
            bitmap = ChangeBitmap.fromBytes(geometry.blockCount(), frame.bitmap());
        } catch (IllegalArgumentException e) {
            throw new WireFormatException(e.getMessage());
        }
        int changed = bitmap.cardinality();
        if (changed == 0) {
            throw new WireFormatException("DIFF frame with an empty bitmap");
        }

        byte[] blocks = decompressor.decompress(frame.payload(),
                FrameGeometry.BLOCK_SIZE, FrameGeometry.BLOCK_SIZE * changed);

        final int stride = geometry.rowStride();
        int next = 0;
        for (int block = 0; block < geometry.blockCount(); block++) {
            if (!bitmap.isSet(block)) {
                continue;
            }
            int bx = block % geometry.blockColumns();
            int by = block / geometry.blockColumns();
            int origin = by * FrameGeometry.BLOCK_SIZE * stride + bx * BLOCK_ROW_BYTES;
            int src = next * FrameGeometry.BLOCK_BYTES;
            for (int row = 0; row < FrameGeometry.BLOCK_SIZE; row++) {
                System.arraycopy(blocks, src + row * BLOCK_ROW_BYTES, canvas, origin + row * stride, BLOCK_ROW_BYTES);
            }
            next++;
        }
    }

    private void applyChecker(EncodedFrame frame) throws CompressionException {
        int phase = frame.mode().checkerPhase();
        byte[] sample = decompressor.decompress(frame.payload(), geometry.width() / 2, geometry.height());

        int src = 0;
        int dst = 0;
        for (int y = 0; y < geometry.height(); y++) {
            for (int x = 0; x < geometry.width(); x++) {
                if (CheckerboardSampler.isSampled(x, y, phase)) {
                    canvas[dst] = sample[src];
                    canvas[dst + 1] = sample[src + 1];
                    canvas[dst + 2] = sample[src + 2];
                    src += FrameGeometry.BYTES_PER_PIXEL;
                }
                dst += FrameGeometry.BYTES_PER_PIXEL;
            }
        }
    }
}
