package com.questrail.framestream.internal.diff;

import java.util.Objects;

/**
 * Outcome of one {@link BlockDiffer#diff} pass.
 *
 * @param bitmap       one bit per block, set for blocks that changed
 * @param payload      packed pixel data of the changed blocks in detection order,
 *                     exactly {@code changedCount * BLOCK_BYTES} bytes
 * @param changedCount number of changed blocks
 */
public record BlockDiffResult(ChangeBitmap bitmap, byte[] payload, int changedCount) {

    public BlockDiffResult {
        Objects.requireNonNull(bitmap, "bitmap");
        Objects.requireNonNull(payload, "payload");
        if (changedCount < 0 || changedCount > bitmap.blockCount()) {
            throw new IllegalArgumentException("changedCount out of range: " + changedCount);
        }
    }
}
