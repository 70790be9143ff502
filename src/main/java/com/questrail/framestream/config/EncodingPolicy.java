package com.questrail.framestream.config;

import com.questrail.framestream.api.FrameGeometry;

/**
 * EncodingPolicy
 * -----------------------------------------------------------------------------
 * Tuning of the per-frame mode decision and of compression.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>forcedRefreshThreshold</b>: a FULL frame is forced once the refresh
 *       counter exceeds this value.</li>
 *   <li><b>noneIncrement</b>, <b>diffIncrement</b>, <b>checkerIncrement</b>:
 *       amount added to the refresh counter after a NONE, DIFF or checker frame.
 *       FULL resets the counter to zero.</li>
 *   <li><b>checkerDivisor</b>: CHECKER is chosen when more than
 *       {@code totalBlocks / checkerDivisor} blocks changed.</li>
 *   <li><b>blockThreshold</b>: sum of absolute channel differences above which
 *       a block counts as changed.</li>
 *   <li><b>quality</b>: lossy compression quality, 1..100.</li>
 * </ul>
 */
public record EncodingPolicy(
        int forcedRefreshThreshold,
        int noneIncrement,
        int diffIncrement,
        int checkerIncrement,
        int checkerDivisor,
        int blockThreshold,
        int quality
) {
    public EncodingPolicy {
        if (forcedRefreshThreshold < 0) {
            throw new IllegalArgumentException("forcedRefreshThreshold must be non-negative");
        }
        if (noneIncrement < 0 || diffIncrement < 0 || checkerIncrement < 0) {
            throw new IllegalArgumentException("refresh increments must be non-negative");
        }
        if (checkerDivisor <= 0) {
            throw new IllegalArgumentException("checkerDivisor must be positive");
        }
        if (blockThreshold < 0) {
            throw new IllegalArgumentException("blockThreshold must be non-negative");
        }
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be within 1..100: " + quality);
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>forcedRefreshThreshold: 100</li>
     *   <li>increments: NONE 1, DIFF 5, checker 3</li>
     *   <li>checkerDivisor: 3</li>
     *   <li>blockThreshold: 8 * 8 * 3</li>
     *   <li>quality: 70</li>
     * </ul>
     */
    public static EncodingPolicy defaults() {
        return new EncodingPolicy(100, 1, 5, 3, 3, FrameGeometry.BLOCK_BYTES, 70);
    }

    public EncodingPolicy withQuality(int quality) {
        return new EncodingPolicy(forcedRefreshThreshold, noneIncrement, diffIncrement,
                checkerIncrement, checkerDivisor, blockThreshold, quality);
    }
}
