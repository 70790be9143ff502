package com.questrail.framestream.internal.mode;

import com.questrail.framestream.config.EncodingPolicy;
import com.questrail.framestream.model.FrameMode;

import java.util.Objects;
import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * ModeSelector
 * =============================================================================
 * Per-frame state machine choosing among {@link FrameMode} values.
 *
 * <h2>Decision order</h2>
 * <ol>
 *   <li>No reference yet, or a resync was requested by {@link #requestResync()}: FULL.</li>
 *   <li>Refresh counter above the threshold: FULL. A pending CHECKER_COMPL is
 *       skipped; the full frame supersedes the half image.</li>
 *   <li>Previous frame was CHECKER: CHECKER_COMPL.</li>
 *   <li>Otherwise classify by changed block count: more than
 *       {@code totalBlocks / divisor} is CHECKER, any is DIFF, none is NONE.</li>
 * </ol>
 *
 * <h2>Two-step use</h2>
 * <p>{@link #forcedMode(boolean)} answers steps 1-3 without touching the frame.
 * Only when it is empty does the caller run the block differ and call
 * {@link #classify(int)}. Counter effects are applied by {@link #commit(FrameMode)}
 * once the frame has been built. A frame that is dropped is never committed;
 * {@link #requestResync()} is called instead.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe; owned by a single session.</p>
 */
public final class ModeSelector
{
    private final EncodingPolicy policy;
    private final int totalBlocks;

    private int forcedRefreshCounter = 0;
    private FrameMode previousMode = FrameMode.FULL;
    private boolean resyncRequested = true;

    public ModeSelector(EncodingPolicy policy, int totalBlocks) {
        this.policy = Objects.requireNonNull(policy, "policy");
        if (totalBlocks <= 0) {
            throw new IllegalArgumentException("totalBlocks must be positive");
        }
        this.totalBlocks = totalBlocks;
    }

    /**
     * The mode the frame must use regardless of its content, if any.
     *
     * @param referencePopulated whether a reference image exists
     */
    public Optional<FrameMode> forcedMode(boolean referencePopulated) {
        if (!referencePopulated || resyncRequested) {
            return Optional.of(FrameMode.FULL);
        }
        if (forcedRefreshCounter > policy.forcedRefreshThreshold()) {
            return Optional.of(FrameMode.FULL);
        }
        if (previousMode == FrameMode.CHECKER) {
            return Optional.of(FrameMode.CHECKER_COMPL);
        }
        return Optional.empty();
    }

    /**
     * Content-driven mode for a frame with {@code changedBlocks} changed blocks.
     */
    public FrameMode classify(int changedBlocks) {
        if (changedBlocks < 0 || changedBlocks > totalBlocks) {
            throw new IllegalArgumentException("changedBlocks out of range: " + changedBlocks);
        }
        if (changedBlocks > totalBlocks / policy.checkerDivisor()) {
            return FrameMode.CHECKER;
        }
        return (changedBlocks > 0) ? FrameMode.DIFF : FrameMode.NONE;
    }

    /**
     * Convenience combining {@link #forcedMode(boolean)} and {@link #classify(int)}.
     * The supplier is consulted only when no mode is forced.
     */
    public FrameMode select(boolean referencePopulated, IntSupplier changedBlocks) {
        return forcedMode(referencePopulated)
                .orElseGet(() -> classify(changedBlocks.getAsInt()));
    }

    /**
     * Apply the counter effects of a frame that was built successfully.
     */
    public void commit(FrameMode mode) {
        Objects.requireNonNull(mode, "mode");
        switch (mode) {
            case FULL -> {
                forcedRefreshCounter = 0;
                resyncRequested = false;
            }
            case NONE -> forcedRefreshCounter += policy.noneIncrement();
            case DIFF -> forcedRefreshCounter += policy.diffIncrement();
            case CHECKER, CHECKER_COMPL -> forcedRefreshCounter += policy.checkerIncrement();
        }
        previousMode = mode;
    }

    /**
     * Force the next frame to FULL, leaving the counter as is. Used when a frame
     * was dropped or the viewer may have lost its image.
     */
    public void requestResync() {
        resyncRequested = true;
    }

    public int forcedRefreshCounter() {
        return forcedRefreshCounter;
    }

    public FrameMode previousMode() {
        return previousMode;
    }

    public boolean isResyncRequested() {
        return resyncRequested;
    }

    // Test/diagnostic seam for driving the selector into a given state.
    void restore(int forcedRefreshCounter, FrameMode previousMode) {
        this.forcedRefreshCounter = forcedRefreshCounter;
        this.previousMode = Objects.requireNonNull(previousMode, "previousMode");
        this.resyncRequested = false;
    }
}
