package com.questrail.framestream.model;

import java.util.Optional;

/**
 * Encoding strategy of a single streamed frame, with its wire tag.
 */
public enum FrameMode
{
    /** Nothing changed; only the tag is sent. */
    NONE(0),
    /** Entire frame, compressed. */
    FULL(1),
    /** Changed 8x8 blocks plus a change bitmap. */
    DIFF(2),
    /** Checkerboard half-sample, phase 0. */
    CHECKER(3),
    /** Complementary checkerboard half-sample, phase 1. */
    CHECKER_COMPL(4);

    private final int tag;

    FrameMode(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    public boolean carriesPayload() {
        return this != NONE;
    }

    /**
     * Checkerboard phase sampled by this mode.
     *
     * @throws IllegalStateException if this is not a checker mode
     */
    public int checkerPhase() {
        return switch (this) {
            case CHECKER -> 0;
            case CHECKER_COMPL -> 1;
            default -> throw new IllegalStateException(this + " has no checker phase");
        };
    }

    public static Optional<FrameMode> fromTag(int tag) {
        for (FrameMode mode : values()) {
            if (mode.tag == tag) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
