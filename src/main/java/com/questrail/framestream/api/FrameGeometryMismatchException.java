package com.questrail.framestream.api;

/**
 * Thrown when a caller supplies pixel data whose size or geometry disagrees with
 * the session's fixed geometry.
 *
 * <p>The frame is rejected before any encoder state is touched.</p>
 */
public final class FrameGeometryMismatchException extends RuntimeException
{
    private final FrameGeometry expected;

    public FrameGeometryMismatchException(FrameGeometry expected, String message) {
        super(message);
        this.expected = expected;
    }

    public FrameGeometry expected() {
        return expected;
    }
}
