package com.questrail.framestream.api;

/**
 * Callback the renderer invokes once per produced frame.
 */
@FunctionalInterface
public interface FrameConsumer
{
    /**
     * Consume a produced frame.
     *
     * @param frame the filled sampling target, or {@code null} when the renderer
     *              only wants to drain a pending acknowledgment
     * @return the most recent acknowledgment byte (0..255), 0 if none arrived
     */
    int onFrame(FrameBuffer frame);
}
