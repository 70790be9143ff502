package com.questrail.framestream.api;

/**
 * FrameSource
 * -----------------------------------------------------------------------------
 * Port to the rendering engine that produces frames.
 *
 * <p>The renderer owns the decision of when a frame is produced. A registered
 * consumer is given a sampling target to fill; after each frame the renderer
 * calls {@link FrameConsumer#onFrame(FrameBuffer)} on the thread that drives
 * rendering. Calls are serialized and never reentrant.</p>
 */
public interface FrameSource
{
    /**
     * Register the active stream consumer.
     *
     * @param target buffer the renderer copies each produced frame into
     * @param consumer callback invoked after the target has been filled
     */
    void registerStreamConsumer(FrameBuffer target, FrameConsumer consumer);

    /**
     * Remove a previously registered consumer. Unknown consumers are ignored.
     */
    void unregisterStreamConsumer(FrameConsumer consumer);
}
