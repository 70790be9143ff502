package com.questrail.framestream.session;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameConsumer;
import com.questrail.framestream.api.FrameGeometryMismatchException;
import com.questrail.framestream.api.FrameSource;

import java.util.Objects;

/**
 * FrameStreamSession
 * =============================================================================
 * One sender streaming to one viewer.
 *
 * <p>The session owns the reference image, the connection and the mode
 * counters through its {@link FrameStreamEncoder}. All of them live exactly as
 * long as the session: {@link #close()} unregisters from the renderer, releases
 * the reference image and closes the connection.</p>
 *
 * <h2>Invocation contract</h2>
 * <p>The renderer drives the session from one thread, one call at a time.
 * A reentrant call or a call after {@link #close()} is rejected with
 * {@link IllegalStateException}.</p>
 */
public final class FrameStreamSession implements FrameConsumer, AutoCloseable
{
    private final FrameStreamEncoder encoder;
    private final FrameBuffer samplingTarget;
    private final FrameSource renderer;

    private boolean inCall = false;
    private boolean closed = false;

    FrameStreamSession(FrameStreamEncoder encoder, FrameSource renderer) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.samplingTarget = FrameBuffer.allocate(encoder.geometry());
        this.renderer = renderer;
    }

    void register() {
        if (renderer != null) {
            renderer.registerStreamConsumer(samplingTarget, this);
        }
    }

    /**
     * Stream one produced frame.
     *
     * @param pixels packed RGB of exactly the session geometry
     * @return the acknowledgment byte read this tick, 0 if none
     * @throws FrameGeometryMismatchException if {@code pixels} has the wrong size
     */
    public int onFrameProduced(byte[] pixels) {
        Objects.requireNonNull(pixels, "pixels");
        return tick(FrameBuffer.wrap(encoder.geometry(), pixels));
    }

    /**
     * Advance the connection and drain one acknowledgment without producing a frame.
     */
    public int pollOnly() {
        return tick(null);
    }

    @Override
    public int onFrame(FrameBuffer frame) {
        return tick(frame);
    }

    /**
     * Buffer the renderer fills before each {@link #onFrame(FrameBuffer)} call.
     */
    public FrameBuffer samplingTarget() {
        return samplingTarget;
    }

    public FrameStreamEncoder encoder() {
        return encoder;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (renderer != null) {
            renderer.unregisterStreamConsumer(this);
        }
        encoder.release();
        encoder.connection().close();
    }

    private int tick(FrameBuffer frame) {
        if (closed) {
            throw new IllegalStateException("session is closed");
        }
        if (inCall) {
            throw new IllegalStateException("reentrant encode call");
        }
        inCall = true;
        try {
            return encoder.encodeAndSend(frame);
        } finally {
            inCall = false;
        }
    }
}
