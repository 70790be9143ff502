package com.questrail.framestream.session;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameGeometry;
import com.questrail.framestream.api.FrameGeometryMismatchException;
import com.questrail.framestream.codec.EncodedFrameEncoder;
import com.questrail.framestream.compress.CompressionException;
import com.questrail.framestream.compress.FrameCompressor;
import com.questrail.framestream.config.EncodingPolicy;
import com.questrail.framestream.internal.checker.CheckerboardSampler;
import com.questrail.framestream.internal.diff.BlockDiffResult;
import com.questrail.framestream.internal.diff.BlockDiffer;
import com.questrail.framestream.internal.diff.ReferenceFrame;
import com.questrail.framestream.internal.mode.ModeSelector;
import com.questrail.framestream.model.EncodedFrame;
import com.questrail.framestream.model.FrameMode;
import com.questrail.framestream.observability.FrameEncodedEvent;
import com.questrail.framestream.observability.StreamErrorEvent;
import com.questrail.framestream.observability.StreamObservabilitySink;
import com.questrail.framestream.transport.ConnectionManager;
import com.questrail.framestream.transport.ConnectionPhase;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * FrameStreamEncoder
 * =============================================================================
 * Per-tick pipeline of a streaming session.
 *
 * <pre>
 *   ConnectionManager.ensureConnected()
 *        → ModeSelector (forced mode, else BlockDiffer + classify)
 *            → payload (raw frame | diff blocks | checker sample | nothing)
 *                → FrameCompressor
 *                    → EncodedFrameEncoder
 *                        → ConnectionManager.send(...)
 *   return ConnectionManager.pollAck()
 * </pre>
 *
 * <h2>Acknowledgment policy</h2>
 * Every frame is encoded, whatever the acknowledgment says. The acknowledgment
 * is returned to the caller as advisory flow-control data only.
 *
 * <h2>Resynchronisation</h2>
 * The next frame is forced to FULL when:
 * <ul>
 *   <li>a payload could not be compressed or framed (the frame is dropped and
 *       the refresh counter is not advanced)</li>
 *   <li>a write to a connected transport failed</li>
 *   <li>a connection has just been established, since the viewer has no image</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Calls must be serialized by the owning session.</p>
 */
public final class FrameStreamEncoder
{
    private final FrameGeometry geometry;
    private final EncodingPolicy policy;
    private final ConnectionManager connection;
    private final FrameCompressor compressor;
    private final EncodedFrameEncoder wireEncoder;
    private final StreamObservabilitySink sink;

    private final ReferenceFrame reference;
    private final BlockDiffer differ;
    private final CheckerboardSampler sampler;
    private final ModeSelector selector;

    private FrameMode lastMode = null;

    public FrameStreamEncoder(FrameGeometry geometry,
                              EncodingPolicy policy,
                              ConnectionManager connection,
                              FrameCompressor compressor,
                              EncodedFrameEncoder wireEncoder,
                              StreamObservabilitySink sink) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.compressor = Objects.requireNonNull(compressor, "compressor");
        this.wireEncoder = Objects.requireNonNull(wireEncoder, "wireEncoder");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.reference = new ReferenceFrame(geometry);
        this.differ = new BlockDiffer(geometry, policy.blockThreshold());
        this.sampler = new CheckerboardSampler(geometry);
        this.selector = new ModeSelector(policy, geometry.blockCount());
    }

    /**
     * Run one tick.
     *
     * @param frame the produced frame, or {@code null} to only poll for an acknowledgment
     * @return the acknowledgment byte read this tick, 0 if none
     * @throws FrameGeometryMismatchException if the frame geometry is not the session's
     */
    public int encodeAndSend(FrameBuffer frame) {
        if (frame != null && !geometry.equals(frame.geometry())) {
            throw new FrameGeometryMismatchException(geometry,
                    "frame geometry " + frame.geometry() + " does not match session " + geometry);
        }

        ConnectionPhase before = connection.phase();
        connection.ensureConnected();
        if (before != ConnectionPhase.CONNECTED && connection.isConnected()) {
            selector.requestResync();
        }

        if (frame == null) {
            return connection.pollAck();
        }

        Optional<FrameMode> forced = selector.forcedMode(reference.isPopulated());
        BlockDiffResult diff = null;
        final FrameMode mode;
        if (forced.isPresent()) {
            mode = forced.get();
        } else {
            diff = differ.diff(frame, reference);
            mode = selector.classify(diff.changedCount());
        }

        final EncodedFrame encoded;
        try {
            encoded = build(mode, frame, diff);
        } catch (CompressionException e) {
            selector.requestResync();
            sink.onError(new StreamErrorEvent(Instant.now(), mode, e.getMessage(), e));
            return connection.pollAck();
        }

        selector.commit(mode);
        lastMode = mode;

        byte[] wire = wireEncoder.encode(encoded);
        boolean wasConnected = connection.isConnected();
        boolean delivered = connection.send(wire);
        if (wasConnected && !delivered) {
            selector.requestResync();
        }

        sink.onFrameEncoded(new FrameEncodedEvent(
                Instant.now(),
                mode,
                wire.length,
                (diff != null) ? diff.changedCount() : -1,
                selector.forcedRefreshCounter(),
                delivered));

        return connection.pollAck();
    }

    /**
     * Release the reference image. The encoder must not be used afterwards.
     */
    public void release() {
        reference.release();
    }

    public FrameGeometry geometry() {
        return geometry;
    }

    /**
     * Mode of the last frame that was built, or {@code null} before the first.
     */
    public FrameMode lastMode() {
        return lastMode;
    }

    public int forcedRefreshCounter() {
        return selector.forcedRefreshCounter();
    }

    public ReferenceFrame reference() {
        return reference;
    }

    public ConnectionManager connection() {
        return connection;
    }

    private EncodedFrame build(FrameMode mode, FrameBuffer frame, BlockDiffResult diff) throws CompressionException {
        switch (mode) {
            case NONE:
                return EncodedFrame.none();

            case FULL:
                reference.overwrite(frame);
                return new EncodedFrame(FrameMode.FULL, null,
                        compress(frame.pixels(), geometry.width(), geometry.height()));

            case DIFF:
                byte[] blocks = compress(diff.payload(),
                        FrameGeometry.BLOCK_SIZE, FrameGeometry.BLOCK_SIZE * diff.changedCount());
                return new EncodedFrame(FrameMode.DIFF, diff.bitmap().toByteArray(), blocks);

            case CHECKER:
            case CHECKER_COMPL:
                byte[] sample = sampler.sample(frame, mode.checkerPhase());
                return new EncodedFrame(mode, null,
                        compress(sample, sampler.sampleWidth(), sampler.sampleHeight()));

            default:
                throw new IllegalStateException("unhandled mode " + mode);
        }
    }

    private byte[] compress(byte[] rgb, int width, int height) throws CompressionException {
        byte[] out = compressor.compress(rgb, width, height, policy.quality());
        if (out == null || out.length == 0) {
            throw new CompressionException("codec produced no data for " + width + "x" + height);
        }
        if (out.length > EncodedFrame.MAX_PAYLOAD_LENGTH) {
            throw new CompressionException("compressed " + width + "x" + height + " payload of "
                    + out.length + " bytes exceeds the 16-bit length field");
        }
        return out;
    }
}
