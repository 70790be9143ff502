package com.questrail.framestream.viewer;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameGeometry;
import com.questrail.framestream.api.TestFrames;
import com.questrail.framestream.codec.WireFormatException;
import com.questrail.framestream.codec.impl.DefaultEncodedFrameDecoder;
import com.questrail.framestream.codec.impl.DefaultEncodedFrameEncoder;
import com.questrail.framestream.compress.CompressionException;
import com.questrail.framestream.compress.RecordingFrameCodec;
import com.questrail.framestream.config.EncodingPolicy;
import com.questrail.framestream.config.StreamTimingPolicy;
import com.questrail.framestream.model.EncodedFrame;
import com.questrail.framestream.model.FrameMode;
import com.questrail.framestream.observability.NullObservabilitySink;
import com.questrail.framestream.session.FrameStreamEncoder;
import com.questrail.framestream.transport.ConnectionManager;
import com.questrail.framestream.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sender and viewer wired back to back through the wire codec, with a lossless
 * codec so images can be compared exactly.
 */
class FrameReconstructorTest {

    // 4 x 2 blocks
    private final FrameGeometry geometry = new FrameGeometry(32, 16);

    private FakeStreamEndpoint endpoint;
    private FrameStreamEncoder encoder;
    private DefaultEncodedFrameDecoder decoder;
    private FrameReconstructor viewer;

    @BeforeEach
    void setUp() {
        RecordingFrameCodec codec = RecordingFrameCodec.identity();
        endpoint = new FakeStreamEndpoint(true);
        ConnectionManager connection = new ConnectionManager(endpoint,
                new InetSocketAddress("127.0.0.1", 6543), StreamTimingPolicy.defaults(),
                NullObservabilitySink.INSTANCE);
        encoder = new FrameStreamEncoder(geometry, EncodingPolicy.defaults(), connection, codec,
                new DefaultEncodedFrameEncoder(), NullObservabilitySink.INSTANCE);
        decoder = new DefaultEncodedFrameDecoder(geometry);
        viewer = new FrameReconstructor(geometry, codec);
    }

    private FrameMode stream(byte[] pixels) throws CompressionException {
        encoder.encodeAndSend(FrameBuffer.wrap(geometry, pixels.clone()));
        EncodedFrame received = decoder.decode(endpoint.lastSent()).orElseThrow();
        viewer.apply(received);
        return received.mode();
    }

    @Test
    void fullFrameReplacesCanvas() throws CompressionException {
        byte[] pixels = TestFrames.random(geometry, 21);

        assertEquals(FrameMode.FULL, stream(pixels));
        assertArrayEquals(pixels, viewer.canvas());
    }

    @Test
    void diffUpdatesOnlyChangedBlocks() throws CompressionException {
        byte[] pixels = TestFrames.random(geometry, 22);
        stream(pixels);

        byte[] next = pixels.clone();
        TestFrames.shiftBlock(geometry, next, 2, 40);

        assertEquals(FrameMode.DIFF, stream(next));
        assertArrayEquals(next, viewer.canvas());
        assertArrayEquals(encoder.reference().snapshot(), viewer.canvas());
    }

    @Test
    void unchangedFrameLeavesCanvas() throws CompressionException {
        byte[] pixels = TestFrames.random(geometry, 23);
        stream(pixels);

        assertEquals(FrameMode.NONE, stream(pixels));
        assertArrayEquals(pixels, viewer.canvas());
    }

    @Test
    void checkerPairRebuildsWholeFrame() throws CompressionException {
        byte[] pixels = TestFrames.solid(geometry, 10);
        stream(pixels);

        byte[] next = TestFrames.random(geometry, 24);

        assertEquals(FrameMode.CHECKER, stream(next));
        byte[] half = viewer.canvas();
        assertNotEquals(0, countDifferences(half, next));
        assertArrayEquals(slice(next, 0, 0), slice(half, 0, 0));   // phase 0 pixel
        assertArrayEquals(slice(pixels, 1, 0), slice(half, 1, 0)); // phase 1 pixel untouched

        assertEquals(FrameMode.CHECKER_COMPL, stream(next));
        assertArrayEquals(next, viewer.canvas());
    }

    @Test
    void diffWithEmptyBitmapIsRejected() {
        EncodedFrame bogus = new EncodedFrame(FrameMode.DIFF, new byte[geometry.bitmapBytes()], new byte[] { 1 });

        assertThrows(WireFormatException.class, () -> viewer.apply(bogus));
    }

    private byte[] slice(byte[] pixels, int x, int y) {
        int p = y * geometry.rowStride() + x * FrameGeometry.BYTES_PER_PIXEL;
        return new byte[] { pixels[p], pixels[p + 1], pixels[p + 2] };
    }

    private static int countDifferences(byte[] a, byte[] b) {
        int n = 0;
        for (int i = 0; i < a.length; i++) {
            if (a[i] != b[i]) {
                n++;
            }
        }
        return n;
    }
}
