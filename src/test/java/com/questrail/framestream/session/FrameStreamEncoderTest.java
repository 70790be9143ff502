package com.questrail.framestream.session;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameGeometry;
import com.questrail.framestream.api.FrameGeometryMismatchException;
import com.questrail.framestream.api.TestFrames;
import com.questrail.framestream.codec.impl.DefaultEncodedFrameDecoder;
import com.questrail.framestream.codec.impl.DefaultEncodedFrameEncoder;
import com.questrail.framestream.compress.RecordingFrameCodec;
import com.questrail.framestream.config.EncodingPolicy;
import com.questrail.framestream.config.StreamTimingPolicy;
import com.questrail.framestream.model.EncodedFrame;
import com.questrail.framestream.model.FrameMode;
import com.questrail.framestream.observability.ConnectionTransitionEvent;
import com.questrail.framestream.observability.FrameEncodedEvent;
import com.questrail.framestream.observability.RecordingObservabilitySink;
import com.questrail.framestream.observability.StreamErrorEvent;
import com.questrail.framestream.transport.ConnectionManager;
import com.questrail.framestream.transport.ConnectionPhase;
import com.questrail.framestream.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FrameStreamEncoderTest
 * -----------------------------------------------------------------------------
 * End-to-end tick scenarios on a 240x320 session (1200 blocks) with a fake
 * transport and a token codec.
 */
class FrameStreamEncoderTest {

    private final FrameGeometry geometry = new FrameGeometry(240, 320);
    private final DefaultEncodedFrameDecoder decoder = new DefaultEncodedFrameDecoder(geometry);

    private FakeStreamEndpoint endpoint;
    private RecordingFrameCodec codec;
    private RecordingObservabilitySink sink;
    private FrameStreamEncoder encoder;

    @BeforeEach
    void setUp() {
        endpoint = new FakeStreamEndpoint(true);
        codec = RecordingFrameCodec.token();
        sink = new RecordingObservabilitySink();
        encoder = newEncoder(StreamTimingPolicy.defaults());
    }

    private FrameStreamEncoder newEncoder(StreamTimingPolicy timing) {
        ConnectionManager connection = new ConnectionManager(
                endpoint, new InetSocketAddress("127.0.0.1", 6543), timing, sink);
        return new FrameStreamEncoder(geometry, EncodingPolicy.defaults(), connection, codec,
                new DefaultEncodedFrameEncoder(), sink);
    }

    private FrameBuffer frame(byte[] pixels) {
        return FrameBuffer.wrap(geometry, pixels);
    }

    private EncodedFrame lastWireFrame() {
        return decoder.decode(endpoint.lastSent()).orElseThrow();
    }

    @Test
    void firstFrameIsFullAndPopulatesReference() {
        byte[] pixels = TestFrames.random(geometry, 1);

        encoder.encodeAndSend(frame(pixels));

        assertEquals(FrameMode.FULL, encoder.lastMode());
        assertEquals(0, encoder.forcedRefreshCounter());
        assertArrayEquals(pixels, encoder.reference().snapshot());
        assertEquals(FrameMode.FULL, lastWireFrame().mode());
        assertEquals(new RecordingFrameCodec.Call(240, 320, 70, geometry.frameBytes()), codec.lastCall());

        // connection transitions are reported before the frame they carried
        List<Object> events = sink.getAllEvents();
        assertEquals(3, events.size());
        assertEquals(ConnectionPhase.CONNECTING, ((ConnectionTransitionEvent) events.get(0)).newPhase());
        assertEquals(ConnectionPhase.CONNECTED, ((ConnectionTransitionEvent) events.get(1)).newPhase());
        FrameEncodedEvent encoded = (FrameEncodedEvent) events.get(2);
        assertEquals(FrameMode.FULL, encoded.mode());
        assertTrue(encoded.delivered());
        assertEquals(endpoint.lastSent().length, encoded.wireBytes());
    }

    @Test
    void identicalFrameSendsTagOnly() {
        byte[] pixels = TestFrames.random(geometry, 2);
        encoder.encodeAndSend(frame(pixels));
        int compressions = codec.calls().size();

        encoder.encodeAndSend(frame(pixels.clone()));

        assertEquals(FrameMode.NONE, encoder.lastMode());
        assertEquals(1, encoder.forcedRefreshCounter());
        assertArrayEquals(new byte[] { 0, 0 }, endpoint.lastSent());
        assertEquals(compressions, codec.calls().size());
    }

    @Test
    void halfTheBlocksChangedSendsCheckerThenComplement() {
        byte[] pixels = TestFrames.solid(geometry, 60);
        encoder.encodeAndSend(frame(pixels));

        byte[] next = pixels.clone();
        for (int block = 0; block < geometry.blockCount(); block += 2) {
            TestFrames.shiftBlock(geometry, next, block, 20);
        }

        encoder.encodeAndSend(frame(next));
        assertEquals(FrameMode.CHECKER, encoder.lastMode());
        assertEquals(FrameMode.CHECKER, lastWireFrame().mode());
        assertEquals(new RecordingFrameCodec.Call(120, 320, 70, geometry.checkerSampleBytes()), codec.lastCall());
        assertEquals(3, encoder.forcedRefreshCounter());

        // same frame again: the complement is unconditional
        encoder.encodeAndSend(frame(next));
        assertEquals(FrameMode.CHECKER_COMPL, encoder.lastMode());
        assertEquals(FrameMode.CHECKER_COMPL, lastWireFrame().mode());
        assertEquals(6, encoder.forcedRefreshCounter());
    }

    @Test
    void fewChangedBlocksSendDiffWithBitmap() {
        byte[] pixels = TestFrames.solid(geometry, 60);
        encoder.encodeAndSend(frame(pixels));

        byte[] next = pixels.clone();
        TestFrames.shiftBlock(geometry, next, 0, 30);
        TestFrames.shiftBlock(geometry, next, 9, 30);
        TestFrames.shiftBlock(geometry, next, 1199, 30);

        encoder.encodeAndSend(frame(next));

        assertEquals(FrameMode.DIFF, encoder.lastMode());
        assertEquals(5, encoder.forcedRefreshCounter());
        assertEquals(new RecordingFrameCodec.Call(8, 24, 70, 3 * FrameGeometry.BLOCK_BYTES), codec.lastCall());

        EncodedFrame wire = lastWireFrame();
        byte[] bitmap = wire.bitmap();
        assertEquals(150, bitmap.length);
        assertEquals(0x01, bitmap[0]);
        assertEquals(0x02, bitmap[1]);
        assertEquals((byte) 0x80, bitmap[149]);
        assertEquals(2 + 2 + 150 + 4, endpoint.lastSent().length);
    }

    @Test
    void periodicRefreshForcesFull() {
        byte[] pixels = TestFrames.random(geometry, 3);
        encoder.encodeAndSend(frame(pixels));

        for (int i = 0; i < 101; i++) {
            encoder.encodeAndSend(frame(pixels));
            assertEquals(FrameMode.NONE, encoder.lastMode());
        }

        encoder.encodeAndSend(frame(pixels));
        assertEquals(FrameMode.FULL, encoder.lastMode());
        assertEquals(0, encoder.forcedRefreshCounter());
    }

    @Test
    void compressionFailureDropsFrameAndForcesFull() {
        byte[] pixels = TestFrames.solid(geometry, 60);
        encoder.encodeAndSend(frame(pixels));
        encoder.encodeAndSend(frame(pixels));
        assertEquals(1, encoder.forcedRefreshCounter());
        int sentBefore = endpoint.sent().size();

        byte[] next = pixels.clone();
        TestFrames.shiftBlock(geometry, next, 4, 30);
        codec.failNext();
        encoder.encodeAndSend(frame(next));

        assertEquals(sentBefore, endpoint.sent().size());
        assertEquals(1, encoder.forcedRefreshCounter());
        assertTrue(sink.hasEventOfType(StreamErrorEvent.class));
        StreamErrorEvent error = sink.eventsOfType(StreamErrorEvent.class).get(0);
        assertEquals(FrameMode.DIFF, error.mode());

        encoder.encodeAndSend(frame(next));
        assertEquals(FrameMode.FULL, encoder.lastMode());
        assertEquals(FrameMode.FULL, lastWireFrame().mode());
    }

    @Test
    void mismatchedFrameIsRejectedWithoutSideEffects() {
        byte[] pixels = TestFrames.random(geometry, 4);
        encoder.encodeAndSend(frame(pixels));
        int sentBefore = endpoint.sent().size();

        FrameBuffer wrong = FrameBuffer.allocate(new FrameGeometry(320, 240));
        assertThrows(FrameGeometryMismatchException.class, () -> encoder.encodeAndSend(wrong));

        assertEquals(sentBefore, endpoint.sent().size());
        assertArrayEquals(pixels, encoder.reference().snapshot());
        assertEquals(0, encoder.forcedRefreshCounter());
    }

    @Test
    void pollWithoutFrameOnlyDrainsAcknowledgment() {
        endpoint.injectAck(9);

        int ack = encoder.encodeAndSend(null);

        assertEquals(9, ack);
        assertTrue(endpoint.sent().isEmpty());
        assertNull(encoder.lastMode());
        assertFalse(encoder.reference().isPopulated());
    }

    @Test
    void acknowledgmentIsReturnedAfterSending() {
        byte[] pixels = TestFrames.random(geometry, 5);
        endpoint.injectAck(1);

        assertEquals(1, encoder.encodeAndSend(frame(pixels)));
        assertEquals(0, encoder.encodeAndSend(frame(pixels)));
    }

    @Test
    void framesAreEncodedButDroppedWhileDisconnected() {
        endpoint.setAcceptConnections(false);
        byte[] pixels = TestFrames.random(geometry, 6);

        encoder.encodeAndSend(frame(pixels));
        encoder.encodeAndSend(frame(pixels));

        assertEquals(FrameMode.NONE, encoder.lastMode());
        assertTrue(endpoint.sent().isEmpty());
        FrameEncodedEvent last = sink.eventsOfType(FrameEncodedEvent.class).get(1);
        assertFalse(last.delivered());
        assertFalse(sink.hasEventOfType(StreamErrorEvent.class));
    }

    @Test
    void reconnectForcesFullSoViewerGetsAnImage() {
        endpoint.setAcceptConnections(false);
        encoder = newEncoder(new StreamTimingPolicy(Duration.ofMillis(10), Duration.ofMillis(10), 1));
        byte[] pixels = TestFrames.random(geometry, 7);

        encoder.encodeAndSend(frame(pixels));   // attempt fails, FULL dropped
        encoder.encodeAndSend(frame(pixels));   // cooldown, NONE dropped
        assertEquals(FrameMode.NONE, encoder.lastMode());

        endpoint.setAcceptConnections(true);
        encoder.encodeAndSend(frame(pixels));   // connects

        assertEquals(FrameMode.FULL, encoder.lastMode());
        assertEquals(1, endpoint.sent().size());
        assertEquals(FrameMode.FULL, lastWireFrame().mode());
    }

    @Test
    void failedWriteForcesFullOnNextFrame() {
        byte[] pixels = TestFrames.random(geometry, 8);
        encoder.encodeAndSend(frame(pixels));

        endpoint.setFailWrites(true);
        encoder.encodeAndSend(frame(pixels));
        endpoint.setFailWrites(false);
        endpoint.setAcceptConnections(false);

        encoder.encodeAndSend(frame(pixels));
        assertEquals(FrameMode.FULL, encoder.lastMode());
    }
}
