package com.questrail.framestream.internal.checker;

import com.questrail.framestream.api.FrameBuffer;
import com.questrail.framestream.api.FrameGeometry;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CheckerboardSamplerTest {

    private final FrameGeometry geometry = new FrameGeometry(24, 16);

    /**
     * Each pixel stores its own index in its three channels.
     */
    private FrameBuffer indexedFrame() {
        FrameBuffer frame = FrameBuffer.allocate(geometry);
        byte[] p = frame.pixels();
        for (int i = 0; i < geometry.width() * geometry.height(); i++) {
            p[i * 3] = (byte) (i >>> 16);
            p[i * 3 + 1] = (byte) (i >>> 8);
            p[i * 3 + 2] = (byte) i;
        }
        return frame;
    }

    private static Set<Integer> indices(byte[] sample) {
        Set<Integer> out = new HashSet<>();
        for (int i = 0; i < sample.length; i += 3) {
            out.add(((sample[i] & 0xFF) << 16) | ((sample[i + 1] & 0xFF) << 8) | (sample[i + 2] & 0xFF));
        }
        return out;
    }

    @Test
    void sampleIsHalfTheFrame() {
        CheckerboardSampler sampler = new CheckerboardSampler(geometry);

        assertEquals(geometry.checkerSampleBytes(), sampler.sample(indexedFrame(), 0).length);
        assertEquals(geometry.checkerSampleBytes(), sampler.sample(indexedFrame(), 1).length);
        assertEquals(12, sampler.sampleWidth());
        assertEquals(16, sampler.sampleHeight());
    }

    @Test
    void phasesAreDisjointAndCoverEveryPixelOnce() {
        CheckerboardSampler sampler = new CheckerboardSampler(geometry);
        FrameBuffer frame = indexedFrame();

        Set<Integer> even = indices(sampler.sample(frame, 0));
        Set<Integer> odd = indices(sampler.sample(frame, 1));

        int half = geometry.width() * geometry.height() / 2;
        assertEquals(half, even.size());
        assertEquals(half, odd.size());

        Set<Integer> overlap = new HashSet<>(even);
        overlap.retainAll(odd);
        assertTrue(overlap.isEmpty());

        Set<Integer> union = new HashSet<>(even);
        union.addAll(odd);
        assertEquals(geometry.width() * geometry.height(), union.size());
    }

    @Test
    void consecutiveRowsSampleComplementaryColumns() {
        CheckerboardSampler sampler = new CheckerboardSampler(geometry);
        byte[] sample = sampler.sample(indexedFrame(), 0);
        int w = geometry.width();

        // row 0 starts at column 0, row 1 at column 1
        assertEquals(0, sample[2] & 0xFF);
        assertEquals(2, sample[5] & 0xFF);
        int row1 = (w / 2) * 3;
        assertEquals(w + 1, sample[row1 + 2] & 0xFF);

        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < w; x++) {
                assertEquals(((x + y) & 1) == 0, CheckerboardSampler.isSampled(x, y, 0));
                assertNotEquals(CheckerboardSampler.isSampled(x, y, 0), CheckerboardSampler.isSampled(x, y, 1));
            }
        }
    }

    @Test
    void invalidPhaseIsRejected() {
        CheckerboardSampler sampler = new CheckerboardSampler(geometry);

        assertThrows(IllegalArgumentException.class, () -> sampler.sample(indexedFrame(), 2));
    }
}
