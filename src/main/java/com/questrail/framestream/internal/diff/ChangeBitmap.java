package com.questrail.framestream.internal.diff;

import java.util.Arrays;

/**
 * ChangeBitmap
 * -----------------------------------------------------------------------------
 * One bit per block in row-major block order. Within each byte bits are filled
 * least-significant first; the byte index advances every 8 blocks.
 *
 * <p>The size is fixed at construction to {@code ceil(blockCount / 8)} bytes.</p>
 */
public final class ChangeBitmap
{
    private final int blockCount;
    private final byte[] bits;

    public ChangeBitmap(int blockCount) {
        if (blockCount <= 0) {
            throw new IllegalArgumentException("blockCount must be positive");
        }
        this.blockCount = blockCount;
        this.bits = new byte[(blockCount + 7) / 8];
    }

    /**
     * Wrap received bitmap bytes for a known block count.
     */
    public static ChangeBitmap fromBytes(int blockCount, byte[] bytes) {
        ChangeBitmap bitmap = new ChangeBitmap(blockCount);
        if (bytes.length != bitmap.bits.length) {
            throw new IllegalArgumentException(
                    "expected " + bitmap.bits.length + " bitmap bytes but got " + bytes.length);
        }
        System.arraycopy(bytes, 0, bitmap.bits, 0, bytes.length);
        return bitmap;
    }

    public void set(int block, boolean changed) {
        checkIndex(block);
        int mask = 1 << (block & 7);
        if (changed) {
            bits[block >>> 3] |= (byte) mask;
        } else {
            bits[block >>> 3] &= (byte) ~mask;
        }
    }

    public boolean isSet(int block) {
        checkIndex(block);
        return (bits[block >>> 3] & (1 << (block & 7))) != 0;
    }

    public int cardinality() {
        int count = 0;
        for (byte b : bits) {
            count += Integer.bitCount(b & 0xFF);
        }
        return count;
    }

    public int blockCount() {
        return blockCount;
    }

    public byte[] toByteArray() {
        return bits.clone();
    }

    private void checkIndex(int block) {
        if (block < 0 || block >= blockCount) {
            throw new IndexOutOfBoundsException("block " + block + " outside 0.." + (blockCount - 1));
        }
    }

    @Override
    public String toString() {
        return "ChangeBitmap[blocks=" + blockCount + ", set=" + cardinality() + ", bytes=" + Arrays.toString(bits) + "]";
    }
}
