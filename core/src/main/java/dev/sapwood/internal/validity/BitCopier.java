/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.validity;

import java.util.Objects;

import dev.sapwood.memory.MemoryBuffer;

/**
 * Copies runs of validity bits between bitmaps at arbitrary bit offsets.
 * <p>
 * After {@link #copy} returns, bit {@code dstOffset + k} of the destination equals bit
 * {@code srcOffset + k} of the source for every {@code k < length}. Destination bits
 * outside that range keep their previous value: partial bytes at either end of the range
 * are merged into the existing destination byte instead of being overwritten.
 * </p>
 * <p>
 * Only the source bytes holding bits of {@code [srcOffset, srcOffset + length)} are read,
 * and only the destination bytes holding bits of {@code [dstOffset, dstOffset + length)}
 * are written, so both bitmaps may be sized exactly to the bits they hold.
 * </p>
 */
public final class BitCopier {

    private BitCopier() {
    }

    /**
     * Copy {@code length} bits from {@code src} starting at bit {@code srcOffset} into
     * {@code dst} starting at bit {@code dstOffset}.
     *
     * @return the number of null (zero) bits in the copied range
     * @throws IndexOutOfBoundsException if either range exceeds its bitmap; nothing is
     *         written in that case
     */
    public static int copy(MemoryBuffer src, long srcOffset, MemoryBuffer dst, long dstOffset, int length) {
        Objects.checkFromIndexSize(srcOffset, length, src.length() * 8L);
        Objects.checkFromIndexSize(dstOffset, length, dst.length() * 8L);
        if (length == 0) {
            return 0;
        }

        if (((srcOffset ^ dstOffset) & 7) == 0) {
            copyAligned(src, srcOffset, dst, dstOffset, length);
        }
        else {
            copyShifted(src, srcOffset, dst, dstOffset, length);
        }
        return ValidityBitmap.countZeroBits(src, srcOffset, srcOffset + length);
    }

    /**
     * Source and destination share the same position within a byte: whole bytes move
     * directly, only the first and last byte need masking.
     */
    private static void copyAligned(MemoryBuffer src, long srcOffset, MemoryBuffer dst, long dstOffset, int length) {
        long end = dstOffset + length;
        int dstByte = Math.toIntExact(dstOffset >>> 3);
        int srcByte = Math.toIntExact(srcOffset >>> 3);
        int lastDstByte = Math.toIntExact((end - 1) >>> 3);
        int head = (int) (dstOffset & 7);
        int tail = (int) (end & 7);

        if (dstByte == lastDstByte) {
            int mask = rangeMask(head, tail == 0 ? 8 : tail);
            merge(dst, dstByte, src.getByte(srcByte), mask);
            return;
        }

        if (head != 0) {
            merge(dst, dstByte++, src.getByte(srcByte++), 0xFF << head);
        }

        int fullBytes = (tail == 0 ? lastDstByte + 1 : lastDstByte) - dstByte;
        if (fullBytes > 0) {
            dst.copyFrom(dstByte, src, srcByte, fullBytes);
            dstByte += fullBytes;
            srcByte += fullBytes;
        }

        if (tail != 0) {
            merge(dst, dstByte, src.getByte(srcByte), (1 << tail) - 1);
        }
    }

    /**
     * General case: every destination byte is assembled from the two source bytes that
     * straddle it, shifted into place, then merged under the mask of bits being updated.
     */
    private static void copyShifted(MemoryBuffer src, long srcOffset, MemoryBuffer dst, long dstOffset, int length) {
        long end = dstOffset + length;
        int firstDstByte = Math.toIntExact(dstOffset >>> 3);
        int lastDstByte = Math.toIntExact((end - 1) >>> 3);
        long firstSrcByte = srcOffset >>> 3;
        long lastSrcByte = (srcOffset + length - 1) >>> 3;

        for (int b = firstDstByte; b <= lastDstByte; b++) {
            long byteStart = (long) b << 3;
            int lo = (int) (Math.max(dstOffset, byteStart) - byteStart);
            int hi = (int) (Math.min(end, byteStart + 8) - byteStart);

            // source bit that lines up with bit 0 of this destination byte; negative for the first byte
            long aligned = srcOffset + byteStart - dstOffset;
            long srcByte = Math.floorDiv(aligned, 8L);
            int shift = (int) Math.floorMod(aligned, 8L);

            int window = readByte(src, srcByte, firstSrcByte, lastSrcByte) >>> shift;
            window |= readByte(src, srcByte + 1, firstSrcByte, lastSrcByte) << (8 - shift);

            merge(dst, b, (byte) window, rangeMask(lo, hi));
        }
    }

    private static int readByte(MemoryBuffer src, long index, long first, long last) {
        if (index < first || index > last) {
            return 0;
        }
        return src.getByte((int) index) & 0xFF;
    }

    /** Bits {@code [lo, hi)} of a byte, {@code 0 <= lo < hi <= 8}. */
    private static int rangeMask(int lo, int hi) {
        return ((1 << hi) - 1) & ~((1 << lo) - 1);
    }

    private static void merge(MemoryBuffer dst, int index, byte value, int mask) {
        int existing = dst.getByte(index);
        dst.putByte(index, (byte) ((existing & ~mask) | (value & mask)));
    }
}
