/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.validity;

import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Bit-level helpers for validity bitmaps.
 * <p>
 * A validity bitmap holds one bit per row, LSB-first within each byte. A set bit marks
 * a valid row, a cleared bit a null row. Bitmaps are allocated in multiples of
 * {@link #ALLOCATION_ALIGNMENT} bytes; every bit past the last row must read as valid.
 * </p>
 * <p>
 * The accessors here do not check bounds beyond what {@link MemoryBuffer} enforces;
 * row bounds are the caller's responsibility.
 * </p>
 */
public final class ValidityBitmap {

    /** Granularity, in bytes, of every validity bitmap allocation. */
    public static final int ALLOCATION_ALIGNMENT = 64;

    private ValidityBitmap() {
    }

    /**
     * Number of bytes needed to hold {@code rows} bits, without padding.
     */
    public static int lengthInBytes(long rows) {
        return Math.toIntExact((rows + 7) >>> 3);
    }

    /**
     * Number of bytes allocated for a bitmap of {@code rows} bits: the byte length rounded
     * up to the next multiple of {@link #ALLOCATION_ALIGNMENT}.
     */
    public static int allocationSizeInBytes(long rows) {
        long bytes = (rows + 7) >>> 3;
        long aligned = (bytes + ALLOCATION_ALIGNMENT - 1) / ALLOCATION_ALIGNMENT * ALLOCATION_ALIGNMENT;
        return Math.toIntExact(aligned);
    }

    /**
     * Allocate a bitmap for {@code rows} rows with every bit, padding included, set to valid.
     */
    public static MemoryBuffer allocate(BufferAllocator allocator, int rows) {
        MemoryBuffer bits = allocator.allocate(allocationSizeInBytes(rows));
        bits.fill((byte) 0xFF);
        return bits;
    }

    public static boolean isValid(MemoryBuffer bits, long index) {
        int b = bits.getByte(byteIndex(index));
        return ((b >>> (index & 7)) & 1) != 0;
    }

    public static void setValid(MemoryBuffer bits, long index) {
        int byteIndex = byteIndex(index);
        bits.putByte(byteIndex, (byte) (bits.getByte(byteIndex) | (1 << (index & 7))));
    }

    public static void setNull(MemoryBuffer bits, long index) {
        int byteIndex = byteIndex(index);
        bits.putByte(byteIndex, (byte) (bits.getByte(byteIndex) & ~(1 << (index & 7))));
    }

    /**
     * Mark bits {@code [from, to)} as valid. Bits outside the range are left unchanged.
     */
    public static void setRangeValid(MemoryBuffer bits, long from, long to) {
        if (from >= to) {
            return;
        }
        int firstByte = byteIndex(from);
        int lastByte = byteIndex(to - 1);
        int headMask = 0xFF << (from & 7);
        int tailMask = 0xFF >>> (7 - ((to - 1) & 7));
        if (firstByte == lastByte) {
            orByte(bits, firstByte, headMask & tailMask);
            return;
        }
        orByte(bits, firstByte, headMask);
        if (lastByte - firstByte > 1) {
            bits.fill(firstByte + 1, lastByte - firstByte - 1, (byte) 0xFF);
        }
        orByte(bits, lastByte, tailMask);
    }

    /**
     * Force the bits between {@code rows} and the end of its byte to valid, so that
     * the partial last byte of a bitmap never reports padding rows as null.
     */
    public static void setTrailingBitsValid(MemoryBuffer bits, int rows) {
        int used = rows & 7;
        if (used != 0) {
            orByte(bits, rows >>> 3, 0xFF << used);
        }
    }

    /**
     * Count the null (zero) bits in {@code [0, length)}.
     */
    public static int countZeroBits(MemoryBuffer bits, int length) {
        return countZeroBits(bits, 0, length);
    }

    /**
     * Count the null (zero) bits in {@code [from, to)}.
     */
    public static int countZeroBits(MemoryBuffer bits, long from, long to) {
        if (from >= to) {
            return 0;
        }
        long total = to - from;
        long ones = 0;
        long bit = from;

        // leading bits up to the first byte boundary
        while (bit < to && (bit & 7) != 0) {
            if (isValid(bits, bit)) {
                ones++;
            }
            bit++;
        }

        int byteIndex = byteIndex(bit);
        int fullBytes = (int) ((to - bit) >>> 3);
        int end = byteIndex + fullBytes;
        for (; byteIndex + Long.BYTES <= end; byteIndex += Long.BYTES) {
            ones += Long.bitCount(bits.getLong(byteIndex));
        }
        for (; byteIndex < end; byteIndex++) {
            ones += Integer.bitCount(bits.getByte(byteIndex) & 0xFF);
        }
        bit += (long) fullBytes << 3;

        for (; bit < to; bit++) {
            if (isValid(bits, bit)) {
                ones++;
            }
        }
        return Math.toIntExact(total - ones);
    }

    private static void orByte(MemoryBuffer bits, int byteIndex, int mask) {
        bits.putByte(byteIndex, (byte) (bits.getByte(byteIndex) | mask));
    }

    private static int byteIndex(long bitIndex) {
        return Math.toIntExact(bitIndex >>> 3);
    }
}
