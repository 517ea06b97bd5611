/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import java.util.Objects;

import dev.sapwood.internal.validity.BitCopier;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * An externally supplied validity mask of {@code length} bits, applied to a column with
 * {@link ColumnVector#superimposeNulls(NullMask)}. Bits past {@code length} are ignored.
 */
public record NullMask(MemoryBuffer bits, int length) {

    public NullMask {
        Objects.requireNonNull(bits, "bits");
        if (length < 0) {
            throw new IllegalArgumentException("Mask length cannot be negative: " + length);
        }
        if (bits.length() * 8L < length) {
            throw new IllegalArgumentException(
                    "Mask of " + length + " bits does not fit into " + bits.length() + " bytes");
        }
    }

    /**
     * Create a mask from per-row flags, {@code true} marking a valid row.
     */
    public static NullMask fromValidFlags(boolean... valid) {
        MemoryBuffer bits = ValidityBitmap.allocate(BufferAllocator.heap(), valid.length);
        for (int i = 0; i < valid.length; i++) {
            if (!valid[i]) {
                ValidityBitmap.setNull(bits, i);
            }
        }
        return new NullMask(bits, valid.length);
    }

    public static NullMask allValid(int length) {
        return new NullMask(ValidityBitmap.allocate(BufferAllocator.heap(), length), length);
    }

    /**
     * A copy of the validity of {@code column}; all valid if the column has no bitmap.
     */
    public static NullMask of(ColumnVector column) {
        int rows = column.getRowCount();
        MemoryBuffer bits = ValidityBitmap.allocate(BufferAllocator.heap(), rows);
        if (column.getValidity() instanceof Validity.Bitmap bitmap) {
            BitCopier.copy(bitmap.bits(), 0, bits, 0, rows);
        }
        return new NullMask(bits, rows);
    }

    public boolean isValid(int index) {
        Objects.checkIndex(index, length);
        return ValidityBitmap.isValid(bits, index);
    }

    /**
     * Number of null bits in {@code [0, length)}, counted from the bitmap.
     */
    public int nullCount() {
        return ValidityBitmap.countZeroBits(bits, length);
    }
}
