/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.nulls;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;

import dev.sapwood.column.ColumnVector;
import dev.sapwood.column.DType;
import dev.sapwood.column.NullMask;
import dev.sapwood.column.Validity;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Applies an external null mask to a column tree.
 * <p>
 * The mask is ANDed into the validity of the column. For struct columns the combined
 * validity, not the original mask, is ANDed into every child, recursively, so that a null
 * struct row is null at every depth below it. String and list columns get the mask on
 * their own validity only; their children are left alone.
 * </p>
 * <p>
 * Once all validities are final, null string and list rows that still span child rows
 * are emptied by {@link NonEmptyNullPurger}. Null counts are always recounted from the
 * combined bitmaps. The input column is never modified; data buffers are shared with the
 * result.
 * </p>
 */
public final class NullSuperimposer {

    private static final Logger LOG = System.getLogger(NullSuperimposer.class.getName());

    private final BufferAllocator allocator;
    private final NonEmptyNullPurger purger;

    public NullSuperimposer(BufferAllocator allocator) {
        this.allocator = allocator;
        this.purger = new NonEmptyNullPurger(allocator);
    }

    /**
     * @throws IllegalArgumentException if the mask length differs from the row count of
     *         {@code column}
     */
    public ColumnVector superimpose(ColumnVector column, NullMask mask) {
        if (mask.length() != column.getRowCount()) {
            throw new IllegalArgumentException("Size mismatch: null mask has " + mask.length()
                    + " bits, column has " + column.getRowCount() + " rows");
        }
        ColumnVector masked = applyMask(column, mask.bits());
        ColumnVector result = purger.purge(masked);

        LOG.log(Level.DEBUG, "Superimposed nulls on {0} column of {1} rows, null count {2} -> {3}",
                column.getType(), column.getRowCount(), column.getNullCount(), result.getNullCount());
        return result;
    }

    private ColumnVector applyMask(ColumnVector column, MemoryBuffer mask) {
        int rows = column.getRowCount();
        MemoryBuffer combined = and(column.getValidity(), mask, rows);
        int nulls = ValidityBitmap.countZeroBits(combined, rows);
        Validity validity = nulls == 0 ? Validity.allValid() : new Validity.Bitmap(combined);

        List<ColumnVector> children = column.getChildren();
        if (column.getType() == DType.STRUCT) {
            List<ColumnVector> maskedChildren = new ArrayList<>(children.size());
            for (ColumnVector child : children) {
                maskedChildren.add(applyMask(child, combined));
            }
            children = maskedChildren;
        }
        return ColumnVector.assemble(column.getType(), rows, column.getData(), column.getOffsets(), validity, nulls,
                children);
    }

    /**
     * A fresh bitmap holding {@code validity AND mask} over the first {@code rows} bits,
     * with all padding bits valid. A column without bitmap counts as all valid.
     */
    private MemoryBuffer and(Validity validity, MemoryBuffer mask, int rows) {
        MemoryBuffer combined = ValidityBitmap.allocate(allocator, rows);
        int bytes = ValidityBitmap.lengthInBytes(rows);
        MemoryBuffer bits = validity instanceof Validity.Bitmap bitmap ? bitmap.bits() : null;

        int i = 0;
        for (; i + Long.BYTES <= bytes; i += Long.BYTES) {
            long word = mask.getLong(i);
            if (bits != null) {
                word &= bits.getLong(i);
            }
            combined.putLong(i, word);
        }
        for (; i < bytes; i++) {
            byte b = mask.getByte(i);
            if (bits != null) {
                b &= bits.getByte(i);
            }
            combined.putByte(i, b);
        }
        ValidityBitmap.setTrailingBitsValid(combined, rows);
        return combined;
    }
}
