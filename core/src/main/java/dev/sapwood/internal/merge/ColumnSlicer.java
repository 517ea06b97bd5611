/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import dev.sapwood.column.ColumnVector;
import dev.sapwood.column.DType;
import dev.sapwood.column.Validity;
import dev.sapwood.internal.validity.BitCopier;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Copies a contiguous row range of a column, recursing into children.
 * <p>
 * Validity bits are moved from source bit offset {@code from} to destination bit offset 0,
 * which is the unaligned case of {@link BitCopier} whenever {@code from} is not a multiple
 * of eight. String and list offsets are rebased to start at 0 and only the referenced
 * child rows are copied.
 * </p>
 */
public final class ColumnSlicer {

    private final BufferAllocator allocator;

    public ColumnSlicer(BufferAllocator allocator) {
        this.allocator = allocator;
    }

    public ColumnVector slice(ColumnVector column, int from, int to) {
        Objects.checkFromToIndex(from, to, column.getRowCount());
        int rows = to - from;

        Validity validity = Validity.allValid();
        int nulls = 0;
        if (column.getValidity() instanceof Validity.Bitmap bitmap && rows > 0) {
            MemoryBuffer bits = ValidityBitmap.allocate(allocator, rows);
            nulls = BitCopier.copy(bitmap.bits(), from, bits, 0, rows);
            if (nulls > 0) {
                validity = new Validity.Bitmap(bits);
            }
        }

        DType type = column.getType();
        if (type == DType.STRUCT) {
            List<ColumnVector> children = new ArrayList<>(column.getNumChildren());
            for (ColumnVector child : column.getChildren()) {
                children.add(slice(child, from, to));
            }
            return ColumnVector.assemble(type, rows, null, null, validity, nulls, children);
        }
        if (type.hasOffsets()) {
            MemoryBuffer sourceOffsets = column.getOffsets();
            int childStart = sourceOffsets.getInt(from * Integer.BYTES);
            int childEnd = sourceOffsets.getInt(to * Integer.BYTES);
            MemoryBuffer offsets = allocator.allocate((rows + 1) * Integer.BYTES);
            for (int i = 0; i <= rows; i++) {
                offsets.putInt(i * Integer.BYTES, sourceOffsets.getInt((from + i) * Integer.BYTES) - childStart);
            }
            ColumnVector child = slice(column.getChild(0), childStart, childEnd);
            return ColumnVector.assemble(type, rows, null, offsets, validity, nulls, List.of(child));
        }

        int stride = type.sizeInBytes();
        MemoryBuffer data = allocator.allocate(Math.multiplyExact(rows, stride));
        data.copyFrom(0, column.getData(), from * stride, rows * stride);
        return ColumnVector.assemble(type, rows, data, null, validity, nulls, List.of());
    }
}
