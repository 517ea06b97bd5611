/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.merge;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import dev.sapwood.column.ColumnVector;
import dev.sapwood.column.DType;
import dev.sapwood.column.Validity;
import dev.sapwood.internal.validity.BitCopier;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Concatenates columns of the same type into one new column.
 * <p>
 * Validity bitmaps are merged with {@link BitCopier} at the running row offset of each
 * input. Those merges share boundary bytes and run in order on the calling thread. Data
 * buffer copies target disjoint byte ranges and are issued on the given executor without
 * ordering between them; {@link #concatenate(List)} waits for all of them before it returns.
 * </p>
 * <p>
 * Every input bitmap is merged, whatever null count its column reports. The null count of
 * the result is the sum of the inputs' counts, which matches the merged bits.
 * </p>
 */
public final class ColumnConcatenator {

    private static final Logger LOG = System.getLogger(ColumnConcatenator.class.getName());

    private final BufferAllocator allocator;
    private final Executor executor;

    public ColumnConcatenator(BufferAllocator allocator, Executor executor) {
        this.allocator = allocator;
        this.executor = executor;
    }

    /**
     * @throws IllegalArgumentException if no columns are given, their types differ, struct
     *         inputs have different numbers of children, or the total row count overflows
     */
    public ColumnVector concatenate(List<ColumnVector> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required for concatenation");
        }
        List<CompletableFuture<Void>> copies = new ArrayList<>();
        ColumnVector result = concatenate(columns, copies);
        awaitCopies(copies);

        LOG.log(Level.DEBUG, "Concatenated {0} {1} columns into {2} rows with {3} nulls ({4} async copies)",
                columns.size(), result.getType(), result.getRowCount(), result.getNullCount(), copies.size());
        return result;
    }

    private ColumnVector concatenate(List<ColumnVector> columns, List<CompletableFuture<Void>> copies) {
        DType type = columns.get(0).getType();
        int rows = 0;
        int nulls = 0;
        for (ColumnVector column : columns) {
            if (column.getType() != type) {
                throw new IllegalArgumentException("Cannot concatenate columns of type " + type
                        + " and " + column.getType());
            }
            try {
                rows = Math.addExact(rows, column.getRowCount());
            }
            catch (ArithmeticException e) {
                throw new IllegalArgumentException("Total row count of concatenation exceeds " + Integer.MAX_VALUE, e);
            }
            nulls += column.getNullCount();
        }

        Validity validity = mergeValidity(columns, rows);

        if (type == DType.STRUCT) {
            return ColumnVector.assemble(type, rows, null, null, validity, nulls, concatenateFields(columns, copies));
        }
        if (type.hasOffsets()) {
            return concatenateOffsets(columns, type, rows, validity, nulls, copies);
        }
        return ColumnVector.assemble(type, rows, copyData(columns, type, rows, copies), null, validity, nulls,
                List.of());
    }

    private Validity mergeValidity(List<ColumnVector> columns, int rows) {
        MemoryBuffer bits = null;
        int merged = 0;
        long rowOffset = 0;
        for (ColumnVector column : columns) {
            if (column.getValidity() instanceof Validity.Bitmap bitmap) {
                if (bits == null) {
                    bits = ValidityBitmap.allocate(allocator, rows);
                }
                merged += BitCopier.copy(bitmap.bits(), 0, bits, rowOffset, column.getRowCount());
            }
            rowOffset += column.getRowCount();
        }
        return merged == 0 ? Validity.allValid() : new Validity.Bitmap(bits);
    }

    private MemoryBuffer copyData(List<ColumnVector> columns, DType type, int rows,
                                  List<CompletableFuture<Void>> copies) {
        int stride = type.sizeInBytes();
        MemoryBuffer data = allocator.allocate(Math.multiplyExact(rows, stride));
        int byteOffset = 0;
        for (ColumnVector column : columns) {
            int bytes = column.getRowCount() * stride;
            if (bytes > 0) {
                MemoryBuffer source = column.getData();
                int target = byteOffset;
                copies.add(CompletableFuture.runAsync(() -> data.copyFrom(target, source, 0, bytes), executor));
            }
            byteOffset += bytes;
        }
        return data;
    }

    private List<ColumnVector> concatenateFields(List<ColumnVector> columns, List<CompletableFuture<Void>> copies) {
        int fields = columns.get(0).getNumChildren();
        for (ColumnVector column : columns) {
            if (column.getNumChildren() != fields) {
                throw new IllegalArgumentException("Cannot concatenate structs with " + fields + " and "
                        + column.getNumChildren() + " fields");
            }
        }
        List<ColumnVector> children = new ArrayList<>(fields);
        for (int field = 0; field < fields; field++) {
            List<ColumnVector> parts = new ArrayList<>(columns.size());
            for (ColumnVector column : columns) {
                parts.add(column.getChild(field));
            }
            children.add(concatenate(parts, copies));
        }
        return children;
    }

    private ColumnVector concatenateOffsets(List<ColumnVector> columns, DType type, int rows, Validity validity,
                                            int nulls, List<CompletableFuture<Void>> copies) {
        MemoryBuffer offsets = allocator.allocate((rows + 1) * Integer.BYTES);
        List<ColumnVector> childParts = new ArrayList<>(columns.size());
        ColumnSlicer slicer = new ColumnSlicer(allocator);
        int row = 0;
        int childBase = 0;

        for (ColumnVector column : columns) {
            MemoryBuffer source = column.getOffsets();
            int count = column.getRowCount();
            int start = source.getInt(0);
            int end = source.getInt(count * Integer.BYTES);
            for (int i = 0; i < count; i++) {
                offsets.putInt((row + i) * Integer.BYTES, source.getInt(i * Integer.BYTES) - start + childBase);
            }
            ColumnVector child = column.getChild(0);
            childParts.add(start == 0 && end == child.getRowCount() ? child : slicer.slice(child, start, end));
            row += count;
            childBase = Math.addExact(childBase, end - start);
        }
        offsets.putInt(rows * Integer.BYTES, childBase);

        ColumnVector child = concatenate(childParts, copies);
        return ColumnVector.assemble(type, rows, null, offsets, validity, nulls, List.of(child));
    }

    private static void awaitCopies(List<CompletableFuture<Void>> copies) {
        try {
            CompletableFuture.allOf(copies.toArray(new CompletableFuture[0])).join();
        }
        catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Buffer copy failed", cause);
        }
    }
}
