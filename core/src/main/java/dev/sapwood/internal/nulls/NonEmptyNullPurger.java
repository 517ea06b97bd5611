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
import dev.sapwood.internal.merge.ColumnConcatenator;
import dev.sapwood.internal.merge.ColumnSlicer;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Enforces that null string and list rows span zero child rows.
 * <p>
 * A string or list column with a null row over a non-empty child range is rebuilt: the
 * offsets are rewritten so that null rows are empty, and the child is compacted to the
 * ranges of the valid rows. Struct columns are purged field by field, list children
 * recursively. Columns that need no change are returned as they are.
 * </p>
 */
public final class NonEmptyNullPurger {

    private static final Logger LOG = System.getLogger(NonEmptyNullPurger.class.getName());

    private final BufferAllocator allocator;

    public NonEmptyNullPurger(BufferAllocator allocator) {
        this.allocator = allocator;
    }

    public static boolean hasNonEmptyNulls(ColumnVector column) {
        DType type = column.getType();
        if (type == DType.STRUCT) {
            for (ColumnVector child : column.getChildren()) {
                if (hasNonEmptyNulls(child)) {
                    return true;
                }
            }
            return false;
        }
        if (type == DType.LIST) {
            return countNonEmptyNulls(column) > 0 || hasNonEmptyNulls(column.getChild(0));
        }
        if (type == DType.STRING) {
            return countNonEmptyNulls(column) > 0;
        }
        return false;
    }

    public ColumnVector purge(ColumnVector column) {
        DType type = column.getType();
        if (type == DType.STRUCT) {
            List<ColumnVector> children = new ArrayList<>(column.getNumChildren());
            boolean changed = false;
            for (ColumnVector child : column.getChildren()) {
                ColumnVector purged = purge(child);
                changed |= purged != child;
                children.add(purged);
            }
            return changed ? rebuild(column, column.getOffsets(), children) : column;
        }
        if (!type.hasOffsets()) {
            return column;
        }

        ColumnVector child = column.getChild(0);
        if (type == DType.LIST) {
            child = purge(child);
        }
        int nonEmptyNulls = countNonEmptyNulls(column);
        if (nonEmptyNulls > 0) {
            return compact(column, child, nonEmptyNulls);
        }
        return child != column.getChild(0) ? rebuild(column, column.getOffsets(), List.of(child)) : column;
    }

    private ColumnVector compact(ColumnVector column, ColumnVector child, int nonEmptyNulls) {
        int rows = column.getRowCount();
        MemoryBuffer source = column.getOffsets();
        MemoryBuffer offsets = allocator.allocate((rows + 1) * Integer.BYTES);
        ColumnSlicer slicer = new ColumnSlicer(allocator);
        List<ColumnVector> kept = new ArrayList<>();

        int runStart = -1;
        int runEnd = -1;
        int total = 0;
        for (int row = 0; row < rows; row++) {
            int start = source.getInt(row * Integer.BYTES);
            int end = source.getInt((row + 1) * Integer.BYTES);
            if (column.isValid(row) && end > start) {
                if (start != runEnd) {
                    if (runStart >= 0) {
                        kept.add(slicer.slice(child, runStart, runEnd));
                    }
                    runStart = start;
                }
                runEnd = end;
                total += end - start;
            }
            offsets.putInt((row + 1) * Integer.BYTES, total);
        }
        if (runStart >= 0) {
            kept.add(slicer.slice(child, runStart, runEnd));
        }

        ColumnVector compacted;
        if (kept.isEmpty()) {
            compacted = slicer.slice(child, 0, 0);
        }
        else if (kept.size() == 1) {
            compacted = kept.get(0);
        }
        else {
            compacted = new ColumnConcatenator(allocator, Runnable::run).concatenate(kept);
        }

        LOG.log(Level.DEBUG, "Purged {0} non-empty null rows from {1} column of {2} rows",
                nonEmptyNulls, column.getType(), rows);
        return rebuild(column, offsets, List.of(compacted));
    }

    private static ColumnVector rebuild(ColumnVector column, MemoryBuffer offsets, List<ColumnVector> children) {
        return ColumnVector.assemble(column.getType(), column.getRowCount(), column.getData(), offsets,
                column.getValidity(), column.getNullCount(), children);
    }

    private static int countNonEmptyNulls(ColumnVector column) {
        if (!column.hasNulls()) {
            return 0;
        }
        MemoryBuffer offsets = column.getOffsets();
        int count = 0;
        for (int row = 0; row < column.getRowCount(); row++) {
            if (column.isNull(row)
                    && offsets.getInt((row + 1) * Integer.BYTES) != offsets.getInt(row * Integer.BYTES)) {
                count++;
            }
        }
        return count;
    }
}
