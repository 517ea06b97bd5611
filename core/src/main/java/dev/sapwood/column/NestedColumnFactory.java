/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import dev.sapwood.internal.buffer.TypedBuffer;
import dev.sapwood.internal.nulls.NonEmptyNullPurger;
import dev.sapwood.internal.validity.BitCopier;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Construction of string and list columns, whose total child size is not known up front.
 */
final class NestedColumnFactory {

    private static final int INITIAL_CHAR_CAPACITY = 64;

    private NestedColumnFactory() {
    }

    static ColumnVector fromStrings(BufferAllocator allocator, String... values) {
        int rows = values.length;
        TypedBuffer offsets = new TypedBuffer(allocator, Integer.BYTES, rows + 1);
        TypedBuffer chars = new TypedBuffer(allocator, 1, INITIAL_CHAR_CAPACITY);
        MemoryBuffer bits = null;
        int nulls = 0;

        offsets.appendInt(0);
        for (int i = 0; i < rows; i++) {
            String value = values[i];
            if (value == null) {
                if (bits == null) {
                    bits = ValidityBitmap.allocate(allocator, rows);
                }
                ValidityBitmap.setNull(bits, i);
                nulls++;
            }
            else {
                byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
                chars.ensureCapacity(Math.addExact(chars.length(), bytes.length));
                chars.appendBytes(bytes);
            }
            offsets.appendInt(chars.length());
        }

        ColumnVector child = ColumnVector.assemble(DType.INT8, chars.length(), chars.buffer(), null,
                Validity.allValid(), 0, List.of());
        Validity validity = bits == null ? Validity.allValid() : new Validity.Bitmap(bits);
        return ColumnVector.assemble(DType.STRING, rows, null, offsets.buffer(), validity, nulls, List.of(child));
    }

    static ColumnVector fromLists(BufferAllocator allocator, DType elementType, List<?>... lists) {
        if (!elementType.isFixedWidth() && elementType != DType.STRING) {
            throw new IllegalArgumentException("List elements must be fixed-width or STRING, got " + elementType);
        }
        int rows = lists.length;
        TypedBuffer offsets = new TypedBuffer(allocator, Integer.BYTES, rows + 1);
        List<Object> elements = new ArrayList<>();
        MemoryBuffer bits = null;
        int nulls = 0;

        offsets.appendInt(0);
        for (int i = 0; i < rows; i++) {
            List<?> list = lists[i];
            if (list == null) {
                if (bits == null) {
                    bits = ValidityBitmap.allocate(allocator, rows);
                }
                ValidityBitmap.setNull(bits, i);
                nulls++;
            }
            else {
                elements.addAll(list);
            }
            offsets.appendInt(elements.size());
        }

        ColumnVector child;
        if (elementType == DType.STRING) {
            String[] strings = new String[elements.size()];
            for (int i = 0; i < strings.length; i++) {
                strings[i] = (String) elements.get(i);
            }
            child = fromStrings(allocator, strings);
        }
        else {
            ColumnBuilder builder = ColumnBuilder.create(elementType, elements.size(), allocator);
            for (Object element : elements) {
                appendValue(builder, element);
            }
            child = builder.build();
        }

        Validity validity = bits == null ? Validity.allValid() : new Validity.Bitmap(bits);
        return ColumnVector.assemble(DType.LIST, rows, null, offsets.buffer(), validity, nulls, List.of(child));
    }

    static ColumnVector fromRawOffsets(BufferAllocator allocator, DType type, int rowCount, MemoryBuffer offsets,
                                       MemoryBuffer validityOrNull, int nullCount, ColumnVector child) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count cannot be negative: " + rowCount);
        }
        if (offsets.length() < ((long) rowCount + 1) * Integer.BYTES) {
            throw new IllegalArgumentException("Offsets buffer of " + offsets.length() + " bytes cannot hold "
                    + (rowCount + 1) + " offsets");
        }
        int previous = offsets.getInt(0);
        if (previous < 0) {
            throw new IllegalArgumentException("First offset cannot be negative: " + previous);
        }
        for (int i = 1; i <= rowCount; i++) {
            int offset = offsets.getInt(i * Integer.BYTES);
            if (offset < previous) {
                throw new IllegalArgumentException("Offsets must not decrease: offset " + i + " is " + offset
                        + ", previous is " + previous);
            }
            previous = offset;
        }
        if (previous > child.getRowCount()) {
            throw new IllegalArgumentException("Last offset " + previous + " exceeds child row count "
                    + child.getRowCount());
        }

        ColumnVector column = ColumnVector.assemble(type, rowCount, null, offsets,
                copyValidity(allocator, validityOrNull, rowCount), nullCount, List.of(child));
        return column.hasNonEmptyNulls() ? new NonEmptyNullPurger(allocator).purge(column) : column;
    }

    /**
     * Copy the first {@code rows} bits of a caller-supplied bitmap into a padded allocation.
     */
    static Validity copyValidity(BufferAllocator allocator, MemoryBuffer bitsOrNull, int rows) {
        if (bitsOrNull == null) {
            return Validity.allValid();
        }
        if (bitsOrNull.length() * 8L < rows) {
            throw new IllegalArgumentException("Validity bitmap of " + bitsOrNull.length()
                    + " bytes cannot hold " + rows + " rows");
        }
        MemoryBuffer bits = ValidityBitmap.allocate(allocator, rows);
        BitCopier.copy(bitsOrNull, 0, bits, 0, rows);
        return new Validity.Bitmap(bits);
    }

    private static void appendValue(ColumnBuilder builder, Object value) {
        if (value == null) {
            builder.appendNull();
            return;
        }
        if (builder.getType() == DType.BOOL8) {
            if (!(value instanceof Boolean b)) {
                throw new IllegalArgumentException("Expected a Boolean for BOOL8, got " + value.getClass().getName());
            }
            builder.append((boolean) b);
            return;
        }
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("Expected a Number for " + builder.getType() + ", got "
                    + value.getClass().getName());
        }
        switch (builder.getType().storage()) {
            case BYTE -> builder.append(number.byteValue());
            case SHORT -> builder.append(number.shortValue());
            case INT -> builder.append(number.intValue());
            case LONG -> builder.append(number.longValue());
            case FLOAT -> builder.append(number.floatValue());
            case DOUBLE -> builder.append(number.doubleValue());
            case NONE -> throw new IllegalArgumentException("No storage for " + builder.getType());
        }
    }
}
