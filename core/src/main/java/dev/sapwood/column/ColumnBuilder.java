/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import java.util.List;
import java.util.Objects;

import dev.sapwood.column.DType.Storage;
import dev.sapwood.internal.buffer.TypedBuffer;
import dev.sapwood.internal.conversion.UnsignedConverter;
import dev.sapwood.internal.validity.BitCopier;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Single-owner writer producing one fixed-width {@link ColumnVector}.
 * <p>
 * The builder owns a data buffer of {@code capacity} elements and writes at a cursor
 * that only moves forward. The validity bitmap is allocated on the first null, with
 * every row written before it marked valid. {@link #build()} hands both buffers over
 * to the column and invalidates the builder.
 * </p>
 * <p>
 * Writing past the capacity fails with an {@link IllegalStateException} before anything
 * is written, so the rows appended so far are unaffected. Not thread-safe.
 * </p>
 */
public final class ColumnBuilder {

    private final DType type;
    private final BufferAllocator allocator;
    private final TypedBuffer data;
    private MemoryBuffer validity;
    private int nullCount;
    private boolean built;

    private ColumnBuilder(DType type, int capacity, BufferAllocator allocator) {
        this.type = type;
        this.allocator = allocator;
        this.data = new TypedBuffer(allocator, type.sizeInBytes(), capacity);
    }

    public static ColumnBuilder create(DType type, int capacity) {
        return create(type, capacity, BufferAllocator.heap());
    }

    public static ColumnBuilder create(DType type, int capacity, BufferAllocator allocator) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(allocator, "allocator");
        if (!type.isFixedWidth()) {
            throw new IllegalArgumentException("Builders only support fixed-width types, got " + type);
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
        }
        return new ColumnBuilder(type, capacity, allocator);
    }

    public DType getType() {
        return type;
    }

    /** Number of rows written so far. */
    public int getRowCount() {
        return data.length();
    }

    public int getCapacity() {
        return data.capacity();
    }

    public int getNullCount() {
        return nullCount;
    }

    public ColumnBuilder append(byte value) {
        beforeAppend(Storage.BYTE, 1);
        markValid();
        data.appendByte(value);
        return this;
    }

    public ColumnBuilder append(short value) {
        beforeAppend(Storage.SHORT, 1);
        markValid();
        data.appendShort(value);
        return this;
    }

    public ColumnBuilder append(int value) {
        beforeAppend(Storage.INT, 1);
        markValid();
        data.appendInt(value);
        return this;
    }

    public ColumnBuilder append(long value) {
        beforeAppend(Storage.LONG, 1);
        markValid();
        data.appendLong(value);
        return this;
    }

    public ColumnBuilder append(float value) {
        beforeAppend(Storage.FLOAT, 1);
        markValid();
        data.appendFloat(value);
        return this;
    }

    public ColumnBuilder append(double value) {
        beforeAppend(Storage.DOUBLE, 1);
        markValid();
        data.appendDouble(value);
        return this;
    }

    public ColumnBuilder append(boolean value) {
        checkNotBuilt();
        if (type != DType.BOOL8) {
            throw new IllegalStateException("Cannot append a boolean to a column of type " + type);
        }
        checkCapacity(1);
        markValid();
        data.appendByte(value ? (byte) 1 : (byte) 0);
        return this;
    }

    /**
     * Append an unsigned integer, stored with the same bit pattern as the signed value
     * of the column's width.
     *
     * @throws IllegalArgumentException if the column is not an integer column or the
     *         value exceeds the unsigned range of its width
     */
    public ColumnBuilder appendUnsigned(long value) {
        checkNotBuilt();
        long bits = UnsignedConverter.toStoredBits(value, type);
        checkCapacity(1);
        markValid();
        switch (type.storage()) {
            case BYTE -> data.appendByte((byte) bits);
            case SHORT -> data.appendShort((short) bits);
            case INT -> data.appendInt((int) bits);
            default -> data.appendLong(bits);
        }
        return this;
    }

    /**
     * Append a null row. The data slot is zero-filled.
     */
    public ColumnBuilder appendNull() {
        checkNotBuilt();
        checkCapacity(1);
        ensureValidity();
        int row = data.length();
        data.appendZero();
        ValidityBitmap.setNull(validity, row);
        nullCount++;
        return this;
    }

    public ColumnBuilder appendArray(byte... values) {
        beforeAppend(Storage.BYTE, values.length);
        markRangeValid(values.length);
        for (byte value : values) {
            data.appendByte(value);
        }
        return this;
    }

    public ColumnBuilder appendArray(short... values) {
        beforeAppend(Storage.SHORT, values.length);
        markRangeValid(values.length);
        for (short value : values) {
            data.appendShort(value);
        }
        return this;
    }

    public ColumnBuilder appendArray(int... values) {
        beforeAppend(Storage.INT, values.length);
        markRangeValid(values.length);
        for (int value : values) {
            data.appendInt(value);
        }
        return this;
    }

    public ColumnBuilder appendArray(long... values) {
        beforeAppend(Storage.LONG, values.length);
        markRangeValid(values.length);
        for (long value : values) {
            data.appendLong(value);
        }
        return this;
    }

    public ColumnBuilder appendArray(float... values) {
        beforeAppend(Storage.FLOAT, values.length);
        markRangeValid(values.length);
        for (float value : values) {
            data.appendFloat(value);
        }
        return this;
    }

    public ColumnBuilder appendArray(double... values) {
        beforeAppend(Storage.DOUBLE, values.length);
        markRangeValid(values.length);
        for (double value : values) {
            data.appendDouble(value);
        }
        return this;
    }

    public ColumnBuilder appendArray(boolean... values) {
        checkNotBuilt();
        if (type != DType.BOOL8) {
            throw new IllegalStateException("Cannot append booleans to a column of type " + type);
        }
        checkCapacity(values.length);
        markRangeValid(values.length);
        for (boolean value : values) {
            data.appendByte(value ? (byte) 1 : (byte) 0);
        }
        return this;
    }

    public ColumnBuilder appendBoxed(Byte... values) {
        beforeAppend(Storage.BYTE, values.length);
        for (Byte value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                append((byte) value);
            }
        }
        return this;
    }

    public ColumnBuilder appendBoxed(Short... values) {
        beforeAppend(Storage.SHORT, values.length);
        for (Short value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                append((short) value);
            }
        }
        return this;
    }

    public ColumnBuilder appendBoxed(Integer... values) {
        beforeAppend(Storage.INT, values.length);
        for (Integer value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                append((int) value);
            }
        }
        return this;
    }

    public ColumnBuilder appendBoxed(Long... values) {
        beforeAppend(Storage.LONG, values.length);
        for (Long value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                append((long) value);
            }
        }
        return this;
    }

    public ColumnBuilder appendBoxed(Float... values) {
        beforeAppend(Storage.FLOAT, values.length);
        for (Float value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                append((float) value);
            }
        }
        return this;
    }

    public ColumnBuilder appendBoxed(Double... values) {
        beforeAppend(Storage.DOUBLE, values.length);
        for (Double value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                append((double) value);
            }
        }
        return this;
    }

    public ColumnBuilder appendBoxed(Boolean... values) {
        checkNotBuilt();
        if (type != DType.BOOL8) {
            throw new IllegalStateException("Cannot append booleans to a column of type " + type);
        }
        checkCapacity(values.length);
        for (Boolean value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                append((boolean) value);
            }
        }
        return this;
    }

    /**
     * Append unsigned values given as boxed longs; {@code null} appends a null row.
     */
    public ColumnBuilder appendBoxedUnsigned(Long... values) {
        checkNotBuilt();
        for (Long value : values) {
            if (value != null) {
                UnsignedConverter.toStoredBits(value, type);
            }
        }
        checkCapacity(values.length);
        for (Long value : values) {
            if (value == null) {
                appendNull();
            }
            else {
                appendUnsigned(value);
            }
        }
        return this;
    }

    /**
     * Append every row of {@code source}, values and nulls, at the cursor.
     *
     * @throws IllegalArgumentException if the source has a different type
     * @throws IllegalStateException if the rows do not fit into the remaining capacity
     */
    public ColumnBuilder append(ColumnVector source) {
        checkNotBuilt();
        if (source.getType() != type) {
            throw new IllegalArgumentException("Cannot append a column of type " + source.getType()
                    + " to a builder of type " + type);
        }
        int length = source.getRowCount();
        checkCapacity(length);
        MemoryBuffer sourceBits = source.getValidity() instanceof Validity.Bitmap bitmap ? bitmap.bits() : null;
        appendBulkUnchecked(source.getData(), sourceBits, length);
        return this;
    }

    /**
     * Append {@code length} elements from a raw data buffer, with validity taken from
     * {@code sourceValidity} (bits {@code [0, length)}), or all valid if it is {@code null}.
     * Bytes are copied as they are: in a {@link DType#BOOL8} column any nonzero byte reads
     * as {@code true}.
     */
    public ColumnBuilder appendBulk(MemoryBuffer sourceData, MemoryBuffer sourceValidity, int length) {
        checkNotBuilt();
        Objects.requireNonNull(sourceData, "sourceData");
        if (length < 0) {
            throw new IllegalArgumentException("Length cannot be negative: " + length);
        }
        checkCapacity(length);
        if (sourceData.length() < (long) length * type.sizeInBytes()) {
            throw new IllegalArgumentException("Source data holds " + sourceData.length()
                    + " bytes, " + length + " elements of " + type + " need " + (long) length * type.sizeInBytes());
        }
        if (sourceValidity != null && sourceValidity.length() * 8L < length) {
            throw new IllegalArgumentException("Source validity holds " + sourceValidity.length() * 8L
                    + " bits, " + length + " are needed");
        }
        appendBulkUnchecked(sourceData, sourceValidity, length);
        return this;
    }

    /**
     * Nulls are taken from the source bits themselves, never from a reported count.
     */
    private void appendBulkUnchecked(MemoryBuffer sourceData, MemoryBuffer sourceBits, int length) {
        int row = data.length();
        int sourceNulls = sourceBits == null ? 0 : ValidityBitmap.countZeroBits(sourceBits, length);
        if (sourceNulls > 0) {
            ensureValidity();
            BitCopier.copy(sourceBits, 0, validity, row, length);
        }
        else {
            markRangeValid(length);
        }
        data.appendElements(sourceData, 0, length);
        nullCount += sourceNulls;
    }

    /**
     * Finish the column. The row count is the number of rows written, which may be less
     * than the capacity. The builder cannot be used afterwards.
     */
    public ColumnVector build() {
        checkNotBuilt();
        built = true;
        Validity columnValidity = nullCount == 0 ? Validity.allValid() : new Validity.Bitmap(validity);
        return ColumnVector.assemble(type, data.length(), data.buffer(), null, columnValidity, nullCount, List.of());
    }

    private void beforeAppend(Storage storage, int count) {
        checkNotBuilt();
        if (type.storage() != storage || type == DType.BOOL8) {
            throw new IllegalStateException("Cannot append " + storage.name().toLowerCase()
                    + " values to a column of type " + type);
        }
        checkCapacity(count);
    }

    private void checkCapacity(int count) {
        if (count > data.remaining()) {
            throw new IllegalStateException("Capacity exceeded: cannot append " + count + " rows at row "
                    + data.length() + ", capacity is " + data.capacity());
        }
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Builder has already been built");
        }
    }

    private void ensureValidity() {
        if (validity == null) {
            validity = ValidityBitmap.allocate(allocator, data.capacity());
        }
    }

    private void markValid() {
        if (validity != null) {
            ValidityBitmap.setValid(validity, data.length());
        }
    }

    private void markRangeValid(int count) {
        if (validity != null) {
            ValidityBitmap.setRangeValid(validity, data.length(), (long) data.length() + count);
        }
    }
}
