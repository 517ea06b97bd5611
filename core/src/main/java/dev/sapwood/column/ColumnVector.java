/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import dev.sapwood.column.DType.Storage;
import dev.sapwood.internal.conversion.UnsignedConverter;
import dev.sapwood.internal.merge.ColumnConcatenator;
import dev.sapwood.internal.merge.ColumnSlicer;
import dev.sapwood.internal.nulls.NonEmptyNullPurger;
import dev.sapwood.internal.nulls.NullSuperimposer;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * An immutable, typed, null-aware column of rows.
 * <p>
 * Fixed-width columns store their values in a data buffer. {@link DType#STRING} and
 * {@link DType#LIST} columns store {@code rowCount + 1} {@code int} offsets into their
 * single child; {@link DType#STRUCT} columns store one child per field, each with the
 * same row count as the struct. A null string or list row always spans zero child rows.
 * </p>
 * <p>
 * Validity is either {@link Validity.AllValid} or a {@link Validity.Bitmap}. The null count
 * may be unknown at construction ({@link #UNKNOWN_NULL_COUNT}); it is then counted from
 * the bitmap on first use and cached.
 * </p>
 * <p>
 * Columns are never modified after construction and may be read from any number of
 * threads. Operations such as {@link #concatenate}, {@link #slice} and
 * {@link #superimposeNulls} return new columns. Row accessors throw
 * {@link IndexOutOfBoundsException} for rows outside {@code [0, rowCount)}.
 * </p>
 */
public final class ColumnVector {

    /** Null count sentinel for columns whose nulls have not been counted yet. */
    public static final int UNKNOWN_NULL_COUNT = -1;

    private static final BufferAllocator DEFAULT_ALLOCATOR = BufferAllocator.heap();

    private final DType type;
    private final int rowCount;
    private final MemoryBuffer data;
    private final MemoryBuffer offsets;
    private final Validity validity;
    private final List<ColumnVector> children;
    private volatile int nullCount;

    private ColumnVector(DType type, int rowCount, MemoryBuffer data, MemoryBuffer offsets, Validity validity,
                         int nullCount, List<ColumnVector> children) {
        this.type = type;
        this.rowCount = rowCount;
        this.data = data;
        this.offsets = offsets;
        this.validity = validity;
        this.nullCount = nullCount;
        this.children = children;
    }

    /**
     * Create a column from already laid-out parts, checking only their shape.
     * <p>
     * Buffers are shared, not copied; the caller must not modify them afterwards. A known
     * {@code nullCount} must match the zero bits of the validity bitmap. Null
     * string and list rows are expected to be empty already: this method does not purge
     * them (see {@link #purgeNonEmptyNulls()}). Validity bitmaps must be padded with
     * valid bits past {@code rowCount}.
     * </p>
     */
    public static ColumnVector assemble(DType type, int rowCount, MemoryBuffer data, MemoryBuffer offsets,
                                        Validity validity, int nullCount, List<ColumnVector> children) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(validity, "validity");
        Objects.requireNonNull(children, "children");
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count cannot be negative: " + rowCount);
        }
        if (nullCount < UNKNOWN_NULL_COUNT || nullCount > rowCount) {
            throw new IllegalArgumentException("Invalid null count " + nullCount + " for " + rowCount + " rows");
        }
        if (validity instanceof Validity.Bitmap bitmap && bitmap.bits().length() * 8L < rowCount) {
            throw new IllegalArgumentException("Validity bitmap of " + bitmap.bits().length()
                    + " bytes cannot hold " + rowCount + " rows");
        }
        if (validity instanceof Validity.Bitmap bitmap && nullCount != UNKNOWN_NULL_COUNT) {
            int counted = ValidityBitmap.countZeroBits(bitmap.bits(), rowCount);
            if (counted != nullCount) {
                throw new IllegalArgumentException("Null count " + nullCount + " disagrees with validity bitmap holding "
                        + counted + " nulls");
            }
        }
        if (validity instanceof Validity.AllValid) {
            if (nullCount > 0) {
                throw new IllegalArgumentException("Column without validity bitmap cannot have " + nullCount + " nulls");
            }
            nullCount = 0;
        }

        if (type.isFixedWidth()) {
            requireBuffer(data, (long) rowCount * type.sizeInBytes(), "data", type);
            requireAbsent(offsets, "offsets", type);
            if (!children.isEmpty()) {
                throw new IllegalArgumentException(type + " columns cannot have children");
            }
        }
        else if (type.hasOffsets()) {
            requireAbsent(data, "data", type);
            requireBuffer(offsets, ((long) rowCount + 1) * Integer.BYTES, "offsets", type);
            if (children.size() != 1) {
                throw new IllegalArgumentException(type + " columns need exactly one child, got " + children.size());
            }
            if (type == DType.STRING && children.get(0).getType() != DType.INT8) {
                throw new IllegalArgumentException("STRING child must be INT8, got " + children.get(0).getType());
            }
        }
        else {
            requireAbsent(data, "data", type);
            requireAbsent(offsets, "offsets", type);
            for (ColumnVector child : children) {
                if (child.getRowCount() != rowCount) {
                    throw new IllegalArgumentException("Struct child has " + child.getRowCount()
                            + " rows, struct has " + rowCount);
                }
            }
        }

        Validity readOnlyValidity = validity instanceof Validity.Bitmap bitmap
                ? new Validity.Bitmap(bitmap.bits().readOnlyView())
                : validity;
        return new ColumnVector(type, rowCount,
                data == null ? null : data.readOnlyView(),
                offsets == null ? null : offsets.readOnlyView(),
                readOnlyValidity, nullCount, List.copyOf(children));
    }

    private static void requireBuffer(MemoryBuffer buffer, long bytes, String name, DType type) {
        if (buffer == null) {
            throw new IllegalArgumentException(type + " columns need a " + name + " buffer");
        }
        if (buffer.length() < bytes) {
            throw new IllegalArgumentException(name + " buffer of " + buffer.length() + " bytes is too small, "
                    + type + " needs " + bytes);
        }
    }

    private static void requireAbsent(MemoryBuffer buffer, String name, DType type) {
        if (buffer != null) {
            throw new IllegalArgumentException(type + " columns cannot have a " + name + " buffer");
        }
    }

    // ==================== Builders ====================

    public static ColumnBuilder builder(DType type, int capacity) {
        return ColumnBuilder.create(type, capacity);
    }

    /**
     * Create a builder, pass it to {@code init} and build the result.
     */
    public static ColumnVector build(DType type, int capacity, Consumer<ColumnBuilder> init) {
        ColumnBuilder builder = ColumnBuilder.create(type, capacity);
        init.accept(builder);
        return builder.build();
    }

    // ==================== Factories from values ====================

    public static ColumnVector fromBytes(byte... values) {
        return build(DType.INT8, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector fromShorts(short... values) {
        return build(DType.INT16, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector fromInts(int... values) {
        return build(DType.INT32, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector fromLongs(long... values) {
        return build(DType.INT64, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector fromFloats(float... values) {
        return build(DType.FLOAT32, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector fromDoubles(double... values) {
        return build(DType.FLOAT64, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector fromBooleans(boolean... values) {
        return build(DType.BOOL8, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector fromBoxedBytes(Byte... values) {
        return build(DType.INT8, values.length, b -> b.appendBoxed(values));
    }

    public static ColumnVector fromBoxedShorts(Short... values) {
        return build(DType.INT16, values.length, b -> b.appendBoxed(values));
    }

    public static ColumnVector fromBoxedInts(Integer... values) {
        return build(DType.INT32, values.length, b -> b.appendBoxed(values));
    }

    public static ColumnVector fromBoxedLongs(Long... values) {
        return build(DType.INT64, values.length, b -> b.appendBoxed(values));
    }

    public static ColumnVector fromBoxedFloats(Float... values) {
        return build(DType.FLOAT32, values.length, b -> b.appendBoxed(values));
    }

    public static ColumnVector fromBoxedDoubles(Double... values) {
        return build(DType.FLOAT64, values.length, b -> b.appendBoxed(values));
    }

    public static ColumnVector fromBoxedBooleans(Boolean... values) {
        return build(DType.BOOL8, values.length, b -> b.appendBoxed(values));
    }

    /**
     * Create an {@link DType#INT8} column from unsigned byte bit patterns.
     */
    public static ColumnVector fromUnsignedBytes(byte... values) {
        return fromBytes(values);
    }

    public static ColumnVector fromUnsignedShorts(short... values) {
        return fromShorts(values);
    }

    /**
     * Create an {@link DType#INT32} column from unsigned int bit patterns, e.g.
     * {@code 0xfedcba98}. Read them back with {@link #getUnsignedInt(int)}.
     */
    public static ColumnVector fromUnsignedInts(int... values) {
        return fromInts(values);
    }

    public static ColumnVector fromUnsignedLongs(long... values) {
        return fromLongs(values);
    }

    public static ColumnVector fromBoxedUnsignedInts(Integer... values) {
        return fromBoxedInts(values);
    }

    public static ColumnVector fromBoxedUnsignedLongs(Long... values) {
        return fromBoxedLongs(values);
    }

    public static ColumnVector timestampDaysFromInts(int... values) {
        return build(DType.TIMESTAMP_DAYS, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector timestampSecondsFromLongs(long... values) {
        return build(DType.TIMESTAMP_SECONDS, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector timestampMilliSecondsFromLongs(long... values) {
        return build(DType.TIMESTAMP_MILLISECONDS, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector timestampMicroSecondsFromLongs(long... values) {
        return build(DType.TIMESTAMP_MICROSECONDS, values.length, b -> b.appendArray(values));
    }

    public static ColumnVector timestampNanoSecondsFromLongs(long... values) {
        return build(DType.TIMESTAMP_NANOSECONDS, values.length, b -> b.appendArray(values));
    }

    /**
     * Create a {@link DType#STRING} column; {@code null} elements become null rows.
     */
    public static ColumnVector fromStrings(String... values) {
        return NestedColumnFactory.fromStrings(DEFAULT_ALLOCATOR, values);
    }

    /**
     * Create a {@link DType#LIST} column whose child has {@code elementType}, which must be
     * fixed-width or {@link DType#STRING}. A {@code null} list becomes a null row, a
     * {@code null} element a null child row.
     */
    public static ColumnVector fromLists(DType elementType, List<?>... lists) {
        return NestedColumnFactory.fromLists(DEFAULT_ALLOCATOR, elementType, lists);
    }

    /**
     * Create a {@link DType#STRUCT} column without nulls of its own. All children must
     * have the same row count.
     */
    public static ColumnVector makeStruct(ColumnVector... children) {
        if (children.length == 0) {
            throw new IllegalArgumentException("A struct without a null mask needs at least one child");
        }
        return assemble(DType.STRUCT, children[0].getRowCount(), null, null, Validity.allValid(), 0,
                Arrays.asList(children));
    }

    /**
     * Create a {@link DType#STRUCT} column whose own validity is a copy of {@code mask}.
     * The children are not modified: a null struct row does not make its children null.
     */
    public static ColumnVector makeStruct(NullMask mask, ColumnVector... children) {
        int nulls = mask.nullCount();
        Validity structValidity = nulls == 0
                ? Validity.allValid()
                : NestedColumnFactory.copyValidity(DEFAULT_ALLOCATOR, mask.bits(), mask.length());
        return assemble(DType.STRUCT, mask.length(), null, null, structValidity, nulls, Arrays.asList(children));
    }

    // ==================== Factories from raw buffers ====================

    /**
     * Create a fixed-width column over a raw data buffer and an optional validity bitmap.
     * <p>
     * The data buffer is taken over as-is. The validity bitmap is copied into a padded
     * allocation so that bits past {@code rowCount} read as valid. {@code nullCount} may
     * be {@link #UNKNOWN_NULL_COUNT}, in which case it is counted on first use.
     *
     * @throws IllegalArgumentException if a known {@code nullCount} disagrees with the bitmap
     * </p>
     */
    public static ColumnVector fromRaw(DType type, int rowCount, MemoryBuffer data, MemoryBuffer validityOrNull,
                                       int nullCount) {
        if (!type.isFixedWidth()) {
            throw new IllegalArgumentException("Raw data columns must be fixed-width, got " + type);
        }
        return assemble(type, rowCount, data, null, NestedColumnFactory.copyValidity(DEFAULT_ALLOCATOR,
                validityOrNull, rowCount), maskNullCount(validityOrNull, nullCount), List.of());
    }

    /**
     * Create a {@link DType#LIST} column from raw offsets ({@code rowCount + 1} ints), an
     * optional validity bitmap and a child. Null rows spanning child rows are purged.
     */
    public static ColumnVector makeList(int rowCount, MemoryBuffer offsets, MemoryBuffer validityOrNull,
                                        int nullCount, ColumnVector child) {
        return NestedColumnFactory.fromRawOffsets(DEFAULT_ALLOCATOR, DType.LIST, rowCount, offsets,
                validityOrNull, maskNullCount(validityOrNull, nullCount), child);
    }

    /**
     * Create a {@link DType#STRING} column from raw offsets, an optional validity bitmap and
     * the UTF-8 bytes of all rows. Null rows spanning bytes are purged.
     */
    public static ColumnVector makeStrings(int rowCount, MemoryBuffer offsets, MemoryBuffer validityOrNull,
                                           int nullCount, MemoryBuffer chars) {
        ColumnVector child = assemble(DType.INT8, chars.length(), chars, null, Validity.allValid(), 0, List.of());
        return NestedColumnFactory.fromRawOffsets(DEFAULT_ALLOCATOR, DType.STRING, rowCount, offsets,
                validityOrNull, maskNullCount(validityOrNull, nullCount), child);
    }

    private static int maskNullCount(MemoryBuffer validityOrNull, int nullCount) {
        return validityOrNull == null ? 0 : nullCount;
    }

    // ==================== Operations ====================

    /**
     * Concatenate columns of the same type into a new column. Row count and null count of
     * the result are the sums of those of the inputs.
     */
    public static ColumnVector concatenate(ColumnVector... columns) {
        return new ColumnConcatenator(DEFAULT_ALLOCATOR, Runnable::run).concatenate(Arrays.asList(columns));
    }

    /**
     * Concatenate columns using the allocator of {@code context}; data buffer copies run
     * on its executor and have all completed when this method returns.
     */
    public static ColumnVector concatenate(SapwoodContext context, ColumnVector... columns) {
        return new ColumnConcatenator(context.allocator(), context.executor()).concatenate(Arrays.asList(columns));
    }

    /**
     * Copy rows {@code [from, to)} into a new column.
     */
    public ColumnVector slice(int from, int to) {
        Objects.checkFromToIndex(from, to, rowCount);
        return new ColumnSlicer(DEFAULT_ALLOCATOR).slice(this, from, to);
    }

    /**
     * Combine {@code mask} into the validity of this column with a bitwise AND. For struct
     * columns the combined validity is pushed into every struct descendant. String and
     * list columns reached this way have their null rows emptied.
     *
     * @throws IllegalArgumentException if the mask length differs from the row count
     */
    public ColumnVector superimposeNulls(NullMask mask) {
        return new NullSuperimposer(DEFAULT_ALLOCATOR).superimpose(this, mask);
    }

    /**
     * Whether any string or list column in this tree has a null row spanning child rows.
     */
    public boolean hasNonEmptyNulls() {
        return NonEmptyNullPurger.hasNonEmptyNulls(this);
    }

    /**
     * Return a column in which every null string or list row spans zero child rows.
     * Returns this column if there is nothing to purge.
     */
    public ColumnVector purgeNonEmptyNulls() {
        return new NonEmptyNullPurger(DEFAULT_ALLOCATOR).purge(this);
    }

    // ==================== Metadata ====================

    public DType getType() {
        return type;
    }

    public int getRowCount() {
        return rowCount;
    }

    /**
     * Number of null rows, counted from the validity bitmap on first call if unknown.
     */
    public int getNullCount() {
        int count = nullCount;
        if (count == UNKNOWN_NULL_COUNT) {
            count = validity instanceof Validity.Bitmap bitmap
                    ? ValidityBitmap.countZeroBits(bitmap.bits(), rowCount)
                    : 0;
            nullCount = count;
        }
        return count;
    }

    public boolean hasNulls() {
        return getNullCount() > 0;
    }

    public boolean hasValidityVector() {
        return validity instanceof Validity.Bitmap;
    }

    public Validity getValidity() {
        return validity;
    }

    /** Read-only data buffer; {@code null} for nested types. */
    public MemoryBuffer getData() {
        return data;
    }

    /** Read-only offsets buffer; {@code null} unless the type is STRING or LIST. */
    public MemoryBuffer getOffsets() {
        return offsets;
    }

    public int getNumChildren() {
        return children.size();
    }

    public ColumnVector getChild(int index) {
        Objects.checkIndex(index, children.size());
        return children.get(index);
    }

    public List<ColumnVector> getChildren() {
        return children;
    }

    // ==================== Row access ====================

    public boolean isNull(int index) {
        Objects.checkIndex(index, rowCount);
        return !validity.isValid(index);
    }

    public boolean isValid(int index) {
        return !isNull(index);
    }

    /**
     * Null check that also accepts rows past the row count, up to the end of the validity
     * bitmap's allocation. Padding rows always read as not null.
     */
    public boolean isNullExtendedRange(long index) {
        long limit = validity instanceof Validity.Bitmap bitmap
                ? bitmap.bits().length() * 8L
                : Math.max(rowCount, ValidityBitmap.allocationSizeInBytes(rowCount) * 8L);
        Objects.checkIndex(index, limit);
        return !validity.isValid(index);
    }

    public byte getByte(int index) {
        checkRead(index, Storage.BYTE);
        return data.getByte(index);
    }

    public short getShort(int index) {
        checkRead(index, Storage.SHORT);
        return data.getShort(index * Short.BYTES);
    }

    public int getInt(int index) {
        checkRead(index, Storage.INT);
        return data.getInt(index * Integer.BYTES);
    }

    public long getLong(int index) {
        checkRead(index, Storage.LONG);
        return data.getLong(index * Long.BYTES);
    }

    public float getFloat(int index) {
        checkRead(index, Storage.FLOAT);
        return data.getFloat(index * Float.BYTES);
    }

    public double getDouble(int index) {
        checkRead(index, Storage.DOUBLE);
        return data.getDouble(index * Double.BYTES);
    }

    public boolean getBoolean(int index) {
        if (type != DType.BOOL8) {
            throw new IllegalStateException("Cannot read a boolean from a column of type " + type);
        }
        Objects.checkIndex(index, rowCount);
        return data.getByte(index) != 0;
    }

    public int getUnsignedByte(int index) {
        return UnsignedConverter.toUnsignedInt(getByte(index));
    }

    public int getUnsignedShort(int index) {
        return UnsignedConverter.toUnsignedInt(getShort(index));
    }

    public long getUnsignedInt(int index) {
        return UnsignedConverter.toUnsignedLong(getInt(index));
    }

    public BigInteger getUnsignedLong(int index) {
        return UnsignedConverter.toUnsignedBigInteger(getLong(index));
    }

    /**
     * UTF-8 bytes of a string row, or {@code null} for a null row.
     */
    public byte[] getUTF8(int index) {
        if (type != DType.STRING) {
            throw new IllegalStateException("Cannot read a string from a column of type " + type);
        }
        if (isNull(index)) {
            return null;
        }
        int start = offsets.getInt(index * Integer.BYTES);
        int end = offsets.getInt((index + 1) * Integer.BYTES);
        byte[] bytes = new byte[end - start];
        children.get(0).getData().copyTo(start, bytes, 0, bytes.length);
        return bytes;
    }

    public String getJavaString(int index) {
        byte[] bytes = getUTF8(index);
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    /** First child row of a string or list row. */
    public int getListStart(int index) {
        checkOffsets(index);
        return offsets.getInt(index * Integer.BYTES);
    }

    /** Number of child rows of a string or list row; 0 for null rows. */
    public int getListSize(int index) {
        checkOffsets(index);
        return offsets.getInt((index + 1) * Integer.BYTES) - offsets.getInt(index * Integer.BYTES);
    }

    /**
     * Boxed elements of a list row, or {@code null} for a null row.
     */
    public List<Object> getList(int index) {
        if (type != DType.LIST) {
            throw new IllegalStateException("Cannot read a list from a column of type " + type);
        }
        if (isNull(index)) {
            return null;
        }
        int start = getListStart(index);
        int size = getListSize(index);
        ColumnVector child = children.get(0);
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(child.getValue(start + i));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Boxed value of a row of any type, or {@code null} for a null row. Struct rows are
     * returned as the list of their field values.
     */
    public Object getValue(int index) {
        if (isNull(index)) {
            return null;
        }
        return switch (type) {
            case BOOL8 -> getBoolean(index);
            case STRING -> getJavaString(index);
            case LIST -> getList(index);
            case STRUCT -> {
                List<Object> fields = new ArrayList<>(children.size());
                for (ColumnVector child : children) {
                    fields.add(child.getValue(index));
                }
                yield Collections.unmodifiableList(fields);
            }
            default -> switch (type.storage()) {
                case BYTE -> getByte(index);
                case SHORT -> getShort(index);
                case INT -> getInt(index);
                case LONG -> getLong(index);
                case FLOAT -> getFloat(index);
                case DOUBLE -> getDouble(index);
                case NONE -> throw new IllegalStateException("No storage for " + type);
            };
        };
    }

    private void checkRead(int index, Storage storage) {
        if (type.storage() != storage) {
            throw new IllegalStateException("Cannot read " + storage.name().toLowerCase()
                    + " values from a column of type " + type);
        }
        Objects.checkIndex(index, rowCount);
    }

    private void checkOffsets(int index) {
        if (!type.hasOffsets()) {
            throw new IllegalStateException("Column of type " + type + " has no offsets");
        }
        Objects.checkIndex(index, rowCount);
    }

    @Override
    public String toString() {
        return "ColumnVector{type=" + type + ", rows=" + rowCount + ", nulls="
                + (nullCount == UNKNOWN_NULL_COUNT ? "unknown" : String.valueOf(nullCount))
                + ", children=" + children.size() + "}";
    }
}
