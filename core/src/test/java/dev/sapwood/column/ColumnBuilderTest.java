/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnBuilderTest {

    @Test
    void bitmapIsOnlyAllocatedOnFirstNull() {
        ColumnVector noNulls = ColumnVector.build(DType.INT64, 4, b -> b.append(1L).append(2L));
        ColumnVector withNull = ColumnVector.build(DType.INT64, 4, b -> b.append(1L).append(2L).appendNull());

        assertThat(noNulls.hasValidityVector()).isFalse();
        assertThat(noNulls.getValidity()).isSameAs(Validity.allValid());
        assertThat(withNull.hasValidityVector()).isTrue();
        assertThat(withNull.isValid(0)).isTrue();
        assertThat(withNull.isValid(1)).isTrue();
        assertThat(withNull.isNull(2)).isTrue();
        assertThat(withNull.getNullCount()).isEqualTo(1);
    }

    @Test
    void nullRowsAreZeroFilled() {
        ColumnVector column = ColumnVector.fromBoxedDoubles(1.5, null, -2.0);

        assertThat(column.getData().getLong(Double.BYTES)).isZero();
        assertThat(column.getDouble(2)).isEqualTo(-2.0);
    }

    @Test
    void capacityExceededLeavesBuilderUsable() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT16, 2);
        builder.append((short) 1);

        assertThatThrownBy(() -> builder.appendArray((short) 2, (short) 3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Capacity exceeded");
        assertThatThrownBy(() -> builder.appendBoxed((short) 2, null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(builder.getRowCount()).isEqualTo(1);
        assertThat(builder.getNullCount()).isZero();

        builder.appendNull();
        assertThatThrownBy(builder::appendNull).isInstanceOf(IllegalStateException.class);

        ColumnVector column = builder.build();
        assertThat(column.getRowCount()).isEqualTo(2);
        assertThat(column.getShort(0)).isEqualTo((short) 1);
        assertThat(column.isNull(1)).isTrue();
    }

    @Test
    void builderCannotBeUsedAfterBuild() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT8, 2);
        builder.append((byte) 1);
        builder.build();

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.append((byte) 2)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyBuild() {
        ColumnVector column = ColumnBuilder.create(DType.FLOAT32, 0).build();

        assertThat(column.getRowCount()).isZero();
        assertThat(column.getNullCount()).isZero();
    }

    @Test
    void shortBuildKeepsPaddingValid() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT32, 100);
        for (int i = 0; i < 10; i++) {
            builder.appendNull();
        }

        ColumnVector column = builder.build();

        assertThat(column.getRowCount()).isEqualTo(10);
        assertThat(column.getNullCount()).isEqualTo(10);
        ColumnAssertions.assertPaddingIsValid(column);
    }

    @Test
    void valueOfWrongWidthIsRejected() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT32, 2);

        assertThatThrownBy(() -> builder.append(1L)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.append(true)).isInstanceOf(IllegalStateException.class);
        assertThat(builder.getRowCount()).isZero();
    }

    @Test
    void nestedTypesHaveNoBuilder() {
        assertThatThrownBy(() -> ColumnBuilder.create(DType.STRING, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnBuilder.create(DType.STRUCT, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnBuilder.create(DType.INT8, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unsignedAppendsStoreTheBitPattern() {
        ColumnVector bytes = ColumnVector.build(DType.INT8, 2, b -> b.appendUnsigned(255).appendUnsigned(7));
        ColumnVector longs = ColumnVector.build(DType.INT64, 2, b -> b.appendBoxedUnsigned(-1L, null));

        assertThat(bytes.getByte(0)).isEqualTo((byte) -1);
        assertThat(bytes.getUnsignedByte(0)).isEqualTo(255);
        assertThat(bytes.getUnsignedByte(1)).isEqualTo(7);
        assertThat(longs.getUnsignedLong(0)).isEqualTo(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE));
        assertThat(longs.isNull(1)).isTrue();
    }

    @Test
    void unsignedValueOutOfRangeIsRejectedBeforeWriting() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT16, 4);

        assertThatThrownBy(() -> builder.appendUnsigned(65536)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.appendBoxedUnsigned(1L, 70000L)).isInstanceOf(IllegalArgumentException.class);
        assertThat(builder.getRowCount()).isZero();
    }

    @Test
    void booleans() {
        ColumnVector column = ColumnVector.fromBoxedBooleans(true, null, false);

        assertThat(column.getType()).isEqualTo(DType.BOOL8);
        assertThat(column.getBoolean(0)).isTrue();
        assertThat(column.isNull(1)).isTrue();
        assertThat(column.getBoolean(2)).isFalse();
        assertThat(column.getValue(0)).isEqualTo(Boolean.TRUE);
    }

    @Test
    void appendColumnOfDifferentTypeFails() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT32, 4);

        assertThatThrownBy(() -> builder.append(ColumnVector.fromLongs(1L)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.append(ColumnVector.timestampDaysFromInts(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void appendColumnAfterNulls() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT32, 12);
        builder.appendNull().append(1).appendNull();

        builder.append(ColumnVector.fromBoxedInts(10, null, 12, 13, null, 15, 16, 17, null));

        ColumnVector column = builder.build();
        ColumnAssertions.assertColumnsAreEqual(
                ColumnVector.fromBoxedInts(null, 1, null, 10, null, 12, 13, null, 15, 16, 17, null), column);
        assertThat(column.getNullCount()).isEqualTo(5);
    }

    @Test
    void appendRawColumnKeepsItsNulls() {
        MemoryBuffer data = BufferAllocator.heap().allocate(3 * Long.BYTES);
        data.putLong(0, 10L);
        data.putLong(16, 30L);
        ColumnVector raw = ColumnVector.fromRaw(DType.INT64, 3, data, MemoryBuffer.wrap(new byte[]{ 0b101 }), 1);

        ColumnVector column = ColumnVector.build(DType.INT64, 4, b -> b.append(raw).append(40L));

        ColumnAssertions.assertColumnsAreEqual(ColumnVector.fromBoxedLongs(10L, null, 30L, 40L), column);
    }

    @Test
    void booleanColumnsOnlyTakeBooleans() {
        ColumnBuilder builder = ColumnBuilder.create(DType.BOOL8, 4);

        assertThatThrownBy(() -> builder.append((byte) 7)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.appendArray((byte) 1, (byte) 0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.appendBoxed((byte) 1)).isInstanceOf(IllegalStateException.class);
        assertThat(builder.getRowCount()).isZero();

        builder.append(true).appendBulk(MemoryBuffer.wrap(new byte[]{ 0, 7 }), null, 2);
        ColumnVector column = builder.build();
        assertThat(column.getBoolean(0)).isTrue();
        assertThat(column.getBoolean(1)).isFalse();
        assertThat(column.getBoolean(2)).isTrue();
    }

    @Test
    void appendBulkFromRawBuffers() {
        MemoryBuffer data = BufferAllocator.heap().allocate(5 * Integer.BYTES);
        for (int i = 0; i < 5; i++) {
            data.putInt(i * Integer.BYTES, i * 100);
        }
        MemoryBuffer validity = MemoryBuffer.wrap(new byte[]{ 0b0001_0101 });

        ColumnVector column = ColumnVector.build(DType.INT32, 6, b -> b.append(-1).appendBulk(data, validity, 5));

        assertThat(column.getRowCount()).isEqualTo(6);
        assertThat(column.getNullCount()).isEqualTo(2);
        assertThat(column.isValid(0)).isTrue();
        assertThat(column.getInt(1)).isZero();
        assertThat(column.isNull(2)).isTrue();
        assertThat(column.getInt(3)).isEqualTo(200);
        assertThat(column.isNull(4)).isTrue();
        assertThat(column.getInt(5)).isEqualTo(400);
        ColumnAssertions.assertPaddingIsValid(column);
    }

    @Test
    void appendBulkWithoutValidity() {
        MemoryBuffer data = MemoryBuffer.wrap(new byte[]{ 1, 2, 3 });

        ColumnVector column = ColumnVector.build(DType.INT8, 4, b -> b.appendNull().appendBulk(data, null, 3));

        assertThat(column.getNullCount()).isEqualTo(1);
        assertThat(column.isNull(0)).isTrue();
        assertThat(column.getByte(3)).isEqualTo((byte) 3);
    }

    @Test
    void appendBulkRejectsShortSources() {
        ColumnBuilder builder = ColumnBuilder.create(DType.INT32, 4);

        assertThatThrownBy(() -> builder.appendBulk(MemoryBuffer.wrap(new byte[7]), null, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.appendBulk(MemoryBuffer.wrap(new byte[36]), null, 9))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Capacity exceeded");

        ColumnBuilder wide = ColumnBuilder.create(DType.INT32, 16);
        assertThatThrownBy(() -> wide.appendBulk(MemoryBuffer.wrap(new byte[36]), MemoryBuffer.wrap(new byte[1]), 9))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(wide.getRowCount()).isZero();
    }

    @Test
    void directAllocator() {
        ColumnBuilder builder = ColumnBuilder.create(DType.FLOAT64, 70, BufferAllocator.direct());
        for (int i = 0; i < 70; i++) {
            if (i % 7 == 0) {
                builder.appendNull();
            }
            else {
                builder.append((double) i);
            }
        }

        ColumnVector column = builder.build();

        assertThat(column.getData().isDirect()).isTrue();
        assertThat(column.getNullCount()).isEqualTo(10);
        assertThat(column.getDouble(69)).isEqualTo(69.0);
        assertThat(ValidityBitmap.countZeroBits(((Validity.Bitmap) column.getValidity()).bits(), 70)).isEqualTo(10);
    }
}
