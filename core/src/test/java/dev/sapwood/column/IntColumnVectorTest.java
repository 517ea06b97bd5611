/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import java.util.Random;

import org.junit.jupiter.api.Test;

import dev.sapwood.internal.validity.ValidityBitmap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

class IntColumnVectorTest {

    @Test
    void buildShortOfCapacity() {
        ColumnVector column = ColumnVector.build(DType.INT32, 3, b -> b.append(1));

        assertThat(column.hasNulls()).isFalse();
        assertThat(column.hasValidityVector()).isFalse();
        assertThat(column.getRowCount()).isEqualTo(1);
        assertThat(column.getInt(0)).isEqualTo(1);
    }

    @Test
    void fromInts() {
        ColumnVector column = ColumnVector.fromInts(2, 3, 5);

        assertThat(column.hasNulls()).isFalse();
        assertThat(column.getInt(0)).isEqualTo(2);
        assertThat(column.getInt(1)).isEqualTo(3);
        assertThat(column.getInt(2)).isEqualTo(5);
    }

    @Test
    void unsignedIntsKeepTheirBitPattern() {
        ColumnVector column = ColumnVector.fromUnsignedInts(0xfedcba98, 0x80000000, 5);

        assertThat(column.hasNulls()).isFalse();
        assertThat(column.getUnsignedInt(0)).isEqualTo(0xfedcba98L);
        assertThat(column.getUnsignedInt(1)).isEqualTo(0x80000000L);
        assertThat(column.getUnsignedInt(2)).isEqualTo(5L);
        assertThat(Integer.toUnsignedLong(column.getInt(0))).isEqualTo(0xfedcba98L);
    }

    @Test
    void upperIndexOutOfBounds() {
        ColumnVector column = ColumnVector.fromInts(2, 3, 5);

        assertThatThrownBy(() -> column.getInt(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> column.isNull(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(column.hasNulls()).isFalse();
    }

    @Test
    void lowerIndexOutOfBounds() {
        ColumnVector column = ColumnVector.fromInts(2, 3, 5);

        assertThat(column.hasNulls()).isFalse();
        assertThatThrownBy(() -> column.getInt(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void addingNullValues() {
        ColumnVector column = ColumnVector.fromBoxedInts(2, 3, 4, 5, 6, 7, null, null);

        assertThat(column.hasNulls()).isTrue();
        assertThat(column.getNullCount()).isEqualTo(2);
        for (int i = 0; i < 6; i++) {
            assertThat(column.isNull(i)).isFalse();
        }
        assertThat(column.isNull(6)).isTrue();
        assertThat(column.isNull(7)).isTrue();
        assertThat(column.getValue(6)).isNull();
    }

    @Test
    void addingUnsignedNullValues() {
        ColumnVector column = ColumnVector.fromBoxedUnsignedInts(2, 3, 4, 5, 0xfedbca98, 0x80000000, null, null);

        assertThat(column.hasNulls()).isTrue();
        assertThat(column.getNullCount()).isEqualTo(2);
        for (int i = 0; i < 6; i++) {
            assertThat(column.isNull(i)).isFalse();
        }
        assertThat(column.getUnsignedInt(4)).isEqualTo(0xfedbca98L);
        assertThat(column.getUnsignedInt(5)).isEqualTo(0x80000000L);
        assertThat(column.isNull(6)).isTrue();
        assertThat(column.isNull(7)).isTrue();
    }

    @Test
    void overrunningTheBuffer() {
        ColumnBuilder builder = ColumnVector.builder(DType.INT32, 3);

        assertThatThrownBy(() -> builder.append(2).appendNull().appendArray(new int[]{ 5, 4 }).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Capacity exceeded");
        assertThat(builder.getRowCount()).isEqualTo(2);
    }

    @Test
    void appendVector() {
        Random random = new Random(192312989128L);
        for (int dstSize = 1; dstSize <= 100; dstSize++) {
            for (int dstPrefilledSize = 0; dstPrefilledSize < dstSize; dstPrefilledSize++) {
                int srcSize = dstSize - dstPrefilledSize;
                for (int sizeOfDataNotToAdd = 0; sizeOfDataNotToAdd <= dstPrefilledSize; sizeOfDataNotToAdd++) {
                    ColumnBuilder dst = ColumnVector.builder(DType.INT32, dstSize);
                    ColumnVector src = ColumnVector.build(DType.INT32, srcSize, b -> {
                        for (int i = 0; i < srcSize; i++) {
                            if (random.nextBoolean()) {
                                b.appendNull();
                            }
                            else {
                                b.append(random.nextInt());
                            }
                        }
                    });
                    ColumnBuilder expectedBuilder = ColumnVector.builder(DType.INT32, dstPrefilledSize);
                    int prefix = dstPrefilledSize - sizeOfDataNotToAdd;
                    for (int i = 0; i < prefix; i++) {
                        if (random.nextBoolean()) {
                            dst.appendNull();
                            expectedBuilder.appendNull();
                        }
                        else {
                            int value = random.nextInt();
                            dst.append(value);
                            expectedBuilder.append(value);
                        }
                    }

                    dst.append(src);
                    ColumnVector actual = dst.build();
                    ColumnVector expected = expectedBuilder.build();

                    assertThat(actual.getRowCount()).isEqualTo(prefix + srcSize);
                    assertThat(actual.getNullCount()).isEqualTo(expected.getNullCount() + src.getNullCount());
                    for (int i = 0; i < prefix; i++) {
                        if (actual.isNull(i) != expected.isNull(i)
                                || (!expected.isNull(i) && actual.getInt(i) != expected.getInt(i))) {
                            fail("Prefilled row %d differs (dstSize=%d, prefilled=%d)", i, dstSize, dstPrefilledSize);
                        }
                    }
                    for (int j = 0; j < srcSize; j++) {
                        if (actual.isNull(prefix + j) != src.isNull(j)
                                || (!src.isNull(j) && actual.getInt(prefix + j) != src.getInt(j))) {
                            fail("Appended row %d differs (dstSize=%d, prefilled=%d)", j, dstSize, dstPrefilledSize);
                        }
                    }
                    if (actual.hasValidityVector()) {
                        long maxIndex = ValidityBitmap.allocationSizeInBytes(actual.getRowCount()) * 8L;
                        for (long i = actual.getRowCount(); i < maxIndex; i++) {
                            if (actual.isNullExtendedRange(i)) {
                                fail("Padding row %d is null (dstSize=%d, prefilled=%d)", i, dstSize, dstPrefilledSize);
                            }
                        }
                    }
                }
            }
        }
    }
}
