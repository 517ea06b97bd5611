/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Value-level comparison of columns, recursing into children.
 */
public final class ColumnAssertions {

    private ColumnAssertions() {
    }

    public static void assertColumnsAreEqual(ColumnVector expected, ColumnVector actual) {
        assertColumnsAreEqual(expected, actual, "column");
    }

    private static void assertColumnsAreEqual(ColumnVector expected, ColumnVector actual, String path) {
        assertThat(actual.getType()).as("%s type", path).isEqualTo(expected.getType());
        assertThat(actual.getRowCount()).as("%s row count", path).isEqualTo(expected.getRowCount());
        assertThat(actual.getNullCount()).as("%s null count", path).isEqualTo(expected.getNullCount());
        for (int row = 0; row < expected.getRowCount(); row++) {
            assertThat(actual.isNull(row)).as("%s null flag of row %d", path, row).isEqualTo(expected.isNull(row));
            if (expected.getType().hasOffsets()) {
                assertThat(actual.getListSize(row)).as("%s size of row %d", path, row)
                        .isEqualTo(expected.getListSize(row));
            }
            if (expected.getType().isFixedWidth() && !expected.isNull(row)) {
                assertThat(actual.getValue(row)).as("%s value of row %d", path, row).isEqualTo(expected.getValue(row));
            }
        }
        assertPaddingIsValid(actual, path);

        assertThat(actual.getNumChildren()).as("%s child count", path).isEqualTo(expected.getNumChildren());
        if (expected.getType().hasOffsets()) {
            // children may differ in layout; compare the rows each parent row spans
            for (int row = 0; row < expected.getRowCount(); row++) {
                if (!expected.isNull(row)) {
                    assertThat(actual.getValue(row)).as("%s value of row %d", path, row)
                            .isEqualTo(expected.getValue(row));
                }
            }
        }
        else {
            for (int i = 0; i < expected.getNumChildren(); i++) {
                assertColumnsAreEqual(expected.getChild(i), actual.getChild(i), path + ".child" + i);
            }
        }
    }

    /**
     * Every bit of the validity allocation past the row count must read as valid.
     */
    public static void assertPaddingIsValid(ColumnVector column) {
        assertPaddingIsValid(column, "column");
    }

    private static void assertPaddingIsValid(ColumnVector column, String path) {
        if (column.getValidity() instanceof Validity.Bitmap bitmap) {
            long limit = bitmap.bits().length() * 8L;
            for (long i = column.getRowCount(); i < limit; i++) {
                assertThat(column.isNullExtendedRange(i)).as("%s padding bit %d", path, i).isFalse();
            }
        }
    }
}
