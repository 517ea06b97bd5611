/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

/**
 * Column data types.
 * <p>
 * Fixed-width types store one element per row in the data buffer. Nested types carry
 * no data buffer of their own: {@link #STRING} and {@link #LIST} hold an offsets buffer
 * plus exactly one child, {@link #STRUCT} holds one child per field.
 * </p>
 * <p>
 * There are no unsigned integer types. Unsigned values are stored in the signed type of
 * the same width with an identical bit pattern and reinterpreted when read.
 * </p>
 */
public enum DType {

    BOOL8(1, Storage.BYTE),
    INT8(1, Storage.BYTE),
    INT16(2, Storage.SHORT),
    INT32(4, Storage.INT),
    INT64(8, Storage.LONG),
    FLOAT32(4, Storage.FLOAT),
    FLOAT64(8, Storage.DOUBLE),
    TIMESTAMP_DAYS(4, Storage.INT),
    TIMESTAMP_SECONDS(8, Storage.LONG),
    TIMESTAMP_MILLISECONDS(8, Storage.LONG),
    TIMESTAMP_MICROSECONDS(8, Storage.LONG),
    TIMESTAMP_NANOSECONDS(8, Storage.LONG),
    STRING(0, Storage.NONE),
    LIST(0, Storage.NONE),
    STRUCT(0, Storage.NONE);

    /**
     * Java primitive used to store and read one element.
     */
    public enum Storage {
        BYTE,
        SHORT,
        INT,
        LONG,
        FLOAT,
        DOUBLE,
        NONE
    }

    private final int sizeInBytes;
    private final Storage storage;

    DType(int sizeInBytes, Storage storage) {
        this.sizeInBytes = sizeInBytes;
        this.storage = storage;
    }

    /** Element size in bytes; 0 for nested types. */
    public int sizeInBytes() {
        return sizeInBytes;
    }

    public Storage storage() {
        return storage;
    }

    public boolean isFixedWidth() {
        return storage != Storage.NONE;
    }

    /** Whether the type carries an offsets buffer and a single child. */
    public boolean hasOffsets() {
        return this == STRING || this == LIST;
    }

    /** Signed integer types, the only ones with an unsigned reading. */
    public boolean isIntegral() {
        return this == INT8 || this == INT16 || this == INT32 || this == INT64;
    }
}
