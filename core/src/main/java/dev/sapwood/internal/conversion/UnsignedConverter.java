/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.conversion;

import java.math.BigInteger;

import dev.sapwood.column.DType;

/**
 * Reinterprets signed integer storage as unsigned values and back.
 * <p>
 * Unsigned columns are stored in the signed type of the same width. Conversions here
 * never change the stored bit pattern: writing the unsigned value {@code V} produces the
 * same bytes as writing the two's-complement signed value with the same bits.
 * </p>
 */
public final class UnsignedConverter {

    private static final BigInteger TWO_POW_64 = BigInteger.ONE.shiftLeft(64);

    private UnsignedConverter() {
    }

    public static int toUnsignedInt(byte value) {
        return Byte.toUnsignedInt(value);
    }

    public static int toUnsignedInt(short value) {
        return Short.toUnsignedInt(value);
    }

    public static long toUnsignedLong(int value) {
        return Integer.toUnsignedLong(value);
    }

    public static BigInteger toUnsignedBigInteger(long value) {
        BigInteger result = BigInteger.valueOf(value);
        return value >= 0 ? result : result.add(TWO_POW_64);
    }

    /**
     * Validate that {@code unsignedValue} is representable in the unsigned range of
     * {@code type} and return the bit pattern to store. For {@link DType#INT64} every
     * {@code long} is accepted and taken as a raw 64-bit pattern.
     *
     * @throws IllegalArgumentException if the type is not an integer type or the value
     *         does not fit
     */
    public static long toStoredBits(long unsignedValue, DType type) {
        if (!type.isIntegral()) {
            throw new IllegalArgumentException("Unsigned values require an integer type, got " + type);
        }
        if (type == DType.INT64) {
            return unsignedValue;
        }
        long max = (1L << (type.sizeInBytes() * 8)) - 1;
        if (unsignedValue < 0 || unsignedValue > max) {
            throw new IllegalArgumentException(
                    "Unsigned value " + unsignedValue + " out of range for " + type + " (0.." + max + ")");
        }
        return unsignedValue;
    }
}
