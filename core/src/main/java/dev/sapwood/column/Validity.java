/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Null tracking of a column: either no bitmap at all (every row valid) or a bit-packed
 * bitmap with one bit per row.
 */
public sealed interface Validity permits Validity.AllValid, Validity.Bitmap {

    /** Whether the row at {@code index} is valid. Bounds are not checked. */
    boolean isValid(long index);

    static Validity allValid() {
        return AllValid.INSTANCE;
    }

    /**
     * No bitmap is allocated; every row is valid.
     */
    record AllValid() implements Validity {

        static final AllValid INSTANCE = new AllValid();

        @Override
        public boolean isValid(long index) {
            return true;
        }
    }

    /**
     * Bit-packed validity, LSB-first; a set bit marks a valid row.
     */
    record Bitmap(MemoryBuffer bits) implements Validity {

        @Override
        public boolean isValid(long index) {
            return ValidityBitmap.isValid(bits, index);
        }
    }
}
