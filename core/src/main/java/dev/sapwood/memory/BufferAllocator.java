/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.memory;

import java.nio.ByteBuffer;

/**
 * Source of {@link MemoryBuffer}s for data, offsets and validity buffers.
 * <p>
 * Buffers returned by an allocator are zero-filled. Release is left to the garbage
 * collector; the column model never frees a buffer explicitly.
 * </p>
 */
@FunctionalInterface
public interface BufferAllocator {

    /**
     * Allocate a zero-filled buffer of exactly {@code bytes} bytes.
     *
     * @throws IllegalArgumentException if {@code bytes} is negative
     */
    MemoryBuffer allocate(int bytes);

    /**
     * Allocator backed by heap byte arrays.
     */
    static BufferAllocator heap() {
        return bytes -> {
            checkSize(bytes);
            return MemoryBuffer.wrap(ByteBuffer.allocate(bytes));
        };
    }

    /**
     * Allocator backed by direct (off-heap) byte buffers.
     */
    static BufferAllocator direct() {
        return bytes -> {
            checkSize(bytes);
            return MemoryBuffer.wrap(ByteBuffer.allocateDirect(bytes));
        };
    }

    private static void checkSize(int bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Allocation size cannot be negative: " + bytes);
        }
    }
}
