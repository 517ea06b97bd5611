/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.buffer;

import java.util.Objects;

import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Fixed-stride element storage with a logical length distinct from its physical capacity.
 * <p>
 * Elements are appended at {@link #length()}. The append methods assume room for the
 * element; callers either check {@link #remaining()} first (fixed-capacity builders) or
 * call {@link #ensureCapacity(int)} (growable buffers such as string characters and
 * list offsets).
 * </p>
 */
public final class TypedBuffer {

    private static final int MIN_GROWTH = 16;

    private final BufferAllocator allocator;
    private final int stride;
    private MemoryBuffer buffer;
    private int capacity;
    private int length;

    public TypedBuffer(BufferAllocator allocator, int stride, int capacity) {
        if (stride <= 0) {
            throw new IllegalArgumentException("Stride must be positive: " + stride);
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
        }
        this.allocator = allocator;
        this.stride = stride;
        this.capacity = capacity;
        this.buffer = allocator.allocate(Math.multiplyExact(capacity, stride));
    }

    public int capacity() {
        return capacity;
    }

    public int length() {
        return length;
    }

    public int remaining() {
        return capacity - length;
    }

    public MemoryBuffer buffer() {
        return buffer;
    }

    /**
     * Grow the buffer so that it can hold at least {@code required} elements. Growth at
     * least doubles the capacity; the first {@link #length()} elements are preserved.
     */
    public void ensureCapacity(int required) {
        if (required <= capacity) {
            return;
        }
        int grown = (int) Math.min(Integer.MAX_VALUE / stride, Math.max((long) capacity * 2, MIN_GROWTH));
        int newCapacity = Math.max(required, grown);
        MemoryBuffer grownBuffer = allocator.allocate(Math.multiplyExact(newCapacity, stride));
        grownBuffer.copyFrom(0, buffer, 0, length * stride);
        buffer = grownBuffer;
        capacity = newCapacity;
    }

    public void appendByte(byte value) {
        buffer.putByte(length * stride, value);
        length++;
    }

    public void appendShort(short value) {
        buffer.putShort(length * stride, value);
        length++;
    }

    public void appendInt(int value) {
        buffer.putInt(length * stride, value);
        length++;
    }

    public void appendLong(long value) {
        buffer.putLong(length * stride, value);
        length++;
    }

    public void appendFloat(float value) {
        buffer.putFloat(length * stride, value);
        length++;
    }

    public void appendDouble(double value) {
        buffer.putDouble(length * stride, value);
        length++;
    }

    /**
     * Append one element whose bytes are all zero.
     */
    public void appendZero() {
        buffer.fill(length * stride, stride, (byte) 0);
        length++;
    }

    /**
     * Append {@code count} elements copied from {@code src}, starting at element {@code srcIndex}.
     */
    public void appendElements(MemoryBuffer src, int srcIndex, int count) {
        int bytes = Math.multiplyExact(count, stride);
        Objects.checkFromIndexSize(Math.multiplyExact(srcIndex, stride), bytes, src.length());
        buffer.copyFrom(length * stride, src, srcIndex * stride, bytes);
        length += count;
    }

    /**
     * Append raw bytes. Only valid for a stride of one.
     */
    public void appendBytes(byte[] bytes) {
        if (stride != 1) {
            throw new IllegalStateException("Raw bytes can only be appended to a byte buffer, stride is " + stride);
        }
        buffer.copyFrom(length, bytes, 0, bytes.length);
        length += bytes.length;
    }

    public int getInt(int index) {
        return buffer.getInt(index * stride);
    }
}
