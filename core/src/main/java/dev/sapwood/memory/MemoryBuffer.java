/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.memory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * A fixed-length, little-endian byte range used for data, offsets and validity buffers.
 * <p>
 * All access is absolute (by byte offset); the position and limit of the underlying
 * {@link ByteBuffer} are never used. Whether the range lives on the heap or off-heap
 * is decided by the {@link BufferAllocator} that created it.
 * </p>
 * <p>
 * A {@link #readOnlyView() read-only view} shares the bytes of its source but rejects
 * every write with {@link java.nio.ReadOnlyBufferException}. Built columns only ever hand
 * out read-only views.
 * </p>
 */
public final class MemoryBuffer {

    private final ByteBuffer buffer;

    private MemoryBuffer(ByteBuffer buffer) {
        this.buffer = buffer;
    }

    /**
     * Wrap the given buffer. The buffer's byte order is switched to little-endian;
     * the whole capacity of the buffer becomes the length of the memory range.
     */
    public static MemoryBuffer wrap(ByteBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        ByteBuffer view = buffer.duplicate().clear();
        view.order(ByteOrder.LITTLE_ENDIAN);
        return new MemoryBuffer(view);
    }

    /**
     * Wrap a heap byte array. Writes through this buffer are visible in the array.
     */
    public static MemoryBuffer wrap(byte[] bytes) {
        return wrap(ByteBuffer.wrap(bytes));
    }

    public int length() {
        return buffer.capacity();
    }

    public boolean isReadOnly() {
        return buffer.isReadOnly();
    }

    public boolean isDirect() {
        return buffer.isDirect();
    }

    /**
     * Returns a view on the same bytes that cannot be written to.
     */
    public MemoryBuffer readOnlyView() {
        if (buffer.isReadOnly()) {
            return this;
        }
        ByteBuffer view = buffer.asReadOnlyBuffer();
        view.order(ByteOrder.LITTLE_ENDIAN);
        return new MemoryBuffer(view);
    }

    public byte getByte(int offset) {
        return buffer.get(offset);
    }

    public void putByte(int offset, byte value) {
        buffer.put(offset, value);
    }

    public short getShort(int offset) {
        return buffer.getShort(offset);
    }

    public void putShort(int offset, short value) {
        buffer.putShort(offset, value);
    }

    public int getInt(int offset) {
        return buffer.getInt(offset);
    }

    public void putInt(int offset, int value) {
        buffer.putInt(offset, value);
    }

    public long getLong(int offset) {
        return buffer.getLong(offset);
    }

    public void putLong(int offset, long value) {
        buffer.putLong(offset, value);
    }

    public float getFloat(int offset) {
        return buffer.getFloat(offset);
    }

    public void putFloat(int offset, float value) {
        buffer.putFloat(offset, value);
    }

    public double getDouble(int offset) {
        return buffer.getDouble(offset);
    }

    public void putDouble(int offset, double value) {
        buffer.putDouble(offset, value);
    }

    /**
     * Set every byte of this buffer to {@code value}.
     */
    public void fill(byte value) {
        fill(0, length(), value);
    }

    /**
     * Set {@code length} bytes starting at {@code offset} to {@code value}.
     */
    public void fill(int offset, int length, byte value) {
        Objects.checkFromIndexSize(offset, length, length());
        int end = offset + length;
        int i = offset;
        if (value == 0 || value == (byte) 0xFF) {
            long word = value == 0 ? 0L : -1L;
            for (; i + Long.BYTES <= end; i += Long.BYTES) {
                buffer.putLong(i, word);
            }
        }
        for (; i < end; i++) {
            buffer.put(i, value);
        }
    }

    /**
     * Bulk copy {@code length} bytes from {@code src} at {@code srcOffset} into this
     * buffer at {@code dstOffset}.
     */
    public void copyFrom(int dstOffset, MemoryBuffer src, int srcOffset, int length) {
        Objects.checkFromIndexSize(srcOffset, length, src.length());
        Objects.checkFromIndexSize(dstOffset, length, length());
        buffer.put(dstOffset, src.buffer, srcOffset, length);
    }

    /**
     * Bulk copy {@code length} bytes from a heap array into this buffer at {@code dstOffset}.
     */
    public void copyFrom(int dstOffset, byte[] src, int srcOffset, int length) {
        buffer.put(dstOffset, src, srcOffset, length);
    }

    /**
     * Bulk copy {@code length} bytes starting at {@code offset} into {@code dst}.
     */
    public void copyTo(int offset, byte[] dst, int dstOffset, int length) {
        buffer.get(offset, dst, dstOffset, length);
    }

    @Override
    public String toString() {
        return "MemoryBuffer[length=" + length() + (isDirect() ? ", direct" : ", heap")
                + (isReadOnly() ? ", read-only]" : "]");
    }
}
