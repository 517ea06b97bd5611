/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.benchmarks;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import dev.sapwood.internal.validity.BitCopier;
import dev.sapwood.internal.validity.ValidityBitmap;
import dev.sapwood.memory.BufferAllocator;
import dev.sapwood.memory.MemoryBuffer;

/**
 * Benchmark for validity bit copies, comparing the byte-aligned path against the
 * shifted path taken when source and destination offsets differ modulo 8.
 *
 * <p>Run with:</p>
 * <pre>
 * java -jar benchmarks.jar BitCopierBenchmark
 * </pre>
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class BitCopierBenchmark {

    @Param({"1024", "65536", "1048576"})
    private int bits;

    @Param({"0", "3"})
    private int dstOffset;

    @Param({"heap", "direct"})
    private String allocator;

    private MemoryBuffer src;
    private MemoryBuffer dst;

    @Setup
    public void setup() {
        BufferAllocator alloc = "direct".equals(allocator) ? BufferAllocator.direct() : BufferAllocator.heap();
        src = alloc.allocate(ValidityBitmap.allocationSizeInBytes(bits));
        dst = ValidityBitmap.allocate(alloc, bits + 8);

        // ~10% nulls
        Random random = new Random(42);
        src.fill((byte) 0xFF);
        for (int i = 0; i < bits; i++) {
            if (random.nextInt(10) == 0) {
                ValidityBitmap.setNull(src, i);
            }
        }
    }

    @Benchmark
    public int copy() {
        return BitCopier.copy(src, 0, dst, dstOffset, bits);
    }

    @Benchmark
    public int countZeroBits() {
        return ValidityBitmap.countZeroBits(src, bits);
    }
}
