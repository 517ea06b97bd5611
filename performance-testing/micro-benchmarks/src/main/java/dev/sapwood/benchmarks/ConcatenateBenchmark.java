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
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

import dev.sapwood.column.ColumnBuilder;
import dev.sapwood.column.ColumnVector;
import dev.sapwood.column.DType;
import dev.sapwood.column.SapwoodContext;

/**
 * Benchmark for combining columns: builder bulk append versus concatenation, the latter
 * with and without parallel data copies.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class ConcatenateBenchmark {

    @Param({"8", "64"})
    private int columnCount;

    @Param({"10000", "1000000"})
    private int rowsPerColumn;

    // 1 in N rows is null; 0 means no nulls
    @Param({"0", "10"})
    private int nullEvery;

    private ColumnVector[] columns;
    private SapwoodContext context;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        columns = new ColumnVector[columnCount];
        for (int c = 0; c < columnCount; c++) {
            // odd lengths so that every column after the first starts at an unaligned bit
            int rows = rowsPerColumn + (c % 2);
            ColumnBuilder builder = ColumnVector.builder(DType.INT64, rows);
            for (int i = 0; i < rows; i++) {
                if (nullEvery > 0 && random.nextInt(nullEvery) == 0) {
                    builder.appendNull();
                }
                else {
                    builder.append(random.nextLong());
                }
            }
            columns[c] = builder.build();
        }
        context = SapwoodContext.create();
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        context.close();
    }

    @Benchmark
    public ColumnVector concatenate() {
        return ColumnVector.concatenate(columns);
    }

    @Benchmark
    public ColumnVector concatenateParallel() {
        return ColumnVector.concatenate(context, columns);
    }

    @Benchmark
    public ColumnVector builderAppend() {
        int total = 0;
        for (ColumnVector column : columns) {
            total += column.getRowCount();
        }
        ColumnBuilder builder = ColumnVector.builder(DType.INT64, total);
        for (ColumnVector column : columns) {
            builder.append(column);
        }
        return builder.build();
    }
}
