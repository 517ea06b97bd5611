/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.column;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import dev.sapwood.memory.BufferAllocator;

/**
 * Context object that manages shared resources for column operations.
 * <p>
 * Holds the buffer allocator and the thread pool on which buffer copies of
 * {@link ColumnVector#concatenate(SapwoodContext, ColumnVector...)} are issued.
 * Parallel copies can be disabled with the {@value #PARALLEL_COPY_PROPERTY} system
 * property, in which case every copy runs on the calling thread.
 * </p>
 */
public final class SapwoodContext implements AutoCloseable {

    public static final String PARALLEL_COPY_PROPERTY = "sapwood.parallelcopy";

    public static final String THREADS_PROPERTY = "sapwood.threads";

    private static final System.Logger LOG = System.getLogger(SapwoodContext.class.getName());

    private final ExecutorService executor;
    private final BufferAllocator allocator;

    private SapwoodContext(ExecutorService executor, BufferAllocator allocator) {
        this.executor = executor;
        this.allocator = allocator;
    }

    /**
     * Create a new context on the heap allocator, with a thread pool sized by the
     * {@value #THREADS_PROPERTY} system property or the number of available processors.
     */
    public static SapwoodContext create() {
        return create(threadsFromProperty());
    }

    /**
     * Create a new context on the heap allocator with a thread pool of the specified size.
     */
    public static SapwoodContext create(int threads) {
        return create(threads, BufferAllocator.heap());
    }

    public static SapwoodContext create(int threads, BufferAllocator allocator) {
        Objects.requireNonNull(allocator, "allocator");
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        ExecutorService executor = null;
        if (parallelCopyEnabled()) {
            AtomicInteger threadCounter = new AtomicInteger(0);
            ThreadFactory threadFactory = r -> {
                Thread t = new Thread(r, "sapwood-" + threadCounter.getAndIncrement());
                t.setDaemon(true);
                return t;
            };
            executor = Executors.newFixedThreadPool(threads, threadFactory);
            LOG.log(System.Logger.Level.DEBUG, "Parallel buffer copies enabled with {0} threads", threads);
        }
        else {
            LOG.log(System.Logger.Level.DEBUG, "Parallel buffer copies disabled via system property");
        }
        return new SapwoodContext(executor, allocator);
    }

    private static boolean parallelCopyEnabled() {
        return !"false".equalsIgnoreCase(System.getProperty(PARALLEL_COPY_PROPERTY));
    }

    private static int threadsFromProperty() {
        String value = System.getProperty(THREADS_PROPERTY);
        if (value == null || value.isBlank()) {
            return Runtime.getRuntime().availableProcessors();
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + THREADS_PROPERTY + ": " + value, e);
        }
    }

    public BufferAllocator allocator() {
        return allocator;
    }

    /**
     * Get the executor for buffer copies; runs tasks on the calling thread if parallel
     * copies are disabled.
     */
    public Executor executor() {
        return executor != null ? executor : Runnable::run;
    }

    public boolean isParallel() {
        return executor != null;
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
