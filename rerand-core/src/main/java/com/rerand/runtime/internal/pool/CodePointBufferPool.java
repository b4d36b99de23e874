/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.internal.pool;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Object pool for the code point buffers that {@code generate()} fills.
 *
 * <p>Each thread keeps a small stack of buffers; a shared queue takes the
 * overflow. A buffer belongs to exactly one caller between {@link #acquire()}
 * and {@link #release(IntArrayList)}.
 *
 * USAGE:
 * <pre>
 * IntArrayList buffer = pool.acquire();
 * try {
 *     buffer.add(codePoint);
 *     return new String(buffer.elements(), 0, buffer.size());
 * } finally {
 *     pool.release(buffer);
 * }
 * </pre>
 */
public class CodePointBufferPool {

    private static final int INITIAL_CAPACITY = 64;

    // Larger buffers are shrunk before they go back
    private static final int MAX_RETAINED_CAPACITY = 4096;

    private final ThreadLocal<LocalStack> local = ThreadLocal.withInitial(LocalStack::new);
    private final BlockingQueue<IntArrayList> overflow = new ArrayBlockingQueue<>(64);

    private final AtomicLong totalAcquires = new AtomicLong();
    private final AtomicLong allocations = new AtomicLong();

    public static CodePointBufferPool create() {
        return new CodePointBufferPool();
    }

    /**
     * Borrow an empty buffer.
     */
    public IntArrayList acquire() {
        totalAcquires.incrementAndGet();

        IntArrayList buffer = local.get().pop();
        if (buffer == null) {
            buffer = overflow.poll();
        }
        if (buffer == null) {
            allocations.incrementAndGet();
            return new IntArrayList(INITIAL_CAPACITY);
        }
        return buffer;
    }

    /**
     * Return a buffer. Its contents are discarded.
     */
    public void release(IntArrayList buffer) {
        if (buffer == null) return;

        buffer.clear();
        buffer.trim(MAX_RETAINED_CAPACITY);
        if (!local.get().push(buffer)) {
            overflow.offer(buffer);
        }
    }

    /**
     * Get reuse rate (1.0 = 100% reuse, 0.0 = no reuse).
     */
    public double getReuseRate() {
        long acquires = totalAcquires.get();
        long allocs = allocations.get();
        return acquires > 0 ? 1.0 - ((double) allocs / acquires) : 0.0;
    }

    public long getAllocations() {
        return allocations.get();
    }

    private static final class LocalStack {
        private static final int MAX_SIZE = 8;

        private final IntArrayList[] buffers = new IntArrayList[MAX_SIZE];
        private int size = 0;

        IntArrayList pop() {
            if (size > 0) {
                IntArrayList buffer = buffers[--size];
                buffers[size] = null;
                return buffer;
            }
            return null;
        }

        boolean push(IntArrayList buffer) {
            if (size < buffers.length) {
                buffers[size++] = buffer;
                return true;
            }
            return false;
        }
    }
}
