/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.random;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single pseudorandom source shared by every caller of a generator.
 *
 * <p>Each draw takes the lock for that one draw only, never across a whole
 * {@code generate()} call. With a seeded {@link Random} and a single caller the
 * sequence of draws is reproducible.
 */
public final class SharedRandom {

    private final Random random;
    private final ReentrantLock lock = new ReentrantLock();

    public SharedRandom(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * A source seeded from {@link System#nanoTime()}.
     */
    public static SharedRandom timeSeeded() {
        return new SharedRandom(new Random(System.nanoTime()));
    }

    /**
     * Uniform value in {@code [0, bound)}.
     */
    public int nextInt(int bound) {
        lock.lock();
        try {
            return random.nextInt(bound);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Uniform value in {@code [0, bound)}.
     */
    public long nextLong(long bound) {
        lock.lock();
        try {
            return random.nextLong(bound);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Uniform value in {@code [0, bound)} by rejection sampling over
     * {@code bound.bitLength()} random bits.
     */
    public BigInteger nextBigInteger(BigInteger bound) {
        if (bound.signum() <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        int bits = bound.bitLength();
        lock.lock();
        try {
            BigInteger candidate;
            do {
                candidate = new BigInteger(bits, random);
            } while (candidate.compareTo(bound) >= 0);
            return candidate;
        } finally {
            lock.unlock();
        }
    }
}
