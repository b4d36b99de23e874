/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.weights;

import com.rerand.runtime.random.SharedRandom;

import java.math.BigInteger;

/**
 * Probability of following the primary successor of a branch, as an exact
 * ratio {@code numerator / denominator}.
 *
 * <p>Ratios whose denominator fits in a {@code long} use native arithmetic;
 * larger ones fall back to {@link BigInteger}.
 */
public sealed interface BranchWeight {

    /**
     * Draws a value in {@code [0, denominator)} and returns whether it is below
     * the numerator.
     */
    boolean choosePrimary(SharedRandom random);

    /** Whether the primary successor can ever be chosen. */
    boolean primaryLive();

    /** Whether the alternate successor can ever be chosen. */
    boolean alternateLive();

    record NativeRatio(long numerator, long denominator) implements BranchWeight {

        public NativeRatio {
            if (denominator <= 0 || numerator < 0 || numerator > denominator) {
                throw new IllegalArgumentException("invalid ratio " + numerator + "/" + denominator);
            }
        }

        @Override
        public boolean choosePrimary(SharedRandom random) {
            return random.nextLong(denominator) < numerator;
        }

        @Override
        public boolean primaryLive() {
            return numerator > 0;
        }

        @Override
        public boolean alternateLive() {
            return numerator < denominator;
        }

        @Override
        public String toString() {
            return numerator + "/" + denominator;
        }
    }

    record BigRatio(BigInteger numerator, BigInteger denominator) implements BranchWeight {

        public BigRatio {
            if (denominator.signum() <= 0 || numerator.signum() < 0 || numerator.compareTo(denominator) > 0) {
                throw new IllegalArgumentException("invalid ratio " + numerator + "/" + denominator);
            }
        }

        @Override
        public boolean choosePrimary(SharedRandom random) {
            return random.nextBigInteger(denominator).compareTo(numerator) < 0;
        }

        @Override
        public boolean primaryLive() {
            return numerator.signum() > 0;
        }

        @Override
        public boolean alternateLive() {
            return numerator.compareTo(denominator) < 0;
        }

        @Override
        public String toString() {
            return numerator + "/" + denominator;
        }
    }
}
