/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.model;

/**
 * Inclusive range of Unicode code points.
 */
public record CodePointRange(int low, int high) {

    public CodePointRange {
        if (low < 0 || high > Character.MAX_CODE_POINT || low > high) {
            throw new IllegalArgumentException(
                    String.format("invalid code point range [%#x, %#x]", low, high));
        }
    }

    public static CodePointRange of(int codePoint) {
        return new CodePointRange(codePoint, codePoint);
    }

    /**
     * Number of code points in this range.
     */
    public int width() {
        return high - low + 1;
    }

    public boolean contains(int codePoint) {
        return codePoint >= low && codePoint <= high;
    }

    @Override
    public String toString() {
        return low == high
                ? String.format("%#x", low)
                : String.format("%#x-%#x", low, high);
    }
}
