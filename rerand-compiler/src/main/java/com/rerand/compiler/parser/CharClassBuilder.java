/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.compiler.parser;

import com.rerand.runtime.model.Alphabet;
import com.rerand.runtime.model.CodePointRange;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Accumulates code point ranges for a character class and produces the
 * normalized form: sorted, non-overlapping, non-adjacent ranges.
 *
 * Ranges are stored as flat (low, high) pairs.
 */
final class CharClassBuilder {

    // Case variants are only expanded for ranges up to this width.
    private static final int MAX_FOLD_WIDTH = 0x3000;

    private final IntArrayList bounds = new IntArrayList();

    CharClassBuilder addRange(int low, int high) {
        bounds.add(low);
        bounds.add(high);
        return this;
    }

    CharClassBuilder add(int codePoint) {
        return addRange(codePoint, codePoint);
    }

    CharClassBuilder addAll(List<CodePointRange> ranges) {
        for (CodePointRange range : ranges) {
            addRange(range.low(), range.high());
        }
        return this;
    }

    /**
     * Adds the complement of the given ranges within {@link Alphabet#ANY}.
     */
    CharClassBuilder addNegated(List<CodePointRange> ranges) {
        return addAll(complement(normalize(new CharClassBuilder().addAll(ranges).bounds)));
    }

    /**
     * Adds the simple case variants of every code point collected so far.
     */
    CharClassBuilder foldCase() {
        int pairs = bounds.size() / 2;
        for (int i = 0; i < pairs; i++) {
            int low = bounds.getInt(2 * i);
            int high = bounds.getInt(2 * i + 1);
            if (high - low >= MAX_FOLD_WIDTH) {
                continue;
            }
            for (int cp = low; cp <= high; cp++) {
                addVariants(cp);
            }
        }
        return this;
    }

    private void addVariants(int cp) {
        int lower = Character.toLowerCase(cp);
        int upper = Character.toUpperCase(cp);
        int title = Character.toTitleCase(cp);
        if (lower != cp) {
            add(lower);
        }
        if (upper != cp) {
            add(upper);
        }
        if (title != cp && title != upper) {
            add(title);
        }
    }

    /**
     * Normalized ranges. An empty list means the class matches nothing.
     */
    List<CodePointRange> build() {
        return normalize(bounds);
    }

    /**
     * Simple case variants of a single code point, including itself.
     */
    static List<CodePointRange> caseVariants(int codePoint) {
        return new CharClassBuilder().add(codePoint).foldCase().build();
    }

    private static List<CodePointRange> normalize(IntArrayList bounds) {
        int pairs = bounds.size() / 2;
        long[] packed = new long[pairs];
        for (int i = 0; i < pairs; i++) {
            packed[i] = ((long) bounds.getInt(2 * i) << 32) | bounds.getInt(2 * i + 1);
        }
        Arrays.sort(packed);

        List<CodePointRange> result = new ArrayList<>();
        int curLow = -1;
        int curHigh = -2;
        for (long p : packed) {
            int low = (int) (p >>> 32);
            int high = (int) p;
            if (low <= curHigh + 1) {
                curHigh = Math.max(curHigh, high);
                continue;
            }
            if (curLow >= 0) {
                result.add(new CodePointRange(curLow, curHigh));
            }
            curLow = low;
            curHigh = high;
        }
        if (curLow >= 0) {
            result.add(new CodePointRange(curLow, curHigh));
        }
        return result;
    }

    private static List<CodePointRange> complement(List<CodePointRange> sorted) {
        List<CodePointRange> result = new ArrayList<>();
        for (CodePointRange allowed : Alphabet.ANY) {
            int next = allowed.low();
            for (CodePointRange range : sorted) {
                if (range.high() < next || range.low() > allowed.high()) {
                    continue;
                }
                if (range.low() > next) {
                    result.add(new CodePointRange(next, range.low() - 1));
                }
                next = range.high() + 1;
            }
            if (next <= allowed.high()) {
                result.add(new CodePointRange(next, allowed.high()));
            }
        }
        return result;
    }
}
