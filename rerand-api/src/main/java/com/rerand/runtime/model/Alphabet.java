/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.model;

import java.util.List;

/**
 * The alphabet used for "any character".
 *
 * <p>Covers {@code 0..0xEFFFF}, which leaves out the supplementary private use
 * planes, and excludes the surrogate block {@code 0xD800..0xDFFF} so that every
 * generated string is well-formed UTF-16. Negated character classes are
 * complemented within the same alphabet.
 */
public final class Alphabet {

    /** Highest code point ever generated. */
    public static final int MAX_CODE_POINT = 0xEFFFF;

    public static final List<CodePointRange> ANY = List.of(
            new CodePointRange(0, Character.MIN_SURROGATE - 1),
            new CodePointRange(Character.MAX_SURROGATE + 1, MAX_CODE_POINT));

    public static final List<CodePointRange> ANY_NOT_NEWLINE = List.of(
            new CodePointRange(0, '\n' - 1),
            new CodePointRange('\n' + 1, Character.MIN_SURROGATE - 1),
            new CodePointRange(Character.MAX_SURROGATE + 1, MAX_CODE_POINT));

    public static final long ANY_SIZE = totalWidth(ANY);

    public static final long ANY_NOT_NEWLINE_SIZE = ANY_SIZE - 1;

    private Alphabet() {
    }

    /**
     * Sum of the widths of the given ranges.
     */
    public static long totalWidth(List<CodePointRange> ranges) {
        long sum = 0;
        for (CodePointRange range : ranges) {
            sum += range.width();
        }
        return sum;
    }
}
