/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.sampling;

import com.rerand.runtime.model.Alphabet;
import com.rerand.runtime.model.CodePointRange;
import com.rerand.runtime.random.SharedRandom;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws code points uniformly from a set of disjoint ranges using Walker's
 * alias method.
 *
 * <p>Each range {@code i} gets the integer weight {@code width(i) * n}, where
 * {@code n} is the number of ranges. Against the total width {@code sum}, ranges
 * above {@code sum} are heavy and the rest light. Pairing each light range with
 * a heavy one gives every slot a threshold and an alias, so a draw is:
 * <ol>
 *   <li>pick a slot {@code i} uniformly,</li>
 *   <li>draw {@code v} in {@code [0, sum)}; keep {@code i} if {@code v} is below
 *       its threshold, otherwise take its alias,</li>
 *   <li>pick a code point uniformly inside the chosen range.</li>
 * </ol>
 * Every code point of every range is equally likely.
 *
 * <p>A class with a single code point needs no randomness and a class with a
 * single range draws inside it directly. Thread-safe.
 */
public final class AliasSampler {

    private final CodePointRange[] ranges;
    private final long[] thresholds;
    private final int[] aliases;
    private final long sum;
    private final SharedRandom random;

    /**
     * @param ranges disjoint, non-empty list of ranges
     * @param random source of randomness, or null for a time-seeded one
     */
    public AliasSampler(List<CodePointRange> ranges, Random random) {
        this(ranges, random == null ? SharedRandom.timeSeeded() : new SharedRandom(random));
    }

    /**
     * A sampler that draws from {@code random}, which other samplers and the
     * generator's branch decisions may share.
     */
    public static AliasSampler sharing(List<CodePointRange> ranges, SharedRandom random) {
        return new AliasSampler(ranges, Objects.requireNonNull(random, "random"));
    }

    private AliasSampler(List<CodePointRange> ranges, SharedRandom random) {
        if (ranges == null || ranges.isEmpty()) {
            throw new IllegalArgumentException("at least one range is required");
        }
        this.ranges = ranges.toArray(new CodePointRange[0]);
        this.random = random;
        this.sum = Alphabet.totalWidth(ranges);

        int n = this.ranges.length;
        this.thresholds = new long[n];
        this.aliases = new int[n];
        if (n > 1) {
            buildTable();
        }
    }

    private void buildTable() {
        int n = ranges.length;
        long[] weights = new long[n];
        IntArrayList light = new IntArrayList();
        IntArrayList heavy = new IntArrayList();
        for (int i = 0; i < n; i++) {
            weights[i] = ranges[i].width() * (long) n;
            aliases[i] = i;
            if (weights[i] > sum) {
                heavy.push(i);
            } else {
                light.push(i);
            }
        }

        while (!light.isEmpty() && !heavy.isEmpty()) {
            int l = light.popInt();
            int h = heavy.topInt();
            thresholds[l] = weights[l];
            aliases[l] = h;
            weights[h] -= sum - weights[l];
            if (weights[h] <= sum) {
                heavy.popInt();
                light.push(h);
            }
        }
        // whatever is left is exactly full
        while (!light.isEmpty()) {
            thresholds[light.popInt()] = sum;
        }
        while (!heavy.isEmpty()) {
            thresholds[heavy.popInt()] = sum;
        }
    }

    /**
     * Draws one code point.
     */
    public int sample() {
        if (sum == 1) {
            return ranges[0].low();
        }
        CodePointRange range;
        if (ranges.length == 1) {
            range = ranges[0];
        } else {
            int i = random.nextInt(ranges.length);
            long v = random.nextLong(sum);
            range = ranges[v < thresholds[i] ? i : aliases[i]];
        }
        return range.low() + random.nextInt(range.width());
    }

    /** Total number of code points covered. */
    public long size() {
        return sum;
    }

    long[] thresholds() {
        return thresholds.clone();
    }

    int[] aliases() {
        return aliases.clone();
    }
}
