/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.weights;

import com.rerand.api.exceptions.UnboundedRepetitionException;
import com.rerand.runtime.counting.PathCount;
import com.rerand.runtime.counting.PathCounter;
import com.rerand.runtime.model.Instruction;
import com.rerand.runtime.model.Opcode;
import com.rerand.runtime.model.Program;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.BitSet;
import java.util.logging.Logger;

/**
 * Assigns a {@link BranchWeight} to every branch reachable from the start of a
 * program. The returned array is indexed by instruction; non-branches hold null.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li><b>Combinatorial</b>: the primary side gets weight
 *       {@code count(primary) / (count(primary) + count(alternate))}, reduced by
 *       the gcd, so every string of the language is equally likely. Programs with
 *       cycles are rejected.</li>
 *   <li><b>Fixed</b>: every branch takes its primary successor with the same
 *       probability, which makes unbounded repetition usable.</li>
 * </ul>
 */
public final class WeightCompiler {
    private static final Logger logger = Logger.getLogger(WeightCompiler.class.getName());

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private WeightCompiler() {
    }

    /**
     * Weights proportional to the number of strings reachable through each side.
     *
     * @throws UnboundedRepetitionException if the program contains a reachable cycle
     */
    public static BranchWeight[] combinatorial(Program program, boolean distinctCodePoints) {
        PathCounter counter = new PathCounter(program, distinctCodePoints);
        BigInteger total = counted(counter.count(program.start()));

        BranchWeight[] weights = new BranchWeight[program.size()];
        for (int i : reachableBranches(program)) {
            Instruction branch = program.instruction(i);
            BigInteger primary = counted(counter.count(branch.next()));
            BigInteger alternate = counted(counter.count(branch.alternate()));
            weights[i] = ratio(primary, primary.add(alternate));
        }
        logger.fine(() -> "Pattern matches " + total + " distinct strings");
        return weights;
    }

    /**
     * The numerator of {@code probability} over {@link Long#MAX_VALUE}, rounded half up.
     *
     * <p>Both sides of a fixed-mode branch must stay live. A lazy loop exits through
     * its primary successor and a greedy one through its alternate, so a ratio of
     * {@code 0} or {@code 1} would keep such a loop running forever.
     *
     * @throws IllegalArgumentException if {@code probability} is outside {@code (0, 1)}
     *         or rounds to {@code 0} or {@code Long.MAX_VALUE}
     */
    public static long fixedNumerator(double probability) {
        if (!(probability > 0.0 && probability < 1.0)) {
            throw new IllegalArgumentException("branch probability must be in (0, 1): " + probability);
        }
        long numerator = new BigDecimal(probability)
                .multiply(BigDecimal.valueOf(Long.MAX_VALUE))
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        if (numerator == 0 || numerator == Long.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "branch probability " + probability + " is too close to 0 or 1 to represent over Long.MAX_VALUE");
        }
        return numerator;
    }

    /**
     * Every reachable branch takes its primary successor with {@code probability}.
     *
     * @param probability in {@code (0, 1)} and representable over {@link Long#MAX_VALUE},
     *                    see {@link #fixedNumerator(double)}
     */
    public static BranchWeight[] fixed(Program program, double probability) {
        BranchWeight weight = new BranchWeight.NativeRatio(fixedNumerator(probability), Long.MAX_VALUE);

        BranchWeight[] weights = new BranchWeight[program.size()];
        for (int i : reachableBranches(program)) {
            weights[i] = weight;
        }
        return weights;
    }

    /**
     * The ratio {@code x / y} in lowest terms; {@code 0/1} when {@code y} is zero.
     */
    static BranchWeight ratio(BigInteger x, BigInteger y) {
        if (y.signum() == 0) {
            return new BranchWeight.NativeRatio(0, 1);
        }
        BigInteger gcd = x.gcd(y);
        BigInteger numerator = x.divide(gcd);
        BigInteger denominator = y.divide(gcd);
        if (denominator.compareTo(LONG_MAX) <= 0) {
            return new BranchWeight.NativeRatio(numerator.longValue(), denominator.longValue());
        }
        return new BranchWeight.BigRatio(numerator, denominator);
    }

    private static BigInteger counted(PathCount count) {
        if (count instanceof PathCount.CycleDetected cycle) {
            throw new UnboundedRepetitionException(cycle.instruction());
        }
        return ((PathCount.Counted) count).value();
    }

    private static IntArrayList reachableBranches(Program program) {
        IntArrayList branches = new IntArrayList();
        BitSet seen = new BitSet(program.size());
        IntArrayList stack = new IntArrayList();
        stack.push(program.start());
        seen.set(program.start());
        while (!stack.isEmpty()) {
            int i = stack.popInt();
            Instruction instruction = program.instruction(i);
            if (!instruction.hasNext()) {
                continue;
            }
            visit(instruction.next(), seen, stack);
            if (instruction.opcode() == Opcode.BRANCH) {
                branches.add(i);
                visit(instruction.alternate(), seen, stack);
            }
        }
        return branches;
    }

    private static void visit(int target, BitSet seen, IntArrayList stack) {
        if (!seen.get(target)) {
            seen.set(target);
            stack.push(target);
        }
    }
}
