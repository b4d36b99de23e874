/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.generation;

import com.rerand.api.exceptions.UnsatisfiablePatternException;
import com.rerand.runtime.model.Instruction;
import com.rerand.runtime.model.Program;
import com.rerand.runtime.weights.BranchWeight;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.BitSet;

/**
 * Checks that a weighted program can only reach instructions the generator
 * knows how to execute.
 *
 * <p>The walk follows live edges only: the primary side of a branch whose
 * weight can choose it, and likewise the alternate side. Reaching a passthrough
 * means the program is malformed; reaching the dead end means the pattern, or a
 * branch the walk may take, matches nothing.
 */
final class ProgramVerifier {

    private ProgramVerifier() {
    }

    /**
     * @return the number of reachable instructions
     * @throws IllegalStateException         if a passthrough or unweighted branch is reachable
     * @throws UnsatisfiablePatternException if the dead end is reachable
     */
    static int verify(String pattern, Program program, BranchWeight[] weights) {
        BitSet seen = new BitSet(program.size());
        IntArrayList stack = new IntArrayList();
        stack.push(program.start());
        seen.set(program.start());

        while (!stack.isEmpty()) {
            int i = stack.popInt();
            Instruction instruction = program.instruction(i);
            switch (instruction.opcode()) {
                case DEAD_END -> throw new UnsatisfiablePatternException(
                        "pattern '" + pattern + "' matches no string along a reachable path");
                case PASSTHROUGH -> throw new IllegalStateException(
                        "passthrough instruction " + i + " is reachable in program for '" + pattern + "'");
                case ACCEPT -> {
                }
                case BRANCH -> {
                    BranchWeight weight = weights[i];
                    if (weight == null) {
                        throw new IllegalStateException("branch " + i + " has no weight");
                    }
                    if (weight.primaryLive()) {
                        visit(instruction.next(), seen, stack);
                    }
                    if (weight.alternateLive()) {
                        visit(instruction.alternate(), seen, stack);
                    }
                }
                default -> visit(instruction.next(), seen, stack);
            }
        }
        return seen.cardinality();
    }

    private static void visit(int target, BitSet seen, IntArrayList stack) {
        if (!seen.get(target)) {
            seen.set(target);
            stack.push(target);
        }
    }
}
