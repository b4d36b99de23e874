/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.counting;

import com.rerand.runtime.model.Alphabet;
import com.rerand.runtime.model.Instruction;
import com.rerand.runtime.model.Opcode;
import com.rerand.runtime.model.Program;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.math.BigInteger;

/**
 * Counts the distinct paths from an instruction to {@link Opcode#ACCEPT}.
 *
 * <p>Counting is a memoized depth-first walk over the program. It runs on an
 * explicit work stack so that long unrolled repetitions cannot overflow the
 * call stack. Each slot is unvisited, in progress or done; meeting an
 * in-progress slot again means the program has a cycle, which is reported as a
 * {@link PathCount.CycleDetected} value.
 *
 * <p>In distinct mode a character class contributes its width (every code point
 * is its own string); otherwise each class counts once. The memo is kept across
 * calls on the same instance. Not thread-safe.
 */
public final class PathCounter {

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    private final Instruction[] code;
    private final boolean distinctCodePoints;
    private final byte[] state;
    private final BigInteger[] memo;

    public PathCounter(Program program, boolean distinctCodePoints) {
        this.code = program.instructions().toArray(new Instruction[0]);
        this.distinctCodePoints = distinctCodePoints;
        this.state = new byte[code.length];
        this.memo = new BigInteger[code.length];
    }

    /**
     * Number of accepting paths starting at {@code node}.
     */
    public PathCount count(int node) {
        if (state[node] == DONE) {
            return new PathCount.Counted(memo[node]);
        }

        IntArrayList stack = new IntArrayList();
        stack.push(node);
        while (!stack.isEmpty()) {
            int top = stack.topInt();
            switch (state[top]) {
                case DONE -> stack.popInt();
                case IN_PROGRESS -> {
                    memo[top] = evaluate(code[top]);
                    state[top] = DONE;
                    stack.popInt();
                }
                default -> {
                    state[top] = IN_PROGRESS;
                    int cycle = pushSuccessors(code[top], stack);
                    if (cycle != Instruction.NONE) {
                        abandon();
                        return new PathCount.CycleDetected(cycle);
                    }
                }
            }
        }
        return new PathCount.Counted(memo[node]);
    }

    /**
     * Pushes unvisited successors. Returns the successor closing a cycle, or
     * {@link Instruction#NONE}.
     */
    private int pushSuccessors(Instruction instruction, IntArrayList stack) {
        if (!instruction.hasNext()) {
            return Instruction.NONE;
        }
        int next = instruction.next();
        if (state[next] == IN_PROGRESS) {
            return next;
        }
        if (instruction.opcode() == Opcode.BRANCH) {
            int alternate = instruction.alternate();
            if (state[alternate] == IN_PROGRESS) {
                return alternate;
            }
            if (state[alternate] == UNVISITED) {
                stack.push(alternate);
            }
        }
        if (state[next] == UNVISITED) {
            stack.push(next);
        }
        return Instruction.NONE;
    }

    private BigInteger evaluate(Instruction instruction) {
        return switch (instruction.opcode()) {
            case DEAD_END -> BigInteger.ZERO;
            case ACCEPT -> BigInteger.ONE;
            case PASSTHROUGH, GROUP, LITERAL -> memo[instruction.next()];
            case CHAR_CLASS -> scale(instruction.next(), Alphabet.totalWidth(instruction.ranges()));
            case ANY -> scale(instruction.next(), Alphabet.ANY_SIZE);
            case ANY_NOT_NEWLINE -> scale(instruction.next(), Alphabet.ANY_NOT_NEWLINE_SIZE);
            case BRANCH -> memo[instruction.next()].add(memo[instruction.alternate()]);
        };
    }

    private BigInteger scale(int next, long width) {
        BigInteger rest = memo[next];
        return distinctCodePoints ? rest.multiply(BigInteger.valueOf(width)) : rest;
    }

    // nodes left in progress by an aborted walk must not look like cycles later
    private void abandon() {
        for (int i = 0; i < state.length; i++) {
            if (state[i] == IN_PROGRESS) {
                state[i] = UNVISITED;
            }
        }
    }
}
