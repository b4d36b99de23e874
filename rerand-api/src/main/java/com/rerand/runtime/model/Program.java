/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A compiled pattern: an immutable, index-addressed graph of {@link Instruction}s
 * and the index where execution starts.
 *
 * <p>Under normal patterns the graph is acyclic. Cycles appear only through
 * {@link Opcode#BRANCH} nodes that represent unbounded repetition.
 */
public final class Program {

    private final List<Instruction> instructions;
    private final int start;

    private Program(List<Instruction> instructions, int start) {
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.start = start;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instruction instruction(int index) {
        return instructions.get(index);
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    public int start() {
        return start;
    }

    /**
     * Number of instructions with the given opcode.
     */
    public int count(Opcode opcode) {
        int n = 0;
        for (Instruction instruction : instructions) {
            if (instruction.opcode() == opcode) {
                n++;
            }
        }
        return n;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < instructions.size(); i++) {
            sb.append(i == start ? String.format("%3d*\t", i) : String.format("%3d\t", i))
                    .append(instructions.get(i))
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * Mutable assembly area for a {@link Program}.
     */
    public static final class Builder {
        private final List<Instruction> instructions = new ArrayList<>();
        private int start = Instruction.NONE;

        private Builder() {
        }

        /**
         * Appends an instruction and returns its index.
         */
        public int add(Instruction instruction) {
            instructions.add(instruction);
            return instructions.size() - 1;
        }

        /**
         * Re-targets the {@code next} (primary) successor of an already added
         * instruction. Used to close repetition loops.
         */
        public Builder patchNext(int index, int next) {
            instructions.set(index, instructions.get(index).withNext(next));
            return this;
        }

        /**
         * Re-targets the {@code alternate} successor of an already added branch.
         */
        public Builder patchAlternate(int index, int alternate) {
            instructions.set(index, instructions.get(index).withAlternate(alternate));
            return this;
        }

        public Builder start(int start) {
            this.start = start;
            return this;
        }

        public int size() {
            return instructions.size();
        }

        public Program build() {
            int size = instructions.size();
            if (start < 0 || start >= size) {
                throw new IllegalArgumentException("start index " + start + " outside program of size " + size);
            }
            for (int i = 0; i < size; i++) {
                Instruction instruction = instructions.get(i);
                if (instruction.hasNext()) {
                    checkTarget(i, instruction.next(), size);
                }
                if (instruction.opcode() == Opcode.BRANCH) {
                    checkTarget(i, instruction.alternate(), size);
                }
            }
            return new Program(instructions, start);
        }

        private static void checkTarget(int from, int target, int size) {
            if (target < 0 || target >= size) {
                throw new IllegalArgumentException(
                        "instruction " + from + " points to " + target + " outside program of size " + size);
            }
        }
    }
}
