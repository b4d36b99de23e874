/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * A single node of a compiled pattern program.
 *
 * <p>Successors are instruction indices. For {@link Opcode#BRANCH} {@code next} is
 * the primary successor and {@code alternate} the other one. Fields that do not
 * apply to an opcode hold {@link #NONE} (or an empty range list).
 *
 * <p>Use the static factories; the canonical constructor only checks the
 * invariants shared by every opcode.
 */
public record Instruction(Opcode opcode,
                          int next,
                          int alternate,
                          int literal,
                          List<CodePointRange> ranges,
                          int groupIndex) {

    public static final int NONE = -1;

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
        if (opcode == Opcode.CHAR_CLASS && ranges.isEmpty()) {
            throw new IllegalArgumentException("CHAR_CLASS instruction requires at least one range");
        }
    }

    public static Instruction deadEnd() {
        return new Instruction(Opcode.DEAD_END, NONE, NONE, NONE, List.of(), NONE);
    }

    public static Instruction passthrough(int next) {
        return new Instruction(Opcode.PASSTHROUGH, next, NONE, NONE, List.of(), NONE);
    }

    public static Instruction charClass(List<CodePointRange> ranges, int next) {
        return new Instruction(Opcode.CHAR_CLASS, next, NONE, NONE, ranges, NONE);
    }

    public static Instruction literal(int codePoint, int next) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException(String.format("invalid code point %#x", codePoint));
        }
        return new Instruction(Opcode.LITERAL, next, NONE, codePoint, List.of(), NONE);
    }

    public static Instruction any(int next) {
        return new Instruction(Opcode.ANY, next, NONE, NONE, List.of(), NONE);
    }

    public static Instruction anyNotNewline(int next) {
        return new Instruction(Opcode.ANY_NOT_NEWLINE, next, NONE, NONE, List.of(), NONE);
    }

    public static Instruction branch(int primary, int alternate) {
        return new Instruction(Opcode.BRANCH, primary, alternate, NONE, List.of(), NONE);
    }

    public static Instruction group(int groupIndex, int next) {
        return new Instruction(Opcode.GROUP, next, NONE, NONE, List.of(), groupIndex);
    }

    public static Instruction accept() {
        return new Instruction(Opcode.ACCEPT, NONE, NONE, NONE, List.of(), NONE);
    }

    /**
     * Copy of this instruction with a different {@code next} (primary) successor.
     */
    public Instruction withNext(int newNext) {
        return new Instruction(opcode, newNext, alternate, literal, ranges, groupIndex);
    }

    /**
     * Copy of this instruction with a different {@code alternate} successor.
     */
    public Instruction withAlternate(int newAlternate) {
        return new Instruction(opcode, next, newAlternate, literal, ranges, groupIndex);
    }

    /**
     * Whether this opcode has a {@code next} successor.
     */
    public boolean hasNext() {
        return opcode != Opcode.DEAD_END && opcode != Opcode.ACCEPT;
    }

    @Override
    public String toString() {
        return switch (opcode) {
            case DEAD_END -> "dead";
            case PASSTHROUGH -> "nop -> " + next;
            case CHAR_CLASS -> "class " + ranges + " -> " + next;
            case LITERAL -> "lit '" + new String(Character.toChars(literal)) + "' -> " + next;
            case ANY -> "any -> " + next;
            case ANY_NOT_NEWLINE -> "anynotnl -> " + next;
            case BRANCH -> "branch -> " + next + ", " + alternate;
            case GROUP -> "group " + groupIndex + " -> " + next;
            case ACCEPT -> "accept";
        };
    }
}
