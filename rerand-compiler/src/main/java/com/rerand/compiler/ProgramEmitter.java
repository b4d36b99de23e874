/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.compiler;

import com.rerand.api.exceptions.PatternCompileException;
import com.rerand.compiler.parser.RegexNode;
import com.rerand.runtime.model.Instruction;
import com.rerand.runtime.model.Program;

import java.util.List;

/**
 * Turns a {@link RegexNode} tree into a {@link Program} (Thompson construction).
 *
 * <p>Emission is continuation-passing: every node is compiled with the index of
 * the instruction that follows it, so empty constructs simply return their
 * continuation and no passthrough instruction is ever needed.
 *
 * <p>Layout: instruction 0 is the dead end, instruction 1 the accept node.
 * Bounded repetition is unrolled as {@code n} copies followed by nested optionals
 * ({@code x{1,3}} becomes {@code x(x(x)?)?}), so every distinct string has exactly
 * one path through the program.
 */
final class ProgramEmitter {

    static final int DEAD_END = 0;
    static final int ACCEPT = 1;

    /** Upper bound on emitted instructions. */
    static final int MAX_INSTRUCTIONS = 500_000;

    private final String pattern;
    private final Program.Builder builder = Program.builder();

    ProgramEmitter(String pattern) {
        this.pattern = pattern;
        builder.add(Instruction.deadEnd());
        builder.add(Instruction.accept());
    }

    Program emit(RegexNode root) {
        int start = emit(root, ACCEPT);
        return builder.start(start).build();
    }

    private int emit(RegexNode node, int next) {
        if (node instanceof RegexNode.Empty) {
            return next;
        }
        if (node instanceof RegexNode.Literal literal) {
            return add(Instruction.literal(literal.codePoint(), next));
        }
        if (node instanceof RegexNode.CharClass charClass) {
            return charClass.ranges().isEmpty()
                    ? DEAD_END
                    : add(Instruction.charClass(charClass.ranges(), next));
        }
        if (node instanceof RegexNode.AnyChar any) {
            return add(any.matchesNewline() ? Instruction.any(next) : Instruction.anyNotNewline(next));
        }
        if (node instanceof RegexNode.Concat concat) {
            List<RegexNode> items = concat.items();
            int current = next;
            for (int i = items.size() - 1; i >= 0; i--) {
                current = emit(items.get(i), current);
            }
            return current;
        }
        if (node instanceof RegexNode.Alternate alternate) {
            List<RegexNode> alternatives = alternate.alternatives();
            int current = emit(alternatives.get(alternatives.size() - 1), next);
            for (int i = alternatives.size() - 2; i >= 0; i--) {
                int first = emit(alternatives.get(i), next);
                current = add(Instruction.branch(first, current));
            }
            return current;
        }
        if (node instanceof RegexNode.Group group) {
            int exit = add(Instruction.group(2 * group.index() + 1, next));
            int body = emit(group.node(), exit);
            return add(Instruction.group(2 * group.index(), body));
        }
        if (node instanceof RegexNode.Repeat repeat) {
            if (repeat.max() == 0 || repeat.node() instanceof RegexNode.Empty) {
                return next;
            }
            return repeat.isUnbounded() ? emitUnbounded(repeat, next) : emitBounded(repeat, next);
        }
        throw new IllegalStateException("unknown node type: " + node);
    }

    private int emitUnbounded(RegexNode.Repeat repeat, int next) {
        // loop: branch between entering the body again and leaving
        int loop = add(repeat.greedy()
                ? Instruction.branch(Instruction.NONE, next)
                : Instruction.branch(next, Instruction.NONE));
        int body = emit(repeat.node(), loop);
        if (repeat.greedy()) {
            builder.patchNext(loop, body);
        } else {
            builder.patchAlternate(loop, body);
        }

        if (repeat.min() == 0) {
            return loop;
        }
        // x{n,} = x{n-1} x+, and x+ enters the body first
        int current = body;
        for (int i = 1; i < repeat.min(); i++) {
            current = emit(repeat.node(), current);
        }
        return current;
    }

    private int emitBounded(RegexNode.Repeat repeat, int next) {
        int current = next;
        for (int i = repeat.min(); i < repeat.max(); i++) {
            int body = emit(repeat.node(), current);
            current = add(repeat.greedy()
                    ? Instruction.branch(body, next)
                    : Instruction.branch(next, body));
        }
        for (int i = 0; i < repeat.min(); i++) {
            current = emit(repeat.node(), current);
        }
        return current;
    }

    private int add(Instruction instruction) {
        if (builder.size() >= MAX_INSTRUCTIONS) {
            throw new PatternCompileException(pattern, 0, "expression too large");
        }
        return builder.add(instruction);
    }
}
