/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.generation;

import com.rerand.api.IStringGenerator;
import com.rerand.runtime.internal.pool.CodePointBufferPool;
import com.rerand.runtime.model.Instruction;
import com.rerand.runtime.model.Opcode;
import com.rerand.runtime.model.Program;
import com.rerand.runtime.random.SharedRandom;
import com.rerand.runtime.sampling.AliasSampler;
import com.rerand.runtime.weights.BranchWeight;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Produces random strings matching a pattern by walking its compiled program.
 *
 * <p>Branches follow their {@link BranchWeight}; character classes and the
 * any-character opcodes draw from an {@link AliasSampler}. Instances are
 * immutable apart from the shared random source and may be used from many
 * threads at once.
 *
 * <p>Built by {@link GeneratorCompiler}, which verifies that no dead end or
 * passthrough instruction is reachable.
 */
public final class RegexGenerator implements IStringGenerator {

    private final String pattern;
    private final Program program;
    private final Instruction[] code;
    private final BranchWeight[] weights;
    private final AliasSampler[] samplers;
    private final SharedRandom random;
    private final CodePointBufferPool bufferPool;

    RegexGenerator(String pattern,
                   Program program,
                   BranchWeight[] weights,
                   AliasSampler[] samplers,
                   SharedRandom random,
                   CodePointBufferPool bufferPool) {
        this.pattern = pattern;
        this.program = program;
        this.code = program.instructions().toArray(new Instruction[0]);
        this.weights = weights;
        this.samplers = samplers;
        this.random = random;
        this.bufferPool = bufferPool;
    }

    @Override
    public String generate() {
        IntArrayList buffer = bufferPool.acquire();
        try {
            int pc = program.start();
            while (true) {
                Instruction instruction = code[pc];
                switch (instruction.opcode()) {
                    case LITERAL -> {
                        buffer.add(instruction.literal());
                        pc = instruction.next();
                    }
                    case CHAR_CLASS, ANY, ANY_NOT_NEWLINE -> {
                        buffer.add(samplers[pc].sample());
                        pc = instruction.next();
                    }
                    case BRANCH -> pc = weights[pc].choosePrimary(random)
                            ? instruction.next()
                            : instruction.alternate();
                    case GROUP -> pc = instruction.next();
                    case ACCEPT -> {
                        return new String(buffer.elements(), 0, buffer.size());
                    }
                    default -> throw malformed(pc, instruction.opcode());
                }
            }
        } finally {
            bufferPool.release(buffer);
        }
    }

    private IllegalStateException malformed(int pc, Opcode opcode) {
        return new IllegalStateException(
                "malformed program for pattern '" + pattern + "': reached " + opcode + " at instruction " + pc);
    }

    @Override
    public String pattern() {
        return pattern;
    }

    public Program program() {
        return program;
    }

    CodePointBufferPool bufferPool() {
        return bufferPool;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
