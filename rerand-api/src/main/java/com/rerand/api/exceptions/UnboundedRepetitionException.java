/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api.exceptions;

/**
 * Thrown when uniform weighting is requested for a pattern with unbounded
 * repetition ({@code *}, {@code +}, {@code {n,}}).
 *
 * <p>Counting the matching strings of such a pattern does not terminate, so the
 * generator cannot be built in combinatorial mode. Use a fixed branch probability
 * or bound the repetition instead.
 */
public class UnboundedRepetitionException extends GeneratorException {

    private final int instruction;

    public UnboundedRepetitionException(int instruction) {
        super("counted too many repeats: cycle through instruction " + instruction
                + " (use a fixed branch probability or bound the repetition)");
        this.instruction = instruction;
    }

    /**
     * Index of the instruction where the cycle was closed.
     */
    public int getInstruction() {
        return instruction;
    }
}
