/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api.exceptions;

/**
 * Thrown when pattern text cannot be parsed or compiled into a program.
 */
public class PatternCompileException extends GeneratorException {

    private final String pattern;
    private final int offset;

    public PatternCompileException(String pattern, int offset, String reason) {
        super(reason + " at offset " + offset + " in pattern '" + pattern + "'");
        this.pattern = pattern;
        this.offset = offset;
    }

    /**
     * The pattern text that failed to compile.
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * Char offset in the pattern where the error was detected.
     */
    public int getOffset() {
        return offset;
    }
}
