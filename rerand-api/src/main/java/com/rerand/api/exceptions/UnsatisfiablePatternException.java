/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api.exceptions;

/**
 * Thrown when a generation walk could end in a dead end, for example because
 * the pattern contains an empty character class on a path the walk may take.
 */
public class UnsatisfiablePatternException extends GeneratorException {

    public UnsatisfiablePatternException(String message) {
        super(message);
    }
}
