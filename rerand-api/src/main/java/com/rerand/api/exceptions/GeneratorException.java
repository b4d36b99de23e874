/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api.exceptions;

/**
 * Base class for every failure raised while building a string generator.
 *
 * <p>All generator failures surface at construction time. A generator that was
 * built successfully never throws one of these from {@code generate()}.
 *
 * This is a RuntimeException so that callers building generators from constant
 * patterns are not forced into checked exception handling.
 */
public class GeneratorException extends RuntimeException {

    public GeneratorException(String message) {
        super(message);
    }

    public GeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
